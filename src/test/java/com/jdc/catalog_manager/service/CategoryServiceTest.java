package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.category.CategoryRequestDto;
import com.jdc.catalog_manager.domain.dto.category.CategoryResponseDto;
import com.jdc.catalog_manager.domain.entity.Category;
import com.jdc.catalog_manager.domain.repository.CategoryRepository;
import com.jdc.catalog_manager.domain.repository.MaterialRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.querydsl.jpa.impl.JPAQueryFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    @Mock
    private JPAQueryFactory queryFactory;

    @Mock
    private CategoryRepository repo;

    @Mock
    private MaterialRepository materialRepo;

    @InjectMocks
    private CategoryService categoryService;

    @Test
    @DisplayName("delete: a category that still has materials is CATEGORY_IN_USE")
    void delete_inUse() {
        when(repo.existsById(1L)).thenReturn(true);
        when(materialRepo.existsByCategoryId(1L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> categoryService.delete(1L));

        assertEquals(ErrorCode.CATEGORY_IN_USE, ex.getErrorCode());
        verify(repo, never()).deleteById(any());
    }

    @Test
    @DisplayName("delete: an empty category is removed")
    void delete_empty() {
        when(repo.existsById(1L)).thenReturn(true);
        when(materialRepo.existsByCategoryId(1L)).thenReturn(false);

        categoryService.delete(1L);

        verify(repo).deleteById(1L);
    }

    @Test
    @DisplayName("update: renames with surrounding whitespace removed")
    void update_renames() {
        Category category = Category.builder().id(2L).name("Stal").build();
        when(repo.findById(2L)).thenReturn(Optional.of(category));

        CategoryResponseDto updated = categoryService.update(2L, new CategoryRequestDto("  Stal zbrojeniowa "));

        assertEquals("Stal zbrojeniowa", updated.getName());
    }

    @Test
    @DisplayName("get: an unknown id is CATEGORY_NOT_FOUND")
    void get_notFound() {
        when(repo.findById(9L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> categoryService.get(9L));

        assertEquals(ErrorCode.CATEGORY_NOT_FOUND, ex.getErrorCode());
    }
}
