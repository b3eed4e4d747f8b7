package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.material.MaterialBulkRequestDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialRequestDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialResponseDto;
import com.jdc.catalog_manager.domain.entity.Category;
import com.jdc.catalog_manager.domain.entity.Material;
import com.jdc.catalog_manager.domain.repository.CategoryRepository;
import com.jdc.catalog_manager.domain.repository.MaterialRepository;
import com.jdc.catalog_manager.domain.repository.StorageItemRepository;
import com.jdc.catalog_manager.domain.type.MaterialUnit;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.querydsl.jpa.impl.JPAQueryFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MaterialServiceTest {

    @Mock
    private JPAQueryFactory queryFactory;

    @Mock
    private MaterialRepository repo;

    @Mock
    private CategoryRepository categoryRepo;

    @Mock
    private StorageItemRepository storageItemRepo;

    @InjectMocks
    private MaterialService materialService;

    private static MaterialRequestDto request(Long categoryId, String name) {
        return MaterialRequestDto.builder()
                .categoryId(categoryId)
                .name(name)
                .build();
    }

    @Test
    @DisplayName("create: applies the default unit and description")
    void create_defaults() {
        Category cement = Category.builder().id(1L).name("Cement").build();
        when(categoryRepo.findById(1L)).thenReturn(Optional.of(cement));
        when(repo.existsByName("Portland")).thenReturn(false);
        when(repo.save(any(Material.class))).thenAnswer(invocation -> invocation.getArgument(0));

        MaterialResponseDto created = materialService.create(request(1L, "  Portland "));

        assertEquals("Portland", created.getName());
        assertEquals("", created.getDescription());
        assertEquals(MaterialUnit.OTHER, created.getUnit());
        assertEquals(1L, created.getCategoryId());
    }

    @Test
    @DisplayName("create: an unknown category is CATEGORY_NOT_FOUND")
    void create_unknownCategory() {
        when(categoryRepo.findById(7L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> materialService.create(request(7L, "Piasek")));

        assertEquals(ErrorCode.CATEGORY_NOT_FOUND, ex.getErrorCode());
        verify(repo, never()).save(any());
    }

    @Test
    @DisplayName("createBulk: a name repeated inside the batch rejects the whole batch")
    void createBulk_duplicateWithinBatch() {
        MaterialBulkRequestDto dto = new MaterialBulkRequestDto(List.of(
                request(1L, "Piasek"),
                request(1L, "Żwir"),
                request(1L, "Piasek ")
        ));

        CustomException ex = assertThrows(CustomException.class, () -> materialService.createBulk(dto));

        assertEquals(ErrorCode.DUPLICATE_MATERIAL, ex.getErrorCode());
        verify(repo, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("createBulk: names already stored reject the whole batch")
    void createBulk_existingNames() {
        Category sand = Category.builder().id(1L).name("Kruszywa").build();
        Material existing = Material.builder().id(3L).category(sand).name("Żwir").build();
        when(repo.findByNameIn(anyCollection())).thenReturn(List.of(existing));

        CustomException ex = assertThrows(CustomException.class, () -> materialService.createBulk(
                new MaterialBulkRequestDto(List.of(request(1L, "Piasek"), request(1L, "Żwir")))));

        assertEquals(ErrorCode.DUPLICATE_MATERIAL, ex.getErrorCode());
        assertThat(ex.getMessage()).contains("Żwir");
        verify(repo, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("createBulk: saves every material and looks each category up once")
    void createBulk_saves() {
        Category sand = Category.builder().id(1L).name("Kruszywa").build();
        when(repo.findByNameIn(anyCollection())).thenReturn(List.of());
        when(categoryRepo.findById(1L)).thenReturn(Optional.of(sand));
        when(repo.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));

        List<MaterialResponseDto> created = materialService.createBulk(
                new MaterialBulkRequestDto(List.of(request(1L, "Piasek"), request(1L, "Żwir"))));

        assertThat(created).extracting(MaterialResponseDto::getName).containsExactly("Piasek", "Żwir");
        verify(categoryRepo, times(1)).findById(1L);
    }

    @Test
    @DisplayName("delete: a material still stocked in a storage is MATERIAL_IN_USE")
    void delete_inUse() {
        when(repo.existsById(4L)).thenReturn(true);
        when(storageItemRepo.existsByMaterialId(4L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> materialService.delete(4L));

        assertEquals(ErrorCode.MATERIAL_IN_USE, ex.getErrorCode());
        verify(repo, never()).deleteById(anyLong());
    }
}
