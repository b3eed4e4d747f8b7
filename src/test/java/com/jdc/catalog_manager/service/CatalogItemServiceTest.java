package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.config.CatalogProperties;
import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemDetailDto;
import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemRequestDto;
import com.jdc.catalog_manager.domain.entity.CatalogItem;
import com.jdc.catalog_manager.domain.repository.CatalogItemRepository;
import com.jdc.catalog_manager.domain.repository.RecipeItemRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.util.PageSlice;
import com.jdc.catalog_manager.util.PageWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogItemServiceTest {

    @Mock
    private CatalogItemRepository catalogItemRepository;

    @Mock
    private RecipeItemRepository recipeItemRepository;

    private CatalogProperties catalogProperties;

    private CatalogItemService catalogItemService;

    @BeforeEach
    void setUp() {
        catalogProperties = new CatalogProperties();
        catalogItemService = new CatalogItemService(catalogItemRepository, recipeItemRepository, catalogProperties);
    }

    @Test
    @DisplayName("findOrCreate: an existing name is returned without inserting")
    void findOrCreate_existing() {
        CatalogItem jajka = CatalogItem.builder().id(5L).name("Jajka").build();
        when(catalogItemRepository.findByName("Jajka")).thenReturn(Optional.of(jajka));

        CatalogItem result = catalogItemService.findOrCreate("Jajka");

        assertSame(jajka, result);
        verify(catalogItemRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("findOrCreate: an unknown name is inserted verbatim and flushed")
    void findOrCreate_new() {
        when(catalogItemRepository.findByName("jajka ")).thenReturn(Optional.empty());
        when(catalogItemRepository.saveAndFlush(any(CatalogItem.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        CatalogItem result = catalogItemService.findOrCreate("jajka ");

        assertEquals("jajka ", result.getName());
        assertNull(result.getLastUsed());
    }

    @Test
    @DisplayName("create: a unique index violation becomes CATALOG_ITEM_CONFLICT")
    void create_conflict() {
        when(catalogItemRepository.saveAndFlush(any(CatalogItem.class)))
                .thenThrow(new DataIntegrityViolationException("uk_catalog_items_name"));

        CustomException ex = assertThrows(CustomException.class, () -> catalogItemService.create("Sól"));

        assertEquals(ErrorCode.CATALOG_ITEM_CONFLICT, ex.getErrorCode());
        assertInstanceOf(DataIntegrityViolationException.class, ex.getCause());
    }

    @Test
    @DisplayName("touchLastUsed: stores the given timestamp on the item")
    void touchLastUsed() {
        CatalogItem item = CatalogItem.builder().id(1L).name("Mleko").build();
        LocalDateTime now = LocalDateTime.of(2024, 5, 1, 12, 0);

        catalogItemService.touchLastUsed(item, now);

        assertEquals(now, item.getLastUsed());
    }

    @Test
    @DisplayName("createItem: an existing name is rejected with DUPLICATE_CATALOG_ITEM")
    void createItem_duplicate() {
        when(catalogItemRepository.existsByName("Jajka")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> catalogItemService.createItem(new CatalogItemRequestDto("Jajka")));

        assertEquals(ErrorCode.DUPLICATE_CATALOG_ITEM, ex.getErrorCode());
        verify(catalogItemRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("updateItem: renaming onto another item's name is rejected")
    void updateItem_duplicate() {
        CatalogItem item = CatalogItem.builder().id(3L).name("Mleko").build();
        when(catalogItemRepository.findById(3L)).thenReturn(Optional.of(item));
        when(catalogItemRepository.existsByNameAndIdNot("Jajka", 3L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> catalogItemService.updateItem(3L, new CatalogItemRequestDto("Jajka")));

        assertEquals(ErrorCode.DUPLICATE_CATALOG_ITEM, ex.getErrorCode());
        assertEquals("Mleko", item.getName());
    }

    @Test
    @DisplayName("deleteItem: an item used by a recipe cannot be deleted")
    void deleteItem_inUse() {
        when(catalogItemRepository.existsById(4L)).thenReturn(true);
        when(recipeItemRepository.existsByCatalogItemId(4L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> catalogItemService.deleteItem(4L));

        assertEquals(ErrorCode.CATALOG_ITEM_IN_USE, ex.getErrorCode());
        verify(catalogItemRepository, never()).deleteById(any());
    }

    @Test
    @DisplayName("deleteItem: an unknown id is CATALOG_ITEM_NOT_FOUND")
    void deleteItem_notFound() {
        when(catalogItemRepository.existsById(4L)).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class, () -> catalogItemService.deleteItem(4L));

        assertEquals(ErrorCode.CATALOG_ITEM_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("search: honours the configured case sensitivity")
    void search_usesConfiguredCaseSensitivity() {
        catalogProperties.getSearch().setCaseSensitive(true);
        LocalDateTime used = LocalDateTime.of(2024, 1, 1, 8, 0);
        CatalogItem jajka = CatalogItem.builder().id(5L).name("Jajka").lastUsed(used).build();
        when(catalogItemRepository.findPage("Jaj", true, 0L, 20)).thenReturn(List.of(jajka));
        when(catalogItemRepository.countByNameContains("Jaj", true)).thenReturn(1L);

        PageSlice<CatalogItemDetailDto> slice = catalogItemService.search("Jaj", new PageWindow(0, 20));

        assertEquals(1L, slice.total());
        assertThat(slice.items()).singleElement()
                .satisfies(dto -> {
                    assertEquals("Jajka", dto.getName());
                    assertEquals(used, dto.getLastUsed());
                });
    }
}
