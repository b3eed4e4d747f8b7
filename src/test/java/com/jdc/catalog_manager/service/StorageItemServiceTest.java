package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemBulkRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemResponseDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemUpdateRequestDto;
import com.jdc.catalog_manager.domain.entity.Category;
import com.jdc.catalog_manager.domain.entity.Material;
import com.jdc.catalog_manager.domain.entity.Storage;
import com.jdc.catalog_manager.domain.entity.StorageItem;
import com.jdc.catalog_manager.domain.repository.MaterialRepository;
import com.jdc.catalog_manager.domain.repository.StorageItemRepository;
import com.jdc.catalog_manager.domain.repository.StorageRepository;
import com.jdc.catalog_manager.domain.type.MaterialUnit;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.util.PageWindow;
import com.querydsl.jpa.impl.JPAQueryFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StorageItemServiceTest {

    @Mock
    private JPAQueryFactory queryFactory;

    @Mock
    private StorageItemRepository repo;

    @Mock
    private StorageRepository storageRepo;

    @Mock
    private MaterialRepository materialRepo;

    @InjectMocks
    private StorageItemService storageItemService;

    private final Storage storage = Storage.builder().id(1L).name("Magazyn A").build();
    private final Material cement = Material.builder()
            .id(5L)
            .name("Cement")
            .unit(MaterialUnit.KILOGRAMS)
            .category(Category.builder().id(2L).name("Spoiwa").build())
            .build();

    private static StorageItemRequestDto delivery(Long storageId, Long materialId, String quantity) {
        return new StorageItemRequestDto(storageId, materialId, new BigDecimal(quantity));
    }

    private StorageItem stocked(String quantity) {
        return StorageItem.builder().id(9L).storage(storage).material(cement).quantityValue(new BigDecimal(quantity)).build();
    }

    @Test
    @DisplayName("upsert: a material not yet in the storage gets a new stock row")
    void upsert_createsNewRow() {
        when(storageRepo.findById(1L)).thenReturn(Optional.of(storage));
        when(repo.findByStorageIdAndMaterialId(1L, 5L)).thenReturn(Optional.empty());
        when(materialRepo.findWithCategoryById(5L)).thenReturn(Optional.of(cement));
        when(repo.saveAndFlush(any(StorageItem.class))).thenAnswer(invocation -> invocation.getArgument(0));

        StorageItemResponseDto response = storageItemService.upsert(delivery(1L, 5L, "25.50"));

        ArgumentCaptor<StorageItem> captor = ArgumentCaptor.forClass(StorageItem.class);
        verify(repo).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getQuantityValue()).isEqualByComparingTo("25.50");
        assertEquals("Cement", response.getMaterialName());
        assertEquals("Spoiwa", response.getCategoryName());
        assertEquals(MaterialUnit.KILOGRAMS, response.getUnit());
    }

    @Test
    @DisplayName("upsert: a material already in the storage has the quantity added")
    void upsert_addsToExisting() {
        StorageItem existing = stocked("10.00");
        when(storageRepo.findById(1L)).thenReturn(Optional.of(storage));
        when(repo.findByStorageIdAndMaterialId(1L, 5L)).thenReturn(Optional.of(existing));

        StorageItemResponseDto response = storageItemService.upsert(delivery(1L, 5L, "2.25"));

        assertThat(response.getQuantityValue()).isEqualByComparingTo("12.25");
        assertThat(existing.getQuantityValue()).isEqualByComparingTo("12.25");
        verify(repo, never()).saveAndFlush(any());
        verifyNoInteractions(materialRepo);
    }

    @Test
    @DisplayName("upsert: a sum that no longer fits the column is rejected and the stock is unchanged")
    void upsert_overflow() {
        StorageItem existing = stocked("9999999999.00");
        when(storageRepo.findById(1L)).thenReturn(Optional.of(storage));
        when(repo.findByStorageIdAndMaterialId(1L, 5L)).thenReturn(Optional.of(existing));

        CustomException ex = assertThrows(CustomException.class,
                () -> storageItemService.upsert(delivery(1L, 5L, "1.00")));

        assertEquals(ErrorCode.INVALID_STORAGE_ITEM_REQUEST, ex.getErrorCode());
        assertThat(existing.getQuantityValue()).isEqualByComparingTo("9999999999.00");
    }

    @Test
    @DisplayName("upsert: an unknown storage is STORAGE_NOT_FOUND")
    void upsert_unknownStorage() {
        when(storageRepo.findById(1L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class,
                () -> storageItemService.upsert(delivery(1L, 5L, "1")));

        assertEquals(ErrorCode.STORAGE_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(repo);
    }

    @Test
    @DisplayName("upsert: an unknown material is MATERIAL_NOT_FOUND")
    void upsert_unknownMaterial() {
        when(storageRepo.findById(1L)).thenReturn(Optional.of(storage));
        when(repo.findByStorageIdAndMaterialId(1L, 5L)).thenReturn(Optional.empty());
        when(materialRepo.findWithCategoryById(5L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class,
                () -> storageItemService.upsert(delivery(1L, 5L, "1")));

        assertEquals(ErrorCode.MATERIAL_NOT_FOUND, ex.getErrorCode());
        verify(repo, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("upsert: a concurrent insert of the same pair is STORAGE_ITEM_CONFLICT")
    void upsert_concurrentInsert() {
        when(storageRepo.findById(1L)).thenReturn(Optional.of(storage));
        when(repo.findByStorageIdAndMaterialId(1L, 5L)).thenReturn(Optional.empty());
        when(materialRepo.findWithCategoryById(5L)).thenReturn(Optional.of(cement));
        when(repo.saveAndFlush(any(StorageItem.class))).thenThrow(new DataIntegrityViolationException("uk_storage_items_storage_material"));

        CustomException ex = assertThrows(CustomException.class,
                () -> storageItemService.upsert(delivery(1L, 5L, "1")));

        assertEquals(ErrorCode.STORAGE_ITEM_CONFLICT, ex.getErrorCode());
    }

    @Test
    @DisplayName("upsertBulk: an item addressed to another storage rejects the whole batch")
    void upsertBulk_storageMismatch() {
        StorageItemBulkRequestDto bulk = new StorageItemBulkRequestDto(List.of(
                delivery(1L, 5L, "1"),
                delivery(2L, 6L, "1")));

        CustomException ex = assertThrows(CustomException.class, () -> storageItemService.upsertBulk(1L, bulk));

        assertEquals(ErrorCode.INVALID_STORAGE_ITEM_REQUEST, ex.getErrorCode());
        verifyNoInteractions(repo, storageRepo, materialRepo);
    }

    @Test
    @DisplayName("update: sets the stock to the given value instead of adding")
    void update_setsQuantity() {
        StorageItem existing = stocked("10.00");
        when(repo.findByStorageIdAndMaterialId(1L, 5L)).thenReturn(Optional.of(existing));

        StorageItemResponseDto response = storageItemService.update(1L, 5L,
                new StorageItemUpdateRequestDto(new BigDecimal("3.00")));

        assertThat(response.getQuantityValue()).isEqualByComparingTo("3.00");
    }

    @Test
    @DisplayName("get/delete: a pair that is not stocked is STORAGE_ITEM_NOT_FOUND")
    void missingPair() {
        when(repo.findByStorageIdAndMaterialId(1L, 5L)).thenReturn(Optional.empty());

        assertEquals(ErrorCode.STORAGE_ITEM_NOT_FOUND,
                assertThrows(CustomException.class, () -> storageItemService.get(1L, 5L)).getErrorCode());
        assertEquals(ErrorCode.STORAGE_ITEM_NOT_FOUND,
                assertThrows(CustomException.class, () -> storageItemService.delete(1L, 5L)).getErrorCode());
        verify(repo, never()).delete(any());
    }

    @Test
    @DisplayName("listByStorage: an unknown storage is STORAGE_NOT_FOUND")
    void listByStorage_unknown() {
        when(storageRepo.existsById(7L)).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class,
                () -> storageItemService.listByStorage(7L, new PageWindow(0, 20)));

        assertEquals(ErrorCode.STORAGE_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(queryFactory);
    }
}
