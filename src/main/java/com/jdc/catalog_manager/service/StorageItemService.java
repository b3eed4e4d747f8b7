package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemBulkRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemResponseDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemUpdateRequestDto;
import com.jdc.catalog_manager.domain.entity.Material;
import com.jdc.catalog_manager.domain.entity.QCategory;
import com.jdc.catalog_manager.domain.entity.QMaterial;
import com.jdc.catalog_manager.domain.entity.QStorageItem;
import com.jdc.catalog_manager.domain.entity.Storage;
import com.jdc.catalog_manager.domain.entity.StorageItem;
import com.jdc.catalog_manager.domain.repository.MaterialRepository;
import com.jdc.catalog_manager.domain.repository.StorageItemRepository;
import com.jdc.catalog_manager.domain.repository.StorageRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.mapper.StorageItemMapper;
import com.jdc.catalog_manager.util.PageSlice;
import com.jdc.catalog_manager.util.PageWindow;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Stock levels per (storage, material). Deliveries are upserts: a material already
 * stocked in the storage has the delivered quantity added to it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class StorageItemService {

    static final BigDecimal MAX_QUANTITY = new BigDecimal("9999999999.99");

    private final JPAQueryFactory queryFactory;
    private final StorageItemRepository repo;
    private final StorageRepository storageRepo;
    private final MaterialRepository materialRepo;

    private final QStorageItem storageItem = QStorageItem.storageItem;

    public StorageItemResponseDto upsert(StorageItemRequestDto dto) {
        Storage storage = getStorage(dto.getStorageId());
        return StorageItemMapper.toDto(addStock(storage, dto.getMaterialId(), dto.getQuantityValue()));
    }

    /**
     * Applies every delivery of the batch to one storage or none of them. A material
     * listed twice is added twice.
     */
    public List<StorageItemResponseDto> upsertBulk(Long storageId, StorageItemBulkRequestDto dto) {
        for (StorageItemRequestDto item : dto.getItems()) {
            if (!storageId.equals(item.getStorageId())) {
                throw new CustomException(ErrorCode.INVALID_STORAGE_ITEM_REQUEST,
                        "Storage item for storage " + item.getStorageId() + " does not belong to storage " + storageId);
            }
        }
        Storage storage = getStorage(storageId);

        List<StorageItem> touched = new ArrayList<>();
        for (StorageItemRequestDto item : dto.getItems()) {
            StorageItem stocked = addStock(storage, item.getMaterialId(), item.getQuantityValue());
            if (!touched.contains(stocked)) {
                touched.add(stocked);
            }
        }
        log.info("Storage {} restocked in bulk: deliveries={}, items={}", storageId, dto.getItems().size(), touched.size());
        return touched.stream().map(StorageItemMapper::toDto).toList();
    }

    @Transactional(readOnly = true)
    public StorageItemResponseDto get(Long storageId, Long materialId) {
        return StorageItemMapper.toDto(getEntity(storageId, materialId));
    }

    public StorageItemResponseDto update(Long storageId, Long materialId, StorageItemUpdateRequestDto dto) {
        StorageItem entity = getEntity(storageId, materialId);
        entity.changeQuantity(dto.getQuantityValue());
        return StorageItemMapper.toDto(entity);
    }

    public void delete(Long storageId, Long materialId) {
        StorageItem entity = getEntity(storageId, materialId);
        repo.delete(entity);
        log.info("Storage item deleted: storageId={}, materialId={}", storageId, materialId);
    }

    @Transactional(readOnly = true)
    public PageSlice<StorageItemResponseDto> listByStorage(Long storageId, PageWindow window) {
        if (!storageRepo.existsById(storageId)) {
            throw new CustomException(ErrorCode.STORAGE_NOT_FOUND);
        }
        return page(storageItem.storage.id.eq(storageId), window);
    }

    @Transactional(readOnly = true)
    public PageSlice<StorageItemResponseDto> listByMaterial(Long materialId, PageWindow window) {
        if (!materialRepo.existsById(materialId)) {
            throw new CustomException(ErrorCode.MATERIAL_NOT_FOUND);
        }
        return page(storageItem.material.id.eq(materialId), window);
    }

    private PageSlice<StorageItemResponseDto> page(BooleanExpression condition, PageWindow window) {
        QMaterial material = QMaterial.material;
        QCategory category = QCategory.category;

        List<StorageItem> content = queryFactory
                .selectFrom(storageItem)
                .join(storageItem.material, material).fetchJoin()
                .join(material.category, category).fetchJoin()
                .where(condition)
                .orderBy(storageItem.createdAt.desc(), storageItem.id.desc())
                .offset(window.offset())
                .limit(window.limit())
                .fetch();

        Long total = queryFactory
                .select(storageItem.count())
                .from(storageItem)
                .where(condition)
                .fetchOne();

        return new PageSlice<>(content, total != null ? total : 0L, window).map(StorageItemMapper::toDto);
    }

    private StorageItem addStock(Storage storage, Long materialId, BigDecimal quantity) {
        if (quantity == null || quantity.signum() < 0) {
            throw new CustomException(ErrorCode.INVALID_STORAGE_ITEM_REQUEST, "quantity_value must not be negative");
        }
        StorageItem existing = repo.findByStorageIdAndMaterialId(storage.getId(), materialId).orElse(null);
        if (existing != null) {
            BigDecimal total = existing.getQuantityValue().add(quantity);
            if (total.compareTo(MAX_QUANTITY) > 0) {
                throw new CustomException(ErrorCode.INVALID_STORAGE_ITEM_REQUEST,
                        "Stock of material " + materialId + " would exceed " + MAX_QUANTITY);
            }
            existing.addQuantity(quantity);
            log.debug("Stock added: storageId={}, materialId={}, +{} -> {}",
                    storage.getId(), materialId, quantity, existing.getQuantityValue());
            return existing;
        }

        Material material = getMaterial(materialId);
        try {
            return repo.saveAndFlush(StorageItemMapper.toEntity(storage, material, quantity));
        } catch (DataIntegrityViolationException e) {
            log.warn("Storage item for storage {} and material {} was inserted concurrently", storage.getId(), materialId);
            throw new CustomException(ErrorCode.STORAGE_ITEM_CONFLICT,
                    "Material " + materialId + " was stocked concurrently in storage " + storage.getId(), e);
        }
    }

    private Storage getStorage(Long storageId) {
        return storageRepo.findById(storageId)
                .orElseThrow(() -> new CustomException(ErrorCode.STORAGE_NOT_FOUND));
    }

    private Material getMaterial(Long materialId) {
        return materialRepo.findWithCategoryById(materialId)
                .orElseThrow(() -> new CustomException(ErrorCode.MATERIAL_NOT_FOUND));
    }

    private StorageItem getEntity(Long storageId, Long materialId) {
        return repo.findByStorageIdAndMaterialId(storageId, materialId)
                .orElseThrow(() -> new CustomException(ErrorCode.STORAGE_ITEM_NOT_FOUND));
    }
}
