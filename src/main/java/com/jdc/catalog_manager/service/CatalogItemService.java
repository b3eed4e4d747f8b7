package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.config.CatalogProperties;
import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemDetailDto;
import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemRequestDto;
import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemResponseDto;
import com.jdc.catalog_manager.domain.entity.CatalogItem;
import com.jdc.catalog_manager.domain.repository.CatalogItemRepository;
import com.jdc.catalog_manager.domain.repository.RecipeItemRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.mapper.CatalogItemMapper;
import com.jdc.catalog_manager.util.PageSlice;
import com.jdc.catalog_manager.util.PageWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Owns the ingredient catalog. Names are unique and matched exactly; the unique
 * index on {@code catalog_items.name} is the only arbiter between concurrent writers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class CatalogItemService {

    private final CatalogItemRepository catalogItemRepository;
    private final RecipeItemRepository recipeItemRepository;
    private final CatalogProperties catalogProperties;

    @Transactional(readOnly = true)
    public Optional<CatalogItem> findByName(String name) {
        return catalogItemRepository.findByName(name);
    }

    /**
     * Inserts a new item and flushes immediately so a lost race on the unique
     * name surfaces here as {@link ErrorCode#CATALOG_ITEM_CONFLICT}.
     */
    public CatalogItem create(String name) {
        try {
            return catalogItemRepository.saveAndFlush(CatalogItemMapper.toEntity(name));
        } catch (DataIntegrityViolationException e) {
            log.warn("Catalog item '{}' was inserted concurrently", name);
            throw new CustomException(ErrorCode.CATALOG_ITEM_CONFLICT,
                    "Catalog item '" + name + "' was created concurrently", e);
        }
    }

    public CatalogItem findOrCreate(String name) {
        return catalogItemRepository.findByName(name)
                .orElseGet(() -> create(name));
    }

    public void touchLastUsed(CatalogItem item, LocalDateTime timestamp) {
        item.touchLastUsed(timestamp);
    }

    public CatalogItemResponseDto createItem(CatalogItemRequestDto dto) {
        String name = dto.getName();
        if (catalogItemRepository.existsByName(name)) {
            throw new CustomException(ErrorCode.DUPLICATE_CATALOG_ITEM, "Catalog item '" + name + "' already exists");
        }
        CatalogItem created;
        try {
            created = create(name);
        } catch (CustomException e) {
            throw new CustomException(ErrorCode.DUPLICATE_CATALOG_ITEM, "Catalog item '" + name + "' already exists", e);
        }
        log.info("Catalog item created: id={}, name='{}'", created.getId(), created.getName());
        return CatalogItemMapper.toDto(created);
    }

    @Transactional(readOnly = true)
    public CatalogItemDetailDto getItem(Long id) {
        return CatalogItemMapper.toDetailDto(getEntity(id));
    }

    public CatalogItemDetailDto updateItem(Long id, CatalogItemRequestDto dto) {
        CatalogItem item = getEntity(id);
        String name = dto.getName();
        if (catalogItemRepository.existsByNameAndIdNot(name, id)) {
            throw new CustomException(ErrorCode.DUPLICATE_CATALOG_ITEM, "Catalog item '" + name + "' already exists");
        }
        item.rename(name);
        try {
            catalogItemRepository.flush();
        } catch (DataIntegrityViolationException e) {
            throw new CustomException(ErrorCode.DUPLICATE_CATALOG_ITEM, "Catalog item '" + name + "' already exists", e);
        }
        log.info("Catalog item renamed: id={}, name='{}'", id, name);
        return CatalogItemMapper.toDetailDto(item);
    }

    public void deleteItem(Long id) {
        if (!catalogItemRepository.existsById(id)) {
            throw new CustomException(ErrorCode.CATALOG_ITEM_NOT_FOUND);
        }
        if (recipeItemRepository.existsByCatalogItemId(id)) {
            throw new CustomException(ErrorCode.CATALOG_ITEM_IN_USE);
        }
        catalogItemRepository.deleteById(id);
        log.info("Catalog item deleted: id={}", id);
    }

    @Transactional(readOnly = true)
    public PageSlice<CatalogItemResponseDto> list(PageWindow window) {
        List<CatalogItem> items = catalogItemRepository.findPage(null, false, window.offset(), window.limit());
        long total = catalogItemRepository.countByNameContains(null, false);
        return new PageSlice<>(items, total, window).map(CatalogItemMapper::toDto);
    }

    @Transactional(readOnly = true)
    public List<CatalogItemResponseDto> listPublic() {
        return catalogItemRepository.findAllOrdered().stream()
                .map(CatalogItemMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageSlice<CatalogItemDetailDto> search(String name, PageWindow window) {
        boolean caseSensitive = catalogProperties.getSearch().isCaseSensitive();
        List<CatalogItem> items = catalogItemRepository.findPage(name, caseSensitive, window.offset(), window.limit());
        long total = catalogItemRepository.countByNameContains(name, caseSensitive);
        return new PageSlice<>(items, total, window).map(CatalogItemMapper::toDetailDto);
    }

    private CatalogItem getEntity(Long id) {
        return catalogItemRepository.findById(id)
                .orElseThrow(() -> new CustomException(ErrorCode.CATALOG_ITEM_NOT_FOUND));
    }
}
