package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.storage.StorageRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.StorageResponseDto;
import com.jdc.catalog_manager.domain.dto.storage.StorageUpdateRequestDto;
import com.jdc.catalog_manager.domain.entity.Construction;
import com.jdc.catalog_manager.domain.entity.QConstruction;
import com.jdc.catalog_manager.domain.entity.QStorage;
import com.jdc.catalog_manager.domain.entity.Storage;
import com.jdc.catalog_manager.domain.repository.ConstructionRepository;
import com.jdc.catalog_manager.domain.repository.StorageItemRepository;
import com.jdc.catalog_manager.domain.repository.StorageRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.mapper.StorageMapper;
import com.jdc.catalog_manager.util.PageSlice;
import com.jdc.catalog_manager.util.PageWindow;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class StorageService {

    private final JPAQueryFactory queryFactory;
    private final StorageRepository repo;
    private final StorageItemRepository storageItemRepo;
    private final ConstructionRepository constructionRepo;

    private final QStorage storage = QStorage.storage;

    public StorageResponseDto create(StorageRequestDto dto) {
        Construction construction = getConstruction(dto.getConstructionId());
        Storage entity = repo.save(StorageMapper.toEntity(dto, construction));
        log.info("Storage created: id={}, constructionId={}, name='{}'",
                entity.getId(), construction.getId(), entity.getName());
        return StorageMapper.toDto(entity);
    }

    @Transactional(readOnly = true)
    public StorageResponseDto get(Long id) {
        return StorageMapper.toDto(getEntity(id));
    }

    public StorageResponseDto update(Long id, StorageUpdateRequestDto dto) {
        Storage entity = getEntity(id);
        Construction construction = dto.getConstructionId() != null ? getConstruction(dto.getConstructionId()) : null;
        entity.update(construction, dto.getName());
        return StorageMapper.toDto(entity);
    }

    /**
     * Removes the storage together with its stock.
     */
    public void delete(Long id) {
        if (!repo.existsById(id)) {
            throw new CustomException(ErrorCode.STORAGE_NOT_FOUND);
        }
        int items = storageItemRepo.deleteByStorageId(id);
        repo.deleteById(id);
        log.info("Storage deleted: id={}, items={}", id, items);
    }

    @Transactional(readOnly = true)
    public List<StorageResponseDto> listPublic() {
        return repo.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(StorageMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageSlice<StorageResponseDto> list(PageWindow window) {
        return search(null, null, window);
    }

    @Transactional(readOnly = true)
    public PageSlice<StorageResponseDto> listByConstruction(Long constructionId, PageWindow window) {
        if (!constructionRepo.existsById(constructionId)) {
            throw new CustomException(ErrorCode.CONSTRUCTION_NOT_FOUND);
        }
        return search(null, constructionId, window);
    }

    /**
     * @param query          name substring, case-insensitive (optional)
     * @param constructionId restricts results to one construction (optional)
     */
    @Transactional(readOnly = true)
    public PageSlice<StorageResponseDto> search(String query, Long constructionId, PageWindow window) {
        QConstruction construction = QConstruction.construction;

        BooleanExpression nameCond = StringUtils.hasText(query)
                ? storage.name.containsIgnoreCase(query)
                : null;
        BooleanExpression constructionCond = constructionId != null
                ? storage.construction.id.eq(constructionId)
                : null;

        List<Storage> content = queryFactory
                .selectFrom(storage)
                .join(storage.construction, construction).fetchJoin()
                .where(nameCond, constructionCond)
                .orderBy(storage.createdAt.desc(), storage.id.desc())
                .offset(window.offset())
                .limit(window.limit())
                .fetch();

        Long total = queryFactory
                .select(storage.count())
                .from(storage)
                .where(nameCond, constructionCond)
                .fetchOne();

        return new PageSlice<>(content, total != null ? total : 0L, window).map(StorageMapper::toDto);
    }

    private Construction getConstruction(Long constructionId) {
        return constructionRepo.findById(constructionId)
                .orElseThrow(() -> new CustomException(ErrorCode.CONSTRUCTION_NOT_FOUND));
    }

    private Storage getEntity(Long id) {
        return repo.findWithConstructionById(id)
                .orElseThrow(() -> new CustomException(ErrorCode.STORAGE_NOT_FOUND));
    }
}
