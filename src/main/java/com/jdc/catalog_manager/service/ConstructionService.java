package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.construction.ConstructionRequestDto;
import com.jdc.catalog_manager.domain.dto.construction.ConstructionResponseDto;
import com.jdc.catalog_manager.domain.dto.construction.ConstructionUpdateRequestDto;
import com.jdc.catalog_manager.domain.entity.Construction;
import com.jdc.catalog_manager.domain.entity.QConstruction;
import com.jdc.catalog_manager.domain.repository.ConstructionRepository;
import com.jdc.catalog_manager.domain.repository.StorageRepository;
import com.jdc.catalog_manager.domain.type.ConstructionStatus;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.mapper.ConstructionMapper;
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
public class ConstructionService {

    private final JPAQueryFactory queryFactory;
    private final ConstructionRepository repo;
    private final StorageRepository storageRepo;

    private final QConstruction construction = QConstruction.construction;

    public ConstructionResponseDto create(ConstructionRequestDto dto) {
        Construction entity = repo.save(ConstructionMapper.toEntity(dto));
        log.info("Construction created: id={}, name='{}'", entity.getId(), entity.getName());
        return ConstructionMapper.toDto(entity);
    }

    @Transactional(readOnly = true)
    public ConstructionResponseDto get(Long id) {
        return ConstructionMapper.toDto(getEntity(id));
    }

    public ConstructionResponseDto update(Long id, ConstructionUpdateRequestDto dto) {
        Construction entity = getEntity(id);
        entity.update(dto.getName(), dto.getDescription(), dto.getAddress(),
                dto.getStartDate(), dto.getStatus(), dto.getImgUrl());
        return ConstructionMapper.toDto(entity);
    }

    public void delete(Long id) {
        if (!repo.existsById(id)) {
            throw new CustomException(ErrorCode.CONSTRUCTION_NOT_FOUND);
        }
        if (storageRepo.existsByConstructionId(id)) {
            throw new CustomException(ErrorCode.CONSTRUCTION_IN_USE);
        }
        repo.deleteById(id);
        log.info("Construction deleted: id={}", id);
    }

    @Transactional(readOnly = true)
    public List<ConstructionResponseDto> listPublic() {
        return repo.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(ConstructionMapper::toDto)
                .toList();
    }

    /**
     * @param query  name substring, case-insensitive (optional)
     * @param status status code such as {@code in_progress} (optional)
     */
    @Transactional(readOnly = true)
    public PageSlice<ConstructionResponseDto> search(String query, String status, PageWindow window) {
        BooleanExpression nameCond = StringUtils.hasText(query)
                ? construction.name.containsIgnoreCase(query)
                : null;
        BooleanExpression statusCond = StringUtils.hasText(status)
                ? construction.status.eq(parseStatus(status))
                : null;

        List<Construction> content = queryFactory
                .selectFrom(construction)
                .where(nameCond, statusCond)
                .orderBy(construction.createdAt.desc(), construction.id.desc())
                .offset(window.offset())
                .limit(window.limit())
                .fetch();

        Long total = queryFactory
                .select(construction.count())
                .from(construction)
                .where(nameCond, statusCond)
                .fetchOne();

        return new PageSlice<>(content, total != null ? total : 0L, window).map(ConstructionMapper::toDto);
    }

    @Transactional(readOnly = true)
    public PageSlice<ConstructionResponseDto> list(PageWindow window) {
        return search(null, null, window);
    }

    private ConstructionStatus parseStatus(String status) {
        try {
            return ConstructionStatus.fromCode(status);
        } catch (IllegalArgumentException e) {
            throw new CustomException(ErrorCode.INVALID_CONSTRUCTION_STATUS, e.getMessage(), e);
        }
    }

    private Construction getEntity(Long id) {
        return repo.findById(id)
                .orElseThrow(() -> new CustomException(ErrorCode.CONSTRUCTION_NOT_FOUND));
    }
}
