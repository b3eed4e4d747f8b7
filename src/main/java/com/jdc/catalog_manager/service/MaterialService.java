package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.material.MaterialBulkRequestDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialRequestDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialResponseDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialUpdateRequestDto;
import com.jdc.catalog_manager.domain.entity.Category;
import com.jdc.catalog_manager.domain.entity.Material;
import com.jdc.catalog_manager.domain.entity.QCategory;
import com.jdc.catalog_manager.domain.entity.QMaterial;
import com.jdc.catalog_manager.domain.repository.CategoryRepository;
import com.jdc.catalog_manager.domain.repository.MaterialRepository;
import com.jdc.catalog_manager.domain.repository.StorageItemRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.mapper.MaterialMapper;
import com.jdc.catalog_manager.util.PageSlice;
import com.jdc.catalog_manager.util.PageWindow;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class MaterialService {

    private final JPAQueryFactory queryFactory;
    private final MaterialRepository repo;
    private final CategoryRepository categoryRepo;
    private final StorageItemRepository storageItemRepo;

    private final QMaterial material = QMaterial.material;

    public MaterialResponseDto create(MaterialRequestDto dto) {
        Category category = getCategory(dto.getCategoryId());
        String name = dto.getName().strip();
        if (repo.existsByName(name)) {
            throw new CustomException(ErrorCode.DUPLICATE_MATERIAL, "Material '" + name + "' already exists");
        }
        Material entity = repo.save(MaterialMapper.toEntity(dto, category));
        log.info("Material created: id={}, name='{}'", entity.getId(), entity.getName());
        return MaterialMapper.toDto(entity);
    }

    /**
     * Creates every material of the batch or none of them. Names must be unique
     * within the batch and must not exist yet.
     */
    public List<MaterialResponseDto> createBulk(MaterialBulkRequestDto dto) {
        List<MaterialRequestDto> requests = dto.getMaterials();

        Set<String> names = new LinkedHashSet<>();
        for (MaterialRequestDto request : requests) {
            String name = request.getName().strip();
            if (!names.add(name)) {
                throw new CustomException(ErrorCode.DUPLICATE_MATERIAL, "Material '" + name + "' appears more than once");
            }
        }

        List<String> existing = repo.findByNameIn(names).stream()
                .map(Material::getName)
                .toList();
        if (!existing.isEmpty()) {
            throw new CustomException(ErrorCode.DUPLICATE_MATERIAL, "Materials already exist: " + existing);
        }

        Map<Long, Category> categories = new HashMap<>();
        List<Material> entities = new ArrayList<>();
        for (MaterialRequestDto request : requests) {
            Category category = categories.computeIfAbsent(request.getCategoryId(), this::getCategory);
            entities.add(MaterialMapper.toEntity(request, category));
        }

        List<MaterialResponseDto> created = repo.saveAll(entities).stream()
                .map(MaterialMapper::toDto)
                .toList();
        log.info("Materials created in bulk: count={}", created.size());
        return created;
    }

    @Transactional(readOnly = true)
    public MaterialResponseDto get(Long id) {
        return MaterialMapper.toDto(getEntity(id));
    }

    public MaterialResponseDto update(Long id, MaterialUpdateRequestDto dto) {
        Material entity = getEntity(id);
        Category category = dto.getCategoryId() != null ? getCategory(dto.getCategoryId()) : null;
        if (dto.getName() != null && repo.existsByNameAndIdNot(dto.getName().strip(), id)) {
            throw new CustomException(ErrorCode.DUPLICATE_MATERIAL, "Material '" + dto.getName().strip() + "' already exists");
        }
        entity.update(category, dto.getName(), dto.getDescription(), dto.getUnit());
        return MaterialMapper.toDto(entity);
    }

    public void delete(Long id) {
        if (!repo.existsById(id)) {
            throw new CustomException(ErrorCode.MATERIAL_NOT_FOUND);
        }
        if (storageItemRepo.existsByMaterialId(id)) {
            throw new CustomException(ErrorCode.MATERIAL_IN_USE);
        }
        repo.deleteById(id);
        log.info("Material deleted: id={}", id);
    }

    @Transactional(readOnly = true)
    public List<MaterialResponseDto> listPublic() {
        return repo.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(MaterialMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageSlice<MaterialResponseDto> listByCategory(Long categoryId, PageWindow window) {
        if (!categoryRepo.existsById(categoryId)) {
            throw new CustomException(ErrorCode.CATEGORY_NOT_FOUND);
        }
        return search(null, categoryId, window);
    }

    @Transactional(readOnly = true)
    public PageSlice<MaterialResponseDto> list(PageWindow window) {
        return search(null, null, window);
    }

    @Transactional(readOnly = true)
    public PageSlice<MaterialResponseDto> search(String query, Long categoryId, PageWindow window) {
        QCategory category = QCategory.category;

        BooleanExpression nameCond = StringUtils.hasText(query)
                ? material.name.containsIgnoreCase(query)
                : null;
        BooleanExpression categoryCond = categoryId != null
                ? material.category.id.eq(categoryId)
                : null;

        List<Material> content = queryFactory
                .selectFrom(material)
                .join(material.category, category).fetchJoin()
                .where(nameCond, categoryCond)
                .orderBy(material.createdAt.desc(), material.id.desc())
                .offset(window.offset())
                .limit(window.limit())
                .fetch();

        Long total = queryFactory
                .select(material.count())
                .from(material)
                .where(nameCond, categoryCond)
                .fetchOne();

        return new PageSlice<>(content, total != null ? total : 0L, window).map(MaterialMapper::toDto);
    }

    private Category getCategory(Long categoryId) {
        return categoryRepo.findById(categoryId)
                .orElseThrow(() -> new CustomException(ErrorCode.CATEGORY_NOT_FOUND));
    }

    private Material getEntity(Long id) {
        return repo.findWithCategoryById(id)
                .orElseThrow(() -> new CustomException(ErrorCode.MATERIAL_NOT_FOUND));
    }
}
