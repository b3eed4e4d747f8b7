package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.category.CategoryRequestDto;
import com.jdc.catalog_manager.domain.dto.category.CategoryResponseDto;
import com.jdc.catalog_manager.domain.entity.Category;
import com.jdc.catalog_manager.domain.entity.QCategory;
import com.jdc.catalog_manager.domain.repository.CategoryRepository;
import com.jdc.catalog_manager.domain.repository.MaterialRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.mapper.CategoryMapper;
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
public class CategoryService {

    private final JPAQueryFactory queryFactory;
    private final CategoryRepository repo;
    private final MaterialRepository materialRepo;

    private final QCategory category = QCategory.category;

    public CategoryResponseDto create(CategoryRequestDto dto) {
        Category entity = repo.save(CategoryMapper.toEntity(dto.getName()));
        log.info("Category created: id={}, name='{}'", entity.getId(), entity.getName());
        return CategoryMapper.toDto(entity);
    }

    @Transactional(readOnly = true)
    public CategoryResponseDto get(Long id) {
        return CategoryMapper.toDto(getEntity(id));
    }

    public CategoryResponseDto update(Long id, CategoryRequestDto dto) {
        Category entity = getEntity(id);
        entity.rename(dto.getName());
        return CategoryMapper.toDto(entity);
    }

    /** Refused while any material still belongs to the category. */
    public void delete(Long id) {
        if (!repo.existsById(id)) {
            throw new CustomException(ErrorCode.CATEGORY_NOT_FOUND);
        }
        if (materialRepo.existsByCategoryId(id)) {
            throw new CustomException(ErrorCode.CATEGORY_IN_USE);
        }
        repo.deleteById(id);
        log.info("Category deleted: id={}", id);
    }

    @Transactional(readOnly = true)
    public List<CategoryResponseDto> listPublic() {
        return repo.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(CategoryMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageSlice<CategoryResponseDto> search(String query, PageWindow window) {
        BooleanExpression nameCond = StringUtils.hasText(query)
                ? category.name.containsIgnoreCase(query)
                : null;

        List<Category> content = queryFactory
                .selectFrom(category)
                .where(nameCond)
                .orderBy(category.createdAt.desc(), category.id.desc())
                .offset(window.offset())
                .limit(window.limit())
                .fetch();

        Long total = queryFactory
                .select(category.count())
                .from(category)
                .where(nameCond)
                .fetchOne();

        return new PageSlice<>(content, total != null ? total : 0L, window).map(CategoryMapper::toDto);
    }

    @Transactional(readOnly = true)
    public PageSlice<CategoryResponseDto> list(PageWindow window) {
        return search(null, window);
    }

    private Category getEntity(Long id) {
        return repo.findById(id)
                .orElseThrow(() -> new CustomException(ErrorCode.CATEGORY_NOT_FOUND));
    }
}
