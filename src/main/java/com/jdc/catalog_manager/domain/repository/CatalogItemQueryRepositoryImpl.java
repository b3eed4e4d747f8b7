package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.CatalogItem;
import com.jdc.catalog_manager.domain.entity.QCatalogItem;
import com.querydsl.core.types.OrderSpecifier;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;

import java.util.List;

@RequiredArgsConstructor
public class CatalogItemQueryRepositoryImpl implements CatalogItemQueryRepository {

    private final JPAQueryFactory queryFactory;

    private final QCatalogItem item = QCatalogItem.catalogItem;

    @Override
    public List<CatalogItem> findPage(String nameContains, boolean caseSensitive, long offset, int limit) {
        return queryFactory
                .selectFrom(item)
                .where(nameContains(nameContains, caseSensitive))
                .orderBy(catalogOrder())
                .offset(offset)
                .limit(limit)
                .fetch();
    }

    @Override
    public long countByNameContains(String nameContains, boolean caseSensitive) {
        Long total = queryFactory
                .select(item.count())
                .from(item)
                .where(nameContains(nameContains, caseSensitive))
                .fetchOne();
        return total != null ? total : 0L;
    }

    @Override
    public List<CatalogItem> findAllOrdered() {
        return queryFactory
                .selectFrom(item)
                .orderBy(catalogOrder())
                .fetch();
    }

    private OrderSpecifier<?>[] catalogOrder() {
        return new OrderSpecifier<?>[]{
                item.lastUsed.desc().nullsLast(),
                item.name.asc(),
                item.id.asc()
        };
    }

    private BooleanExpression nameContains(String keyword, boolean caseSensitive) {
        if (!StringUtils.hasText(keyword)) {
            return null;
        }
        return caseSensitive ? item.name.contains(keyword) : item.name.containsIgnoreCase(keyword);
    }
}
