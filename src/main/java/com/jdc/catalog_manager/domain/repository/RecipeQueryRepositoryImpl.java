package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.QRecipe;
import com.jdc.catalog_manager.domain.entity.QUser;
import com.jdc.catalog_manager.domain.entity.Recipe;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;

import java.util.List;

@RequiredArgsConstructor
public class RecipeQueryRepositoryImpl implements RecipeQueryRepository {

    private final JPAQueryFactory queryFactory;

    @Override
    public List<Recipe> findPage(Long userId, String titleContains, long offset, int limit) {
        QRecipe recipe = QRecipe.recipe;
        QUser user = QUser.user;

        return queryFactory
                .selectFrom(recipe)
                .join(recipe.user, user).fetchJoin()
                .where(
                        ownerEq(userId),
                        titleContains(titleContains)
                )
                .orderBy(recipe.createdAt.desc(), recipe.id.desc())
                .offset(offset)
                .limit(limit)
                .fetch();
    }

    @Override
    public long countPage(Long userId, String titleContains) {
        QRecipe recipe = QRecipe.recipe;

        Long total = queryFactory
                .select(recipe.count())
                .from(recipe)
                .where(
                        ownerEq(userId),
                        titleContains(titleContains)
                )
                .fetchOne();
        return total != null ? total : 0L;
    }

    private BooleanExpression ownerEq(Long userId) {
        return userId != null ? QRecipe.recipe.user.id.eq(userId) : null;
    }

    private BooleanExpression titleContains(String title) {
        return StringUtils.hasText(title) ? QRecipe.recipe.title.containsIgnoreCase(title) : null;
    }
}
