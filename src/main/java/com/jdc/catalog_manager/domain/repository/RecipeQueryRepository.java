package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.Recipe;

import java.util.List;

public interface RecipeQueryRepository {

    List<Recipe> findPage(Long userId, String titleContains, long offset, int limit);

    long countPage(Long userId, String titleContains);
}
