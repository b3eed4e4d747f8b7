package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.RecipeItem;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RecipeItemRepository extends JpaRepository<RecipeItem, Long> {

    @EntityGraph(attributePaths = "catalogItem")
    List<RecipeItem> findByRecipeIdOrderByIdAsc(Long recipeId);

    long countByRecipeId(Long recipeId);

    boolean existsByCatalogItemId(Long catalogItemId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RecipeItem ri WHERE ri.recipe.id = :recipeId")
    int deleteByRecipeId(@Param("recipeId") Long recipeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RecipeItem ri WHERE ri.recipe.id IN (SELECT r.id FROM Recipe r WHERE r.user.id = :userId)")
    int deleteByRecipeUserId(@Param("userId") Long userId);
}
