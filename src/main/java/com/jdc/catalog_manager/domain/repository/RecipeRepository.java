package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.Recipe;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RecipeRepository extends JpaRepository<Recipe, Long>, RecipeQueryRepository {

    @EntityGraph(attributePaths = "user")
    Optional<Recipe> findWithUserById(Long id);

    @EntityGraph(attributePaths = "user")
    List<Recipe> findAllByOrderByCreatedAtDescIdDesc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Recipe r WHERE r.user.id = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
