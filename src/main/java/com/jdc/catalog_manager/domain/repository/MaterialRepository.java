package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.Material;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MaterialRepository extends JpaRepository<Material, Long> {

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);

    boolean existsByCategoryId(Long categoryId);

    @EntityGraph(attributePaths = "category")
    Optional<Material> findWithCategoryById(Long id);

    @EntityGraph(attributePaths = "category")
    List<Material> findAllByOrderByCreatedAtDescIdDesc();

    List<Material> findByNameIn(Collection<String> names);
}
