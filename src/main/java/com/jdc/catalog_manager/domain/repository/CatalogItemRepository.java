package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.CatalogItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CatalogItemRepository extends JpaRepository<CatalogItem, Long>, CatalogItemQueryRepository {

    /** Exact, case-sensitive lookup. The name is not trimmed or folded. */
    Optional<CatalogItem> findByName(String name);

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);
}
