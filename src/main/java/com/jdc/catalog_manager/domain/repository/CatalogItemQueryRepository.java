package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.CatalogItem;

import java.util.List;

public interface CatalogItemQueryRepository {

    /**
     * One page of catalog items ordered by last use (never used last), then name.
     *
     * @param nameContains substring filter, ignored when null or blank
     * @param caseSensitive whether the substring filter respects case
     */
    List<CatalogItem> findPage(String nameContains, boolean caseSensitive, long offset, int limit);

    long countByNameContains(String nameContains, boolean caseSensitive);

    List<CatalogItem> findAllOrdered();
}
