package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.StorageItem;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface StorageItemRepository extends JpaRepository<StorageItem, Long> {

    @EntityGraph(attributePaths = {"storage", "material", "material.category"})
    Optional<StorageItem> findByStorageIdAndMaterialId(Long storageId, Long materialId);

    boolean existsByMaterialId(Long materialId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM StorageItem si WHERE si.storage.id = :storageId")
    int deleteByStorageId(@Param("storageId") Long storageId);
}
