package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.Storage;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StorageRepository extends JpaRepository<Storage, Long> {

    boolean existsByConstructionId(Long constructionId);

    @EntityGraph(attributePaths = "construction")
    Optional<Storage> findWithConstructionById(Long id);

    @EntityGraph(attributePaths = "construction")
    List<Storage> findAllByOrderByCreatedAtDescIdDesc();
}
