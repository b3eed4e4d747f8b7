package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.Construction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConstructionRepository extends JpaRepository<Construction, Long> {

    List<Construction> findAllByOrderByCreatedAtDescIdDesc();
}
