package com.jdc.catalog_manager.domain.repository;

import com.jdc.catalog_manager.domain.entity.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CategoryRepository extends JpaRepository<Category, Long> {

    List<Category> findAllByOrderByCreatedAtDescIdDesc();
}
