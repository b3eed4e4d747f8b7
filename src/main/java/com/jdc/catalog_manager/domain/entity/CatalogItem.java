package com.jdc.catalog_manager.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Shared ingredient catalog entry. Names are unique and compared verbatim,
 * so "Jajka" and "jajka" are two different items.
 */
@Entity
@Table(name = "catalog_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_catalog_items_name", columnNames = {"name"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class CatalogItem {

    public static final int MAX_NAME_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String name;

    @Column(name = "last_used")
    private LocalDateTime lastUsed;

    public void rename(String name) {
        this.name = name;
    }

    public void touchLastUsed(LocalDateTime timestamp) {
        this.lastUsed = timestamp;
    }
}
