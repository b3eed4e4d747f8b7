package com.jdc.catalog_manager.domain.entity;

import com.jdc.catalog_manager.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;

/**
 * Named place on a construction site where materials are kept.
 */
@Entity
@Table(name = "storages", indexes = {
        @Index(name = "idx_storages_construction_id", columnList = "construction_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Storage extends BaseTimeEntity {

    public static final int MAX_NAME_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "construction_id", nullable = false)
    private Construction construction;

    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String name;

    public void update(Construction construction, String name) {
        if (construction != null) this.construction = construction;
        if (name != null) this.name = name.strip();
    }
}
