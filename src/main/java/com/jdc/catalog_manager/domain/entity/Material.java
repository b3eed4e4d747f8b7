package com.jdc.catalog_manager.domain.entity;

import com.jdc.catalog_manager.domain.entity.common.BaseTimeEntity;
import com.jdc.catalog_manager.domain.type.MaterialUnit;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "materials", uniqueConstraints = {
        @UniqueConstraint(name = "uk_materials_name", columnNames = {"name"})
}, indexes = {
        @Index(name = "idx_materials_category_id", columnList = "category_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Material extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private String description = "";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private MaterialUnit unit = MaterialUnit.OTHER;

    public void update(Category category, String name, String description, MaterialUnit unit) {
        if (category != null) this.category = category;
        if (name != null) this.name = name.strip();
        if (description != null) this.description = description.strip();
        if (unit != null) this.unit = unit;
    }
}
