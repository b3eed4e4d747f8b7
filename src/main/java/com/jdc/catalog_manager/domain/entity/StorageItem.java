package com.jdc.catalog_manager.domain.entity;

import com.jdc.catalog_manager.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;

/**
 * Stock of one material in one storage. A storage holds at most one row per material;
 * further deliveries are added to {@link #quantityValue}.
 */
@Entity
@Table(name = "storage_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_storage_items_storage_material", columnNames = {"storage_id", "material_id"})
}, indexes = {
        @Index(name = "idx_storage_items_material_id", columnList = "material_id")
})
@Getter
@ToString(exclude = {"storage", "material"})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class StorageItem extends BaseTimeEntity {

    public static final int QUANTITY_PRECISION = 12;
    public static final int QUANTITY_SCALE = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "storage_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Storage storage;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "material_id", nullable = false)
    private Material material;

    @Column(name = "quantity_value", nullable = false, precision = QUANTITY_PRECISION, scale = QUANTITY_SCALE)
    private BigDecimal quantityValue;

    public void addQuantity(BigDecimal delta) {
        this.quantityValue = this.quantityValue.add(delta);
    }

    public void changeQuantity(BigDecimal quantityValue) {
        this.quantityValue = quantityValue;
    }
}
