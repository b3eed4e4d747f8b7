package com.jdc.catalog_manager.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * Link between a recipe and a catalog item. Rows are read back in id order,
 * which is the order the ingredients were submitted in.
 */
@Entity
@Table(name = "recipe_items", indexes = {
        @Index(name = "idx_recipe_items_recipe_id", columnList = "recipe_id")
})
@Getter
@ToString(exclude = {"recipe", "catalogItem"})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecipeItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipe_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Recipe recipe;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "item_id", nullable = false)
    private CatalogItem catalogItem;

    @Embedded
    private Quantity quantity;
}
