package com.jdc.catalog_manager.domain.entity;

import com.jdc.catalog_manager.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(
        name = "recipes",
        indexes = {
                @Index(name = "idx_recipes_user_id", columnList = "user_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    public static final int MAX_TITLE_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false, length = MAX_TITLE_LENGTH)
    private String title;

    @Column(name = "external_url", length = 2048)
    private String externalUrl;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "preparation_steps", nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private String preparationSteps = "";

    @Column(name = "prep_time_minutes", nullable = false)
    @Builder.Default
    private Integer prepTimeMinutes = 0;

    public void update(String title, String externalUrl, String imageUrl,
                       String preparationSteps, Integer prepTimeMinutes) {
        if (title != null) this.title = title;
        if (externalUrl != null) this.externalUrl = externalUrl.isBlank() ? null : externalUrl;
        if (imageUrl != null) this.imageUrl = imageUrl.isBlank() ? null : imageUrl;
        if (preparationSteps != null) this.preparationSteps = preparationSteps;
        if (prepTimeMinutes != null) this.prepTimeMinutes = prepTimeMinutes;
    }

    public boolean isOwnedBy(Long userId) {
        return user != null && user.getId().equals(userId);
    }
}
