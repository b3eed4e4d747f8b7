package com.jdc.catalog_manager.domain.entity;

import com.jdc.catalog_manager.domain.entity.common.BaseTimeEntity;
import com.jdc.catalog_manager.domain.type.ConstructionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "constructions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Construction extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private String description = "";

    @Column(nullable = false, length = 255)
    @Builder.Default
    private String address = "";

    @Column(name = "start_date")
    private LocalDateTime startDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ConstructionStatus status = ConstructionStatus.INACTIVE;

    @Column(name = "img_url", length = 500)
    private String imgUrl;

    public void update(String name, String description, String address,
                       LocalDateTime startDate, ConstructionStatus status, String imgUrl) {
        if (name != null) this.name = name.strip();
        if (description != null) this.description = description.strip();
        if (address != null) this.address = address.strip();
        if (startDate != null) this.startDate = startDate;
        if (status != null) this.status = status;
        if (imgUrl != null) this.imgUrl = imgUrl.isBlank() ? null : imgUrl.strip();
    }
}
