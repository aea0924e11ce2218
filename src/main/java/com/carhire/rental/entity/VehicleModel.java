package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A make/model combination. Name is unique per brand.
 */
@Entity
@Table(
    name = "vehicle_models",
    uniqueConstraints = @UniqueConstraint(name = "uk_model_brand_name", columnNames = {"brand_id", "name"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleModel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "brand_id", nullable = false)
    private VehicleBrand brand;

    @ManyToOne(optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private VehicleCategory category;

    @Column(nullable = false, length = 100)
    private String name;

    @Builder.Default
    private boolean active = true;

    public String getDisplayName() {
        return brand != null ? brand.getName() + " " + name : name;
    }
}
