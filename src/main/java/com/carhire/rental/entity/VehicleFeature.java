package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "vehicle_features")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleFeature {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    private String description;

    @Column(length = 50)
    private String icon;

    @Builder.Default
    private boolean active = true;
}
