package com.carhire.rental.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "vehicle_brands")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleBrand {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    private String countryOfOrigin;

    @Builder.Default
    private boolean active = true;
}
