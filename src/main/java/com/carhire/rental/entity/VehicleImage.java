package com.carhire.rental.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Image metadata. Files are stored elsewhere; only the path is kept.
 */
@Entity
@Table(name = "vehicle_images")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleImage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "vehicle_id", nullable = false)
    private Vehicle vehicle;

    @Column(nullable = false, length = 500)
    private String imagePath;

    @Column(length = 20)
    @Builder.Default
    private String imageType = "exterior";

    private String caption;

    @Builder.Default
    private boolean primaryImage = false;

    @Builder.Default
    private int sortOrder = 0;

    private LocalDateTime uploadedAt;
}
