package com.carhire.rental.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(
    name = "vehicle_safety_equipment",
    uniqueConstraints = @UniqueConstraint(name = "uk_vehicle_equipment", columnNames = {"vehicle_id", "equipment_type"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VehicleSafetyEquipment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "vehicle_id", nullable = false)
    private Vehicle vehicle;

    /** fire_extinguisher, first_aid_kit, warning_triangle, spare_wheel, ... */
    @Column(name = "equipment_type", nullable = false, length = 30)
    private String equipmentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SafetyEquipmentStatus status = SafetyEquipmentStatus.PRESENT;

    private LocalDate expiryDate;
    private LocalDate lastInspectionDate;
    private String notes;

    public boolean isExpired(LocalDate today) {
        return expiryDate != null && expiryDate.isBefore(today);
    }
}
