package com.carhire.rental.repository;

import com.carhire.rental.entity.VehicleSafetyEquipment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VehicleSafetyEquipmentRepository extends JpaRepository<VehicleSafetyEquipment, Long> {

    List<VehicleSafetyEquipment> findByVehicleId(Long vehicleId);

    Optional<VehicleSafetyEquipment> findByVehicleIdAndEquipmentType(Long vehicleId, String equipmentType);
}
