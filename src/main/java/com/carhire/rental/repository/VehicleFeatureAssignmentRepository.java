package com.carhire.rental.repository;

import com.carhire.rental.entity.VehicleFeatureAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VehicleFeatureAssignmentRepository extends JpaRepository<VehicleFeatureAssignment, Long> {

    List<VehicleFeatureAssignment> findByVehicleId(Long vehicleId);

    boolean existsByVehicleIdAndFeatureId(Long vehicleId, Long featureId);
}
