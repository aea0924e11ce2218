package com.carhire.rental.repository;

import com.carhire.rental.entity.VehicleMaintenanceRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VehicleMaintenanceRecordRepository extends JpaRepository<VehicleMaintenanceRecord, Long> {

    List<VehicleMaintenanceRecord> findByVehicleIdOrderByScheduledDateDesc(Long vehicleId);
}
