package com.carhire.rental.repository;

import com.carhire.rental.entity.VehicleImage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VehicleImageRepository extends JpaRepository<VehicleImage, Long> {

    List<VehicleImage> findByVehicleIdOrderBySortOrderAsc(Long vehicleId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VehicleImage i SET i.primaryImage = false WHERE i.vehicle.id = :vehicleId")
    int clearPrimary(@Param("vehicleId") Long vehicleId);
}
