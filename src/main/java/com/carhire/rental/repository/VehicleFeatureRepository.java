package com.carhire.rental.repository;

import com.carhire.rental.entity.VehicleFeature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VehicleFeatureRepository extends JpaRepository<VehicleFeature, Long> {

    List<VehicleFeature> findByActiveTrueOrderByName();
}
