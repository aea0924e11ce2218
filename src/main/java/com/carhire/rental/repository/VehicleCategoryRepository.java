package com.carhire.rental.repository;

import com.carhire.rental.entity.VehicleCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VehicleCategoryRepository extends JpaRepository<VehicleCategory, Long> {

    List<VehicleCategory> findByActiveTrueOrderByName();
}
