package com.carhire.rental.repository;

import com.carhire.rental.entity.Vehicle;
import com.carhire.rental.entity.VehicleStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Vehicle entity
 */
@Repository
public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    /**
     * Locks the vehicle row while a booking is placed, so two customers
     * cannot both pass the overlap check for the same dates.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Vehicle v WHERE v.id = :id")
    Optional<Vehicle> findByIdForUpdate(@Param("id") Long id);

    List<Vehicle> findByActiveTrueOrderByIdAsc();

    List<Vehicle> findByStatusAndActiveTrueOrderByIdAsc(VehicleStatus status);

    boolean existsByLicensePlate(String licensePlate);

    boolean existsByVinNumber(String vinNumber);

    boolean existsByLicensePlateAndIdNot(String licensePlate, Long id);

    boolean existsByVinNumberAndIdNot(String vinNumber, Long id);

    // ── Admin bulk updates ──

    /** Rented vehicles are left alone; they change status through their booking. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Vehicle v SET v.status = :status, v.updatedAt = :now " +
           "WHERE v.id IN :ids AND v.status <> com.carhire.rental.entity.VehicleStatus.RENTED")
    int bulkUpdateStatus(@Param("ids") Collection<Long> ids,
                         @Param("status") VehicleStatus status,
                         @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Vehicle v SET v.featured = :featured, v.updatedAt = :now WHERE v.id IN :ids")
    int bulkUpdateFeatured(@Param("ids") Collection<Long> ids,
                           @Param("featured") boolean featured,
                           @Param("now") LocalDateTime now);
}
