package com.carhire.rental.repository;

import com.carhire.rental.entity.Review;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface ReviewRepository extends JpaRepository<Review, Long> {

    boolean existsByBookingId(Long bookingId);

    List<Review> findByVehicleIdAndApprovedTrueOrderByCreatedAtDesc(Long vehicleId);

    List<Review> findByFeaturedTrueAndApprovedTrueOrderByCreatedAtDesc();

    @Query("SELECT AVG(r.overallRating) FROM Review r WHERE r.vehicle.id = :vehicleId AND r.approved = true")
    Double averageRatingForVehicle(@Param("vehicleId") Long vehicleId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Review r SET r.approved = :approved, r.updatedAt = :now WHERE r.id IN :ids")
    int bulkUpdateApproved(@Param("ids") Collection<Long> ids,
                           @Param("approved") boolean approved,
                           @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Review r SET r.verified = true, r.updatedAt = :now WHERE r.id IN :ids")
    int bulkVerify(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Review r SET r.featured = true, r.updatedAt = :now WHERE r.id IN :ids")
    int bulkFeature(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);
}
