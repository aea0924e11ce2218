package com.carhire.rental.repository;

import com.carhire.rental.entity.Promotion;
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

@Repository
public interface PromotionRepository extends JpaRepository<Promotion, Long> {

    Optional<Promotion> findByCodeIgnoreCase(String code);

    /** Locked read used when a promotion is redeemed, so usage limits hold. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Promotion p WHERE UPPER(p.code) = UPPER(:code)")
    Optional<Promotion> findByCodeForUpdate(@Param("code") String code);

    boolean existsByCodeIgnoreCase(String code);

    @Query("SELECT p FROM Promotion p WHERE p.active = true AND p.publicPromotion = true " +
           "AND p.startDate <= :now AND p.endDate >= :now ORDER BY p.endDate ASC")
    List<Promotion> findCurrentPublic(@Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Promotion p SET p.active = :active WHERE p.id IN :ids")
    int bulkUpdateActive(@Param("ids") Collection<Long> ids, @Param("active") boolean active);
}
