package com.carhire.rental.repository;

import com.carhire.rental.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByUsername(String username);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByDriversLicenseNumber(String driversLicenseNumber);

    // ── Admin bulk updates ──

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.verified = true, u.verificationDate = :now, " +
           "u.verificationLevel = com.carhire.rental.entity.VerificationLevel.VERIFIED, u.updatedAt = :now " +
           "WHERE u.id IN :ids")
    int bulkVerify(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.suspended = true, u.active = false, u.updatedAt = :now WHERE u.id IN :ids")
    int bulkSuspend(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.suspended = false, u.suspensionReason = null, u.active = true, u.updatedAt = :now " +
           "WHERE u.id IN :ids")
    int bulkActivate(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);
}
