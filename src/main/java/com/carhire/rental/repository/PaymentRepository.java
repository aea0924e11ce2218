package com.carhire.rental.repository;

import com.carhire.rental.entity.Payment;
import com.carhire.rental.entity.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    /** Row lock for status transitions and refunds. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> findByIdForUpdate(@Param("id") Long id);

    boolean existsByTransactionId(String transactionId);

    Optional<Payment> findByTransactionId(String transactionId);

    List<Payment> findByBookingIdOrderByCreatedAtDesc(Long bookingId);

    /** Sum of amount minus refunds over the booking's payments in {@code statuses}. */
    @Query("SELECT COALESCE(SUM(p.amount - p.refundAmount), 0) FROM Payment p " +
           "WHERE p.booking.id = :bookingId AND p.status IN :statuses")
    BigDecimal sumNetAmountByBooking(@Param("bookingId") Long bookingId,
                                     @Param("statuses") Collection<PaymentStatus> statuses);

    // ── Admin bulk updates ──

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Payment p SET p.status = com.carhire.rental.entity.PaymentStatus.PROCESSING, " +
           "p.paymentDate = :now, p.updatedAt = :now " +
           "WHERE p.id IN :ids AND p.status = com.carhire.rental.entity.PaymentStatus.PENDING")
    int bulkProcess(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Payment p SET p.status = com.carhire.rental.entity.PaymentStatus.FAILED, p.updatedAt = :now " +
           "WHERE p.id IN :ids AND p.status IN (com.carhire.rental.entity.PaymentStatus.PENDING, " +
           "com.carhire.rental.entity.PaymentStatus.PROCESSING)")
    int bulkFail(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);
}
