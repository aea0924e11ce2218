package com.carhire.rental.repository;

import com.carhire.rental.entity.Booking;
import com.carhire.rental.entity.BookingStatus;
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

/**
 * Repository interface for Booking entity
 */
@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Acquires a PESSIMISTIC_WRITE (SELECT FOR UPDATE) lock on the booking row.
     *
     * Every status transition loads through here so that two concurrent
     * requests on the same booking are serialised: the second one sees the
     * state written by the first and fails its guard.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    Optional<Booking> findByBookingReference(String bookingReference);

    boolean existsByBookingReference(String bookingReference);

    List<Booking> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    List<Booking> findAllByOrderByCreatedAtDesc();

    long countByCustomerId(Long customerId);

    long countByCustomerIdAndStatusIn(Long customerId, Collection<BookingStatus> statuses);

    long countByCustomerIdAndPromotionCodeIgnoreCaseAndStatusNot(Long customerId, String promotionCode,
                                                                 BookingStatus status);

    /**
     * Bookings in {@code statuses} whose [pickup, return) range intersects the given one.
     */
    @Query("SELECT COUNT(b) FROM Booking b WHERE b.vehicle.id = :vehicleId " +
           "AND b.status IN :statuses " +
           "AND b.pickupDate < :returnDate AND b.returnDate > :pickupDate")
    long countOverlapping(@Param("vehicleId") Long vehicleId,
                          @Param("pickupDate") LocalDateTime pickupDate,
                          @Param("returnDate") LocalDateTime returnDate,
                          @Param("statuses") Collection<BookingStatus> statuses);

    @Query("SELECT COALESCE(SUM(b.totalAmount), 0) FROM Booking b " +
           "WHERE b.customer.id = :customerId AND b.status = :status")
    BigDecimal sumTotalAmountByCustomerAndStatus(@Param("customerId") Long customerId,
                                                 @Param("status") BookingStatus status);

    // ── Admin bulk updates (status filter only, no per-row guards) ──

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.status = com.carhire.rental.entity.BookingStatus.CONFIRMED, " +
           "b.confirmedAt = :now, b.updatedAt = :now " +
           "WHERE b.id IN :ids AND b.status = com.carhire.rental.entity.BookingStatus.PENDING")
    int bulkConfirm(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.status = com.carhire.rental.entity.BookingStatus.ACTIVE, " +
           "b.actualPickupDate = :now, b.updatedAt = :now " +
           "WHERE b.id IN :ids AND b.status = com.carhire.rental.entity.BookingStatus.CONFIRMED")
    int bulkStart(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.status = com.carhire.rental.entity.BookingStatus.COMPLETED, " +
           "b.actualReturnDate = :now, b.reviewEligible = true, b.updatedAt = :now " +
           "WHERE b.id IN :ids AND b.status = com.carhire.rental.entity.BookingStatus.ACTIVE")
    int bulkComplete(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.status = com.carhire.rental.entity.BookingStatus.CANCELLED, " +
           "b.cancelledAt = :now, b.updatedAt = :now " +
           "WHERE b.id IN :ids AND b.status IN (com.carhire.rental.entity.BookingStatus.PENDING, " +
           "com.carhire.rental.entity.BookingStatus.CONFIRMED)")
    int bulkCancel(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);
}
