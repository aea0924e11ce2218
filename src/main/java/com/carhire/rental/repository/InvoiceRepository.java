package com.carhire.rental.repository;

import com.carhire.rental.entity.Invoice;
import com.carhire.rental.entity.InvoiceStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    Optional<Invoice> findByInvoiceNumber(String invoiceNumber);

    List<Invoice> findByBookingIdOrderByCreatedAtDesc(Long bookingId);

    List<Invoice> findByBookingIdAndStatusIn(Long bookingId, Collection<InvoiceStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Invoice i SET i.status = com.carhire.rental.entity.InvoiceStatus.PAID, " +
           "i.paidAmount = i.totalAmount, i.updatedAt = :now " +
           "WHERE i.id IN :ids AND i.status <> com.carhire.rental.entity.InvoiceStatus.CANCELLED")
    int bulkMarkPaid(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    /**
     * Past-due invoices among {@code ids} that are neither paid nor cancelled become OVERDUE.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Invoice i SET i.status = com.carhire.rental.entity.InvoiceStatus.OVERDUE, i.updatedAt = :now " +
           "WHERE i.id IN :ids AND i.dueDate < :today " +
           "AND i.status NOT IN (com.carhire.rental.entity.InvoiceStatus.PAID, " +
           "com.carhire.rental.entity.InvoiceStatus.CANCELLED, com.carhire.rental.entity.InvoiceStatus.OVERDUE)")
    int bulkMarkOverdue(@Param("ids") Collection<Long> ids,
                        @Param("today") LocalDate today,
                        @Param("now") LocalDateTime now);

    /** Same rule as {@link #bulkMarkOverdue} over every invoice; used by the scheduled sweep. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Invoice i SET i.status = com.carhire.rental.entity.InvoiceStatus.OVERDUE, i.updatedAt = :now " +
           "WHERE i.dueDate < :today " +
           "AND i.status NOT IN (com.carhire.rental.entity.InvoiceStatus.PAID, " +
           "com.carhire.rental.entity.InvoiceStatus.CANCELLED, com.carhire.rental.entity.InvoiceStatus.OVERDUE)")
    int markAllOverdue(@Param("today") LocalDate today, @Param("now") LocalDateTime now);
}
