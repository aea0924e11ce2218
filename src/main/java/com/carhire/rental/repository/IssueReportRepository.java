package com.carhire.rental.repository;

import com.carhire.rental.entity.IssueReport;
import com.carhire.rental.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface IssueReportRepository extends JpaRepository<IssueReport, Long> {

    List<IssueReport> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    List<IssueReport> findAllByOrderByCreatedAtDesc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IssueReport i SET i.status = com.carhire.rental.entity.IssueStatus.IN_PROGRESS, i.updatedAt = :now " +
           "WHERE i.id IN :ids AND i.status IN (com.carhire.rental.entity.IssueStatus.OPEN, " +
           "com.carhire.rental.entity.IssueStatus.ESCALATED)")
    int bulkMarkInProgress(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IssueReport i SET i.status = com.carhire.rental.entity.IssueStatus.RESOLVED, " +
           "i.resolutionDate = :now, i.resolvedBy = :staff, i.updatedAt = :now " +
           "WHERE i.id IN :ids AND i.status NOT IN (com.carhire.rental.entity.IssueStatus.RESOLVED, " +
           "com.carhire.rental.entity.IssueStatus.CLOSED)")
    int bulkMarkResolved(@Param("ids") Collection<Long> ids,
                         @Param("staff") User staff,
                         @Param("now") LocalDateTime now);
}
