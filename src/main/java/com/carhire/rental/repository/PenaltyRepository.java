package com.carhire.rental.repository;

import com.carhire.rental.entity.Penalty;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PenaltyRepository extends JpaRepository<Penalty, Long> {

    List<Penalty> findByBookingIdOrderByCreatedAtDesc(Long bookingId);

    List<Penalty> findByCustomerIdOrderByCreatedAtDesc(Long customerId);
}
