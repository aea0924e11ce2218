package com.carhire.rental.repository;

import com.carhire.rental.entity.BookingAddOn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BookingAddOnRepository extends JpaRepository<BookingAddOn, Long> {

    List<BookingAddOn> findByActiveTrueOrderByName();
}
