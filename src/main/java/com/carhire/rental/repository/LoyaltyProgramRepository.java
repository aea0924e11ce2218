package com.carhire.rental.repository;

import com.carhire.rental.entity.LoyaltyProgram;
import com.carhire.rental.entity.LoyaltyTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LoyaltyProgramRepository extends JpaRepository<LoyaltyProgram, Long> {

    Optional<LoyaltyProgram> findByTierAndActiveTrue(LoyaltyTier tier);

    List<LoyaltyProgram> findByActiveTrueOrderByMinPointsRequiredDesc();
}
