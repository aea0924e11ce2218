package com.carhire.rental.repository;

import com.carhire.rental.entity.ReferenceSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ReferenceSequenceRepository extends JpaRepository<ReferenceSequence, Long> {

    /**
     * SELECT ... FOR UPDATE on the counter row of a scope. Holders of the
     * lock are serialised until their transaction ends, so two callers can
     * never read the same last value.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ReferenceSequence s WHERE s.scopeKey = :scopeKey")
    Optional<ReferenceSequence> findByScopeKeyForUpdate(@Param("scopeKey") String scopeKey);
}
