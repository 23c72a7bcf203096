package com.purchasingpower.policyflow.repository;

import com.purchasingpower.policyflow.model.SequenceCounter;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SequenceCounterRepository extends JpaRepository<SequenceCounter, String> {

    /**
     * Load a counter row and hold a write lock on it until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM SequenceCounter c WHERE c.sequenceKey = :key")
    Optional<SequenceCounter> findForUpdate(@Param("key") String key);
}
