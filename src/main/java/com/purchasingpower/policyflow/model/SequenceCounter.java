package com.purchasingpower.policyflow.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Last value handed out for one (collection, field) sequence.
 *
 * Read under a pessimistic write lock so two allocations cannot observe the
 * same value.
 *
 * Table: SEQUENCE_COUNTERS
 */
@Entity
@Table(name = "SEQUENCE_COUNTERS")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SequenceCounter {

    /**
     * {@code collection:field}
     */
    @Id
    @Column(name = "sequence_key", length = 200)
    private String sequenceKey;

    @Column(name = "last_value", nullable = false)
    private Long lastValue;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
