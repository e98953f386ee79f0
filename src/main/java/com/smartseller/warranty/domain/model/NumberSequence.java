package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-year counter behind human-readable numbers (WAR-, RPR-, BATCH-).
 * Keyed by "{name}:{year}" and read under a pessimistic lock.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "number_sequences")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NumberSequence {

    @Id
    @Column(name = "sequence_key", nullable = false, length = 50)
    private String sequenceKey;

    @Column(name = "next_value", nullable = false)
    private Long nextValue;

    @Version
    @Column(name = "version")
    private Long version;
}
