package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.NumberSequence;
import com.smartseller.warranty.repository.NumberSequenceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.ZoneOffset;

/**
 * Human-readable numbers of the form {@code <NAME>-<YYYY>-<6 digits>}, one counter per name and year.
 *
 * Each number is drawn in its own short transaction under a row lock, so callers never hold the
 * counter while their own work runs. A rolled-back caller leaves a gap.
 *
 * @author Warranty Platform Team
 */
@Service
public class NumberSequenceService {

    private static final Logger logger = LoggerFactory.getLogger(NumberSequenceService.class);

    public static final String CLAIM = "WAR";
    public static final String REPAIR_TICKET = "RPR";
    public static final String BATCH = "BATCH";

    /** Largest value that still fits the six digit suffix. */
    static final long MAX_VALUE = 999_999L;

    private final NumberSequenceRepository sequenceRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public NumberSequenceService(
            NumberSequenceRepository sequenceRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.sequenceRepository = sequenceRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Draw the next number for a sequence in the current year.
     *
     * @param name Sequence name (WAR, RPR, BATCH)
     * @return Formatted number, e.g. WAR-2024-000001
     */
    public String next(String name) {
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        String key = name + ":" + year;
        long value;
        try {
            value = draw(key);
        } catch (DataIntegrityViolationException e) {
            // Another instance created the counter row first
            logger.debug("Sequence {} created concurrently, retrying", key);
            value = draw(key);
        }
        return format(name, year, value);
    }

    /**
     * @throws IllegalStateException if the value no longer fits six digits
     */
    public static String format(String name, int year, long value) {
        if (value < 1 || value > MAX_VALUE) {
            throw new IllegalStateException("Sequence " + name + "-" + year + " out of range: " + value);
        }
        return String.format("%s-%04d-%06d", name, year, value);
    }

    private long draw(String key) {
        Long value = transactionTemplate.execute(status -> {
            NumberSequence sequence = sequenceRepository.findByKeyForUpdate(key).orElse(null);
            if (sequence == null) {
                sequenceRepository.saveAndFlush(NumberSequence.builder()
                        .sequenceKey(key)
                        .nextValue(2L)
                        .build());
                return 1L;
            }
            long current = sequence.getNextValue();
            if (current > MAX_VALUE) {
                logger.error("Sequence {} exhausted at {}", key, MAX_VALUE);
                throw new IllegalStateException("Sequence " + key + " exhausted");
            }
            sequence.setNextValue(current + 1);
            sequenceRepository.save(sequence);
            return current;
        });
        return value;
    }
}
