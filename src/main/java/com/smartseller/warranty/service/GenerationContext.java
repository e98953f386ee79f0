package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.BarcodeBatch;

import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run generation parameters of a batch plus the set of strings accepted so far.
 * Shared by all workers of the run; the accepted set is concurrent and the first add wins.
 *
 * @author Warranty Platform Team
 */
public class GenerationContext {

    private final String batchId;
    private final String prefix;
    private final int year;
    private final long seed;
    private final int maxRetries;
    private final Set<String> accepted = ConcurrentHashMap.newKeySet();

    public GenerationContext(String batchId, String prefix, int year, long seed, int maxRetries) {
        this.batchId = batchId;
        this.prefix = prefix;
        this.year = year;
        this.seed = seed;
        this.maxRetries = maxRetries;
    }

    public static GenerationContext forBatch(BarcodeBatch batch) {
        int year = batch.getCreatedAt().atZone(ZoneOffset.UTC).getYear();
        return new GenerationContext(batch.getBatchId(), batch.getPrefix(), year,
                batch.getEntropySeed(), batch.getMaxRetries());
    }

    /**
     * Claim a string for this batch.
     *
     * @return true if no other slot of the batch holds it
     */
    public boolean tryAccept(String candidate) {
        return accepted.add(candidate);
    }

    public void release(String candidate) {
        accepted.remove(candidate);
    }

    public String getBatchId() { return batchId; }
    public String getPrefix() { return prefix; }
    public int getYear() { return year; }
    public long getSeed() { return seed; }
    public int getMaxRetries() { return maxRetries; }
}
