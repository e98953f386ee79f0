package com.smartseller.warranty.service;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Generation-rate samples per running batch.
 *
 * Only the batch's aggregator records samples; pollers read a rate computed over the most recent
 * window. Samples are in memory: after a restart the rate is unknown until two new chunks commit.
 *
 * @author Warranty Platform Team
 */
@Component
public class BatchProgressTracker {

    static final int WINDOW = 10;

    private final Map<String, Deque<Sample>> samples = new ConcurrentHashMap<>();

    /**
     * Record the resolved-slot count of a batch at an instant.
     */
    public void record(String batchId, long resolvedSlots, Instant at) {
        Deque<Sample> window = samples.computeIfAbsent(batchId, id -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(new Sample(resolvedSlots, at));
            while (window.size() > WINDOW) {
                window.removeFirst();
            }
        }
    }

    /**
     * Items per second over the recent window, or null with fewer than two samples.
     */
    public Double rate(String batchId) {
        Deque<Sample> window = samples.get(batchId);
        if (window == null) {
            return null;
        }
        Sample first;
        Sample last;
        synchronized (window) {
            if (window.size() < 2) {
                return null;
            }
            first = window.peekFirst();
            last = window.peekLast();
        }
        long millis = Duration.between(first.at, last.at).toMillis();
        if (millis <= 0) {
            return null;
        }
        return (last.resolved - first.resolved) * 1000.0 / millis;
    }

    /**
     * Linear extrapolation of the completion instant, or null when the rate is unknown or zero.
     */
    public Instant estimateCompletion(String batchId, long remainingSlots, Instant now) {
        Double rate = rate(batchId);
        if (rate == null || rate <= 0.0) {
            return null;
        }
        long millis = (long) Math.ceil(remainingSlots / rate * 1000.0);
        return now.plusMillis(millis);
    }

    public void clear(String batchId) {
        samples.remove(batchId);
    }

    private static final class Sample {
        private final long resolved;
        private final Instant at;

        private Sample(long resolved, Instant at) {
            this.resolved = resolved;
            this.at = at;
        }
    }
}
