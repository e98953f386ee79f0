package com.smartseller.warranty.service;

import org.springframework.stereotype.Component;

/**
 * Default generator: the payload is the low 48 bits of a SplitMix64 mix of the batch seed and
 * the attempt counter, rendered as 10 base36 characters.
 *
 * @author Warranty Platform Team
 */
@Component
public class EntropyBarcodeGenerator implements BarcodeGenerator {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    @Override
    public String generate(String prefix, int year, long seed, long counter) {
        long mixed = mix(seed + (counter + 1) * GOLDEN_GAMMA);
        String payload = BarcodeFormat.base36(mixed & BarcodeFormat.PAYLOAD_MASK, BarcodeFormat.PAYLOAD_LENGTH);
        return BarcodeFormat.compose(prefix, year, payload);
    }

    static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
