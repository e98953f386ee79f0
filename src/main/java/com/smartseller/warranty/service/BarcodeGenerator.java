package com.smartseller.warranty.service;

/**
 * Produces candidate barcode strings of the form {@code <PREFIX>-<YYYY>-<payload>}.
 *
 * Implementations are pure: the same inputs always give the same string, and they hold no state.
 *
 * @author Warranty Platform Team
 */
public interface BarcodeGenerator {

    /**
     * @param prefix  upper-case prefix, 2-10 letters
     * @param year    four-digit year
     * @param seed    per-batch entropy seed
     * @param counter attempt counter, see {@link BarcodeFormat#counterFor(int, int, int)}
     * @return candidate barcode string
     */
    String generate(String prefix, int year, long seed, long counter);
}
