package com.smartseller.warranty.service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Barcode string format and the arithmetic shared by generation and validation.
 *
 * @author Warranty Platform Team
 */
public final class BarcodeFormat {

    public static final Pattern BARCODE_PATTERN = Pattern.compile("^[A-Z]{2,10}-\\d{4}-[0-9A-Z]{8,16}$");
    public static final Pattern PREFIX_PATTERN = Pattern.compile("^[A-Z]{2,10}$");

    public static final int PAYLOAD_LENGTH = 10;
    static final long PAYLOAD_MASK = (1L << 48) - 1;

    private BarcodeFormat() {
    }

    public static boolean isValid(String barcode) {
        return barcode != null && BARCODE_PATTERN.matcher(barcode).matches();
    }

    public static boolean isValidPrefix(String prefix) {
        return prefix != null && PREFIX_PATTERN.matcher(prefix).matches();
    }

    /**
     * Counter for an attempt of a slot. Every (slot, attempt) pair of a batch maps to a distinct counter.
     */
    public static long counterFor(int slotIndex, int attempt, int maxRetries) {
        return (long) slotIndex * (maxRetries + 1) + attempt;
    }

    /**
     * Upper-case base36 of a non-negative value, left-padded with zeros.
     */
    public static String base36(long value, int width) {
        String digits = Long.toString(value, 36).toUpperCase(Locale.ROOT);
        if (digits.length() >= width) {
            return digits;
        }
        StringBuilder padded = new StringBuilder(width);
        for (int i = digits.length(); i < width; i++) {
            padded.append('0');
        }
        return padded.append(digits).toString();
    }

    public static String compose(String prefix, int year, String payload) {
        return prefix + "-" + String.format("%04d", year) + "-" + payload;
    }
}
