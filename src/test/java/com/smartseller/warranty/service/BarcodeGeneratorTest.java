package com.smartseller.warranty.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for barcode format helpers and the default generator.
 */
@DisplayName("Barcode Generation Tests")
class BarcodeGeneratorTest {

    private final EntropyBarcodeGenerator generator = new EntropyBarcodeGenerator();

    // ========================================
    // BarcodeFormat Tests
    // ========================================

    @Test
    @DisplayName("Format accepts prefix, year and 8-16 char payload")
    void formatValidation() {
        assertThat(BarcodeFormat.isValid("WB-2024-A1B2C3D4E5")).isTrue();
        assertThat(BarcodeFormat.isValid("WARRANTY-2024-ABCDEFGH")).isTrue();
        assertThat(BarcodeFormat.isValid("wb-2024-A1B2C3D4E5")).isFalse();
        assertThat(BarcodeFormat.isValid("W-2024-A1B2C3D4E5")).isFalse();
        assertThat(BarcodeFormat.isValid("WB-24-A1B2C3D4E5")).isFalse();
        assertThat(BarcodeFormat.isValid("WB-2024-SHORT")).isFalse();
        assertThat(BarcodeFormat.isValid(null)).isFalse();
    }

    @Test
    @DisplayName("Prefix must be 2-10 upper-case letters")
    void prefixValidation() {
        assertThat(BarcodeFormat.isValidPrefix("WB")).isTrue();
        assertThat(BarcodeFormat.isValidPrefix("ABCDEFGHIJ")).isTrue();
        assertThat(BarcodeFormat.isValidPrefix("ABCDEFGHIJK")).isFalse();
        assertThat(BarcodeFormat.isValidPrefix("W1")).isFalse();
        assertThat(BarcodeFormat.isValidPrefix("wb")).isFalse();
    }

    @Test
    @DisplayName("Every (slot, attempt) pair maps to a distinct counter")
    void countersAreDistinct() {
        Set<Long> counters = new HashSet<>();
        int maxRetries = 3;
        for (int slot = 0; slot < 100; slot++) {
            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                counters.add(BarcodeFormat.counterFor(slot, attempt, maxRetries));
            }
        }
        assertThat(counters).hasSize(400);
    }

    @Test
    @DisplayName("Base36 pads to width and upper-cases")
    void base36Padding() {
        assertThat(BarcodeFormat.base36(35, 4)).isEqualTo("000Z");
        assertThat(BarcodeFormat.base36(36, 2)).isEqualTo("10");
    }

    // ========================================
    // EntropyBarcodeGenerator Tests
    // ========================================

    @Test
    @DisplayName("Generator output matches the barcode format")
    void generatedStringsAreValid() {
        for (long counter = 0; counter < 1000; counter++) {
            String barcode = generator.generate("WB", 2024, 42L, counter);
            assertThat(BarcodeFormat.isValid(barcode)).as(barcode).isTrue();
            assertThat(barcode).startsWith("WB-2024-");
        }
    }

    @Test
    @DisplayName("Same inputs give the same string")
    void generatorIsDeterministic() {
        assertThat(generator.generate("WB", 2024, 7L, 99L))
                .isEqualTo(generator.generate("WB", 2024, 7L, 99L));
    }

    @Test
    @DisplayName("Different seeds and counters spread out")
    void generatorSpreadsOutput() {
        Set<String> seen = new HashSet<>();
        for (long counter = 0; counter < 10_000; counter++) {
            seen.add(generator.generate("WB", 2024, 1L, counter));
        }
        assertThat(seen).hasSize(10_000);
        assertThat(generator.generate("WB", 2024, 1L, 0L))
                .isNotEqualTo(generator.generate("WB", 2024, 2L, 0L));
    }
}
