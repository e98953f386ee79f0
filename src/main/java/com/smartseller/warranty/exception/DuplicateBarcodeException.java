package com.smartseller.warranty.exception;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Raised by the record store when the unique index on barcode strings rejects a write.
 * The collision detector reacts to it; it never reaches API callers.
 *
 * @author Warranty Platform Team
 */
public class DuplicateBarcodeException extends RuntimeException {

    private final Set<String> duplicates;

    public DuplicateBarcodeException(Set<String> duplicates, Throwable cause) {
        super(String.format("%d barcode(s) already exist in the store", duplicates.size()), cause);
        this.duplicates = Collections.unmodifiableSet(new LinkedHashSet<>(duplicates));
    }

    /**
     * Offending strings, when they could be determined. May be empty.
     */
    public Set<String> getDuplicates() {
        return duplicates;
    }
}
