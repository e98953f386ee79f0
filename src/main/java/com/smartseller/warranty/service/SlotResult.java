package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.CollisionRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of resolving one batch slot: either an accepted string, or a failure after the
 * retry budget ran out. Carries the collision records written along the way.
 *
 * @author Warranty Platform Team
 */
public final class SlotResult {

    private final int slotIndex;
    private final String barcode;
    private final int attempt;
    private final List<CollisionRecord> collisions;
    private final String error;

    private SlotResult(int slotIndex, String barcode, int attempt, List<CollisionRecord> collisions, String error) {
        this.slotIndex = slotIndex;
        this.barcode = barcode;
        this.attempt = attempt;
        this.collisions = Collections.unmodifiableList(new ArrayList<>(collisions));
        this.error = error;
    }

    public static SlotResult accepted(int slotIndex, String barcode, int attempt, List<CollisionRecord> collisions) {
        return new SlotResult(slotIndex, barcode, attempt, collisions, null);
    }

    public static SlotResult failed(int slotIndex, int attempt, List<CollisionRecord> collisions, String error) {
        return new SlotResult(slotIndex, null, attempt, collisions, error);
    }

    public boolean isAccepted() {
        return barcode != null;
    }

    public int getSlotIndex() { return slotIndex; }
    public String getBarcode() { return barcode; }
    public int getAttempt() { return attempt; }
    public List<CollisionRecord> getCollisions() { return collisions; }
    public String getError() { return error; }
}
