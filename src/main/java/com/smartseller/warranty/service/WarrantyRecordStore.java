package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.BarcodeBatch;
import com.smartseller.warranty.domain.model.CollisionRecord;
import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;
import com.smartseller.warranty.exception.ConflictException;
import com.smartseller.warranty.exception.DuplicateBarcodeException;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidStateException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.repository.BarcodeBatchRepository;
import com.smartseller.warranty.repository.CollisionRecordRepository;
import com.smartseller.warranty.repository.WarrantyBarcodeRepository;
import com.smartseller.warranty.security.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Warranty record store: the persistence boundary for barcodes and batch progress.
 *
 * The unique index on the barcode string is the source of truth for uniqueness. Violations are
 * surfaced as {@link DuplicateBarcodeException} naming the offending strings, so the collision
 * detector can regenerate them.
 *
 * Chunk commits run in their own transaction: barcodes, collision records and the batch counters
 * of one chunk become visible together or not at all.
 *
 * @author Warranty Platform Team
 */
@Service
public class WarrantyRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(WarrantyRecordStore.class);

    private final WarrantyBarcodeRepository barcodeRepository;
    private final BarcodeBatchRepository batchRepository;
    private final CollisionRecordRepository collisionRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public WarrantyRecordStore(
            WarrantyBarcodeRepository barcodeRepository,
            BarcodeBatchRepository batchRepository,
            CollisionRecordRepository collisionRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.barcodeRepository = barcodeRepository;
        this.batchRepository = batchRepository;
        this.collisionRepository = collisionRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Persist a single barcode.
     *
     * @throws DuplicateBarcodeException if the string already exists
     */
    public WarrantyBarcode createBarcode(WarrantyBarcode barcode) {
        return bulkCreateBarcodes(List.of(barcode)).get(0);
    }

    /**
     * Persist barcodes in one transaction.
     *
     * @throws DuplicateBarcodeException if any string already exists; nothing is persisted
     */
    public List<WarrantyBarcode> bulkCreateBarcodes(List<WarrantyBarcode> barcodes) {
        try {
            return transactionTemplate.execute(status -> barcodeRepository.saveAllAndFlush(barcodes));
        } catch (DataIntegrityViolationException e) {
            throw translateDuplicate(barcodes, e);
        }
    }

    /**
     * Apply one commit chunk of a batch: insert the accepted barcodes, write the collision records
     * and add the chunk's counts to the batch row under a pessimistic lock.
     *
     * @param batchId     Batch ID
     * @param barcodes    Accepted barcodes of the chunk
     * @param collisions  Collision records produced for the chunk's slots
     * @param failedSlots Slots of the chunk that exhausted their retry budget
     * @param lastError   Last slot error of the chunk, or null
     * @return Batch row after the counters were applied
     * @throws DuplicateBarcodeException if a barcode of the chunk is already persisted
     */
    public BarcodeBatch commitChunk(
            String batchId,
            List<WarrantyBarcode> barcodes,
            List<CollisionRecord> collisions,
            int failedSlots,
            String lastError
    ) {
        try {
            return transactionTemplate.execute(status -> {
                if (!barcodes.isEmpty()) {
                    barcodeRepository.saveAllAndFlush(barcodes);
                }
                if (!collisions.isEmpty()) {
                    collisionRepository.saveAll(collisions);
                }

                BarcodeBatch batch = batchRepository.findByIdForUpdate(batchId)
                        .orElseThrow(() -> new ResourceNotFoundException("BarcodeBatch", batchId));
                batch.setGeneratedCount(batch.getGeneratedCount() + barcodes.size() + failedSlots);
                batch.setSuccessfulCount(batch.getSuccessfulCount() + barcodes.size());
                batch.setFailedCount(batch.getFailedCount() + failedSlots);
                batch.setErrorCount(batch.getErrorCount() + failedSlots);
                batch.setCollisionCount(batch.getCollisionCount() + collisions.size());
                if (lastError != null) {
                    batch.setLastError(lastError);
                }
                batch.setUpdatedAt(clock.instant());
                return batchRepository.save(batch);
            });
        } catch (DataIntegrityViolationException e) {
            throw translateDuplicate(barcodes, e);
        }
    }

    /**
     * Count a transient chunk failure against the batch.
     */
    public void incrementRetryCount(String batchId) {
        transactionTemplate.executeWithoutResult(status -> {
            BarcodeBatch batch = batchRepository.findByIdForUpdate(batchId)
                    .orElseThrow(() -> new ResourceNotFoundException("BarcodeBatch", batchId));
            batch.setRetryCount(batch.getRetryCount() + 1);
            batch.setUpdatedAt(clock.instant());
            batchRepository.save(batch);
        });
    }

    public boolean exists(String barcodeNumber) {
        return barcodeRepository.existsByBarcodeNumber(barcodeNumber);
    }

    public Optional<WarrantyBarcode> getByString(String barcodeNumber) {
        return barcodeRepository.findByBarcodeNumber(barcodeNumber);
    }

    public WarrantyBarcode getById(String barcodeId) {
        return barcodeRepository.findById(barcodeId)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyBarcode", barcodeId));
    }

    /**
     * Lock the barcode row for the rest of the caller's transaction.
     * Claim submission serializes on it so the open-claim check and the insert are atomic.
     */
    public Optional<WarrantyBarcode> lockForClaim(String barcodeNumber) {
        return barcodeRepository.findByBarcodeNumberForUpdate(barcodeNumber);
    }

    public Page<WarrantyBarcode> listByBatch(String batchId, Pageable pageable) {
        return barcodeRepository.findByBatchIdOrderByCreatedAtAsc(batchId, pageable);
    }

    /**
     * Move a barcode between statuses with compare-and-set on the expected current status.
     *
     * @throws InvalidStateException if the move is not a legal barcode transition
     * @throws ConflictException if the barcode left the expected status concurrently
     */
    public void updateStatus(String barcodeId, BarcodeStatus expected, BarcodeStatus target) {
        if (!expected.canMoveTo(target)) {
            throw new InvalidStateException("WarrantyBarcode", barcodeId, expected.name(),
                    legalTargets(expected), String.format("Cannot move barcode from %s to %s", expected, target));
        }
        int updated = transactionTemplate.execute(status ->
                barcodeRepository.updateStatusIfCurrent(barcodeId, expected, target, clock.instant()));
        if (updated == 0) {
            throw new ConflictException("status_changed",
                    String.format("Barcode %s is no longer %s", barcodeId, expected));
        }
        logger.info("Barcode {} moved from {} to {}", barcodeId, expected, target);
    }

    /**
     * Activate a barcode with compare-and-set on status = GENERATED.
     *
     * @return true if this call activated the barcode, false if it was no longer GENERATED
     */
    public boolean activate(String barcodeId, ActivationRecord record) {
        Instant expiry = WarrantyBarcode.computeExpiry(record.getActivatedAt(), record.getPeriodMonths());
        Integer updated = transactionTemplate.execute(status -> barcodeRepository.activateIfGenerated(
                barcodeId,
                BarcodeStatus.ACTIVE,
                BarcodeStatus.GENERATED,
                record.getActivatedAt(),
                expiry,
                record.getPeriodMonths(),
                record.getCustomerId(),
                record.getCustomerEmail(),
                record.getPurchaseDate(),
                record.getRetailer(),
                record.getInvoiceNumber(),
                record.getSerialNumber(),
                record.getPurchasePrice()
        ));
        return updated != null && updated == 1;
    }

    /**
     * Revoke a barcode. Administrators only; a reason is required.
     */
    public WarrantyBarcode revoke(String barcodeId, String reason, Actor actor) {
        if (!actor.isAdmin()) {
            throw new ForbiddenException("Only administrators can revoke barcodes");
        }
        if (reason == null || reason.isBlank()) {
            throw new InvalidArgumentException("reason", "Revocation reason is required", reason);
        }
        WarrantyBarcode revoked = transactionTemplate.execute(status -> {
            WarrantyBarcode barcode = getById(barcodeId);
            if (!barcode.getStatus().canMoveTo(BarcodeStatus.REVOKED)) {
                throw new InvalidStateException("WarrantyBarcode", barcodeId, barcode.getStatus().name(),
                        legalTargets(barcode.getStatus()), "Barcode cannot be revoked in status " + barcode.getStatus());
            }
            Instant now = clock.instant();
            barcode.setStatus(BarcodeStatus.REVOKED);
            barcode.setRevokedAt(now);
            barcode.setRevocationReason(reason);
            barcode.setUpdatedAt(now);
            return barcodeRepository.save(barcode);
        });
        logger.info("Barcode {} revoked by {}: {}", barcodeId, actor, reason);
        return revoked;
    }

    private DuplicateBarcodeException translateDuplicate(List<WarrantyBarcode> barcodes, DataIntegrityViolationException e) {
        List<String> candidates = barcodes.stream()
                .map(WarrantyBarcode::getBarcodeNumber)
                .collect(Collectors.toList());
        Set<String> duplicates = new HashSet<>(findExisting(candidates));
        if (duplicates.isEmpty()) {
            // Not a barcode uniqueness failure
            throw e;
        }
        logger.warn("Unique index rejected {} of {} barcodes", duplicates.size(), barcodes.size());
        return new DuplicateBarcodeException(duplicates, e);
    }

    private List<String> findExisting(Collection<String> candidates) {
        if (candidates.isEmpty()) {
            return new ArrayList<>();
        }
        return barcodeRepository.findExistingBarcodeNumbers(candidates);
    }

    private static List<String> legalTargets(BarcodeStatus from) {
        List<String> targets = new ArrayList<>();
        for (BarcodeStatus candidate : BarcodeStatus.values()) {
            if (from.canMoveTo(candidate)) {
                targets.add(candidate.name());
            }
        }
        return targets;
    }
}
