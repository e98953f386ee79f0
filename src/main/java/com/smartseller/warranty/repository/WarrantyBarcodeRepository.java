package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for WarrantyBarcode entity.
 * The unique index on barcode_number is the final arbiter of barcode uniqueness.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface WarrantyBarcodeRepository extends JpaRepository<WarrantyBarcode, String> {

    Optional<WarrantyBarcode> findByBarcodeNumber(String barcodeNumber);

    /**
     * Find barcode with pessimistic write lock.
     * Claim submission holds it until commit, so only one open claim can be inserted per barcode.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM WarrantyBarcode b WHERE b.barcodeNumber = :barcodeNumber")
    Optional<WarrantyBarcode> findByBarcodeNumberForUpdate(@Param("barcodeNumber") String barcodeNumber);

    boolean existsByBarcodeNumber(String barcodeNumber);

    /**
     * Which of the given strings are already persisted.
     * Used to pinpoint the offenders after a bulk insert hits the unique index.
     *
     * @param barcodeNumbers Candidate strings
     * @return Subset that already exists
     */
    @Query("SELECT b.barcodeNumber FROM WarrantyBarcode b WHERE b.barcodeNumber IN :barcodeNumbers")
    List<String> findExistingBarcodeNumbers(@Param("barcodeNumbers") Collection<String> barcodeNumbers);

    Page<WarrantyBarcode> findByBatchIdOrderByCreatedAtAsc(String batchId, Pageable pageable);

    long countByBatchId(String batchId);

    /**
     * Activate a barcode with compare-and-set on status = GENERATED.
     * Serializes concurrent activations: exactly one caller sees 1 row updated.
     *
     * @return Number of rows updated (0 if the barcode was not in GENERATED state)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE WarrantyBarcode b SET " +
           "b.status = :active, " +
           "b.activatedAt = :activatedAt, " +
           "b.expiryDate = :expiryDate, " +
           "b.warrantyPeriodMonths = :periodMonths, " +
           "b.customerId = :customerId, " +
           "b.customerEmail = :customerEmail, " +
           "b.purchaseDate = :purchaseDate, " +
           "b.purchaseRetailer = :retailer, " +
           "b.purchaseInvoice = :invoice, " +
           "b.serialNumber = :serialNumber, " +
           "b.purchasePrice = :purchasePrice, " +
           "b.updatedAt = :activatedAt, " +
           "b.version = b.version + 1 " +
           "WHERE b.barcodeId = :barcodeId AND b.status = :expected")
    int activateIfGenerated(
            @Param("barcodeId") String barcodeId,
            @Param("active") BarcodeStatus active,
            @Param("expected") BarcodeStatus expected,
            @Param("activatedAt") Instant activatedAt,
            @Param("expiryDate") Instant expiryDate,
            @Param("periodMonths") Integer periodMonths,
            @Param("customerId") String customerId,
            @Param("customerEmail") String customerEmail,
            @Param("purchaseDate") LocalDate purchaseDate,
            @Param("retailer") String retailer,
            @Param("invoice") String invoice,
            @Param("serialNumber") String serialNumber,
            @Param("purchasePrice") BigDecimal purchasePrice
    );

    /**
     * Compare-and-set status change used for revoke and claim consumption.
     *
     * @return Number of rows updated
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE WarrantyBarcode b SET b.status = :target, b.updatedAt = :updatedAt, b.version = b.version + 1 " +
           "WHERE b.barcodeId = :barcodeId AND b.status = :expected")
    int updateStatusIfCurrent(
            @Param("barcodeId") String barcodeId,
            @Param("expected") BarcodeStatus expected,
            @Param("target") BarcodeStatus target,
            @Param("updatedAt") Instant updatedAt
    );

    /**
     * Public lookup by product with optional narrowing filters.
     * Generated barcodes are never returned: they carry no warranty yet.
     */
    @Query("SELECT b FROM WarrantyBarcode b WHERE b.productId = :productId " +
           "AND b.status <> :excluded " +
           "AND (:serialNumber IS NULL OR b.serialNumber = :serialNumber) " +
           "AND (:purchaseDate IS NULL OR b.purchaseDate = :purchaseDate) " +
           "AND (:email IS NULL OR LOWER(b.customerEmail) = LOWER(:email)) " +
           "ORDER BY b.activatedAt DESC")
    List<WarrantyBarcode> findForProductLookup(
            @Param("productId") String productId,
            @Param("excluded") BarcodeStatus excluded,
            @Param("serialNumber") String serialNumber,
            @Param("purchaseDate") LocalDate purchaseDate,
            @Param("email") String email
    );

    List<WarrantyBarcode> findByCustomerIdOrderByActivatedAtDesc(String customerId);
}
