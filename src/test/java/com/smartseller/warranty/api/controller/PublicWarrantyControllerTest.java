package com.smartseller.warranty.api.controller;

import com.smartseller.warranty.api.exception.GlobalExceptionHandler;
import com.smartseller.warranty.exception.DeadlineExceededException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.service.PublicWarrantyService;
import com.smartseller.warranty.service.PublicWarrantyService.CoverageCheckResult;
import com.smartseller.warranty.service.PublicWarrantyService.LookupResult;
import com.smartseller.warranty.service.PublicWarrantyService.ProductInfo;
import com.smartseller.warranty.service.PublicWarrantyService.ValidationResult;
import com.smartseller.warranty.service.PublicWarrantyService.WarrantyInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for PublicWarrantyController using MockMvc. No authenticated user.
 */
@WebMvcTest(PublicWarrantyController.class)
@ContextConfiguration(classes = {PublicWarrantyController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("PublicWarrantyController Tests")
class PublicWarrantyControllerTest {

    private static final String BARCODE = "WB-2024-0K3J9Z2QXA";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PublicWarrantyService publicWarrantyService;

    // ========================================
    // GET /validate Tests
    // ========================================

    @Test
    @DisplayName("GET /validate - Active warranty returned with product and warranty blocks")
    void validate_Active_Returns200() throws Exception {
        // Given
        ValidationResult result = ValidationResult.builder()
                .valid(true)
                .barcodeNumber(BARCODE)
                .status("active")
                .message("Warranty is active")
                .product(ProductInfo.builder().productId("prod-0001").sku("SKU-PHONE-001").name("Phone X").build())
                .warranty(WarrantyInfo.builder().barcodeNumber(BARCODE).status("active").active(true)
                        .daysRemaining(300).warrantyPeriod("1 year").canClaim(true).build())
                .validationTime(Instant.parse("2024-07-01T12:00:00Z"))
                .build();
        when(publicWarrantyService.validate(BARCODE, "SKU-PHONE-001")).thenReturn(result);

        // When / Then
        mockMvc.perform(get("/api/v1/public/warranty/validate")
                        .param("barcode", BARCODE)
                        .param("sku", "SKU-PHONE-001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.product.sku").value("SKU-PHONE-001"))
                .andExpect(jsonPath("$.warranty.daysRemaining").value(300))
                .andExpect(jsonPath("$.warranty.warrantyPeriod").value("1 year"));
    }

    @Test
    @DisplayName("GET /validate - Unknown barcode still returns 200 with not_found in the body")
    void validate_NotFound_Returns200() throws Exception {
        // Given
        ValidationResult result = ValidationResult.builder()
                .valid(false)
                .barcodeNumber("WB-2024-NOSUCH001")
                .status("not_found")
                .message("Warranty not found")
                .build();
        when(publicWarrantyService.validate("WB-2024-NOSUCH001", null)).thenReturn(result);

        // When / Then
        mockMvc.perform(get("/api/v1/public/warranty/validate").param("barcode", "WB-2024-NOSUCH001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.status").value("not_found"))
                .andExpect(jsonPath("$.product").doesNotExist())
                .andExpect(jsonPath("$.warranty").doesNotExist());
    }

    @Test
    @DisplayName("GET /validate - Missing barcode parameter returns 400")
    void validate_MissingBarcode_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(get("/api/v1/public/warranty/validate"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors[0].field").value("barcode"));

        verifyNoInteractions(publicWarrantyService);
    }

    @Test
    @DisplayName("GET /validate - Store timeout returns 504")
    void validate_Timeout_Returns504() throws Exception {
        // Given
        when(publicWarrantyService.validate(anyString(), any()))
                .thenThrow(new DeadlineExceededException("validate", null));

        // When / Then
        mockMvc.perform(get("/api/v1/public/warranty/validate").param("barcode", BARCODE))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error").value("deadline_exceeded"));
    }

    // ========================================
    // GET /lookup Tests
    // ========================================

    @Test
    @DisplayName("GET /lookup - Purchase date parsed as ISO date")
    void lookup_Returns200() throws Exception {
        // Given
        LookupResult result = LookupResult.builder()
                .found(true)
                .warranties(List.of(WarrantyInfo.builder().barcodeNumber(BARCODE).status("active").build()))
                .build();
        when(publicWarrantyService.lookupByProduct("SKU-PHONE-001", "SN-445566", LocalDate.of(2024, 5, 30), null))
                .thenReturn(result);

        // When / Then
        mockMvc.perform(get("/api/v1/public/warranty/lookup")
                        .param("sku", "SKU-PHONE-001")
                        .param("serialNumber", "SN-445566")
                        .param("purchaseDate", "2024-05-30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.warranties", hasSize(1)));
    }

    // ========================================
    // POST /coverage Tests
    // ========================================

    @Test
    @DisplayName("POST /coverage - Excluded issue reported as not covered with estimate")
    void checkCoverage_Excluded() throws Exception {
        // Given
        CoverageCheckResult result = CoverageCheckResult.builder()
                .covered(false)
                .barcodeNumber(BARCODE)
                .issueType("water_damage")
                .estimatedCost(new BigDecimal("150.00"))
                .build();
        when(publicWarrantyService.checkCoverage(BARCODE, "water_damage", null)).thenReturn(result);

        // When / Then
        mockMvc.perform(post("/api/v1/public/warranty/coverage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"barcode\": \"" + BARCODE + "\", \"issueType\": \"water_damage\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.covered").value(false))
                .andExpect(jsonPath("$.estimatedCost").value(150.00));
    }

    @Test
    @DisplayName("POST /coverage - Masked barcode returns 404")
    void checkCoverage_Masked_Returns404() throws Exception {
        // Given
        when(publicWarrantyService.checkCoverage(anyString(), anyString(), any()))
                .thenThrow(new ResourceNotFoundException("Warranty", BARCODE));

        // When / Then
        mockMvc.perform(post("/api/v1/public/warranty/coverage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"barcode\": \"" + BARCODE + "\", \"issueType\": \"hardware\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    @DisplayName("POST /coverage - Missing issue type returns 400")
    void checkCoverage_MissingIssueType_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/public/warranty/coverage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"barcode\": \"" + BARCODE + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors[0].field").value("issueType"));
    }
}
