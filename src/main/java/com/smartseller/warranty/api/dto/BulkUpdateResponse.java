package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.service.WarrantyClaimService.BulkItemResult;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-item outcome of a bulk status update.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class BulkUpdateResponse {

    private int total;
    private int succeeded;
    private int failed;
    private List<Item> results = new ArrayList<>();

    public static BulkUpdateResponse from(List<BulkItemResult> results) {
        BulkUpdateResponse response = new BulkUpdateResponse();
        response.setTotal(results.size());
        for (BulkItemResult result : results) {
            Item item = new Item();
            item.setClaimId(result.getClaimId());
            item.setSuccess(result.isSuccess());
            if (result.isSuccess()) {
                item.setStatus(result.getStatus().name().toLowerCase());
                response.succeeded++;
            } else {
                item.setError(result.getErrorKind().getCode());
                item.setMessage(result.getMessage());
                response.failed++;
            }
            response.results.add(item);
        }
        return response;
    }

    @Data
    @NoArgsConstructor
    public static class Item {
        private String claimId;
        private boolean success;
        private String status;
        private String error;
        private String message;
    }
}
