package com.customerhub.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for a bulk creation.
 * successCount + failureCount always equals the requested count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkCreateResponse {

    private int successCount;

    private int failureCount;

    @Builder.Default
    private List<CustomerResponse> createdCustomers = new ArrayList<>();

    @Builder.Default
    private List<BulkCreateError> errors = new ArrayList<>();
}
