package com.customerhub.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for generating random customers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkCreateRequest {

    @NotNull(message = "Count is required")
    @Min(value = 1, message = "Count must be between 1 and 1000")
    @Max(value = 1000, message = "Count must be between 1 and 1000")
    private Integer count;
}
