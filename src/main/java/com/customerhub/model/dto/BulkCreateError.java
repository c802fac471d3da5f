package com.customerhub.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A failed item of a bulk creation, identified by its position in the batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkCreateError {
    private int index;
    private String message;
}
