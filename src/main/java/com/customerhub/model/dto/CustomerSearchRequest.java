package com.customerhub.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Search parameters of the customer listing endpoint, in page/pageSize form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerSearchRequest {

    @Builder.Default
    private int page = 1;

    @Builder.Default
    private int pageSize = 10;

    private String search;

    private String email;

    private LocalDateTime dateFrom;

    private LocalDateTime dateTo;

    private String sortBy;

    private String sortOrder;
}
