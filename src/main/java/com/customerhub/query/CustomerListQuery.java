package com.customerhub.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Parameters of a customer listing, already translated from page/pageSize
 * to an offset window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerListQuery {

    private long skip;

    @Builder.Default
    private int take = 10;

    private String searchTerm;

    private String emailFilter;

    private LocalDateTime dateFrom;

    private LocalDateTime dateTo;

    private String sortBy;

    private String sortOrder;
}
