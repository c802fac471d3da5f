package com.customerhub.util;

import com.customerhub.model.dto.CustomerResponse;
import com.customerhub.model.dto.PagedResponse;
import com.customerhub.model.entity.Customer;
import com.customerhub.query.CustomerPage;

import java.util.stream.Collectors;

/**
 * Utility class for converting customer entities to response DTOs.
 */
public final class CustomerMapper {

    private CustomerMapper() {
    }

    /**
     * Convert an entity to its public shape. Deletion flag and actors stay internal.
     *
     * @param customer The customer entity
     * @return Customer response DTO
     */
    public static CustomerResponse toResponse(Customer customer) {
        return CustomerResponse.builder()
                .id(customer.getId())
                .name(customer.getName())
                .email(customer.getEmail())
                .phone(customer.getPhone())
                .address(customer.getAddress())
                .createdAt(customer.getCreatedAt())
                .updatedAt(customer.getUpdatedAt())
                .build();
    }

    /**
     * Wrap a listing window in the paginated envelope.
     *
     * @param page The listing window
     * @param pageNumber 1-based page number that produced the window
     * @param pageSize Requested page size
     * @return Paginated response
     */
    public static PagedResponse<CustomerResponse> toPagedResponse(CustomerPage page, int pageNumber, int pageSize) {
        return PagedResponse.<CustomerResponse>builder()
                .items(page.getItems().stream()
                        .map(CustomerMapper::toResponse)
                        .collect(Collectors.toList()))
                .totalCount(page.getTotalCount())
                .page(pageNumber)
                .pageSize(pageSize)
                .totalPages(totalPages(page.getTotalCount(), pageSize))
                .build();
    }

    /**
     * Number of pages needed for {@code totalCount} items.
     */
    public static int totalPages(long totalCount, int pageSize) {
        if (pageSize <= 0) {
            return 0;
        }
        return (int) ((totalCount + pageSize - 1) / pageSize);
    }
}
