package com.customerhub.service;

import com.customerhub.exception.ResourceNotFoundException;
import com.customerhub.model.dto.CustomerCreateRequest;
import com.customerhub.model.dto.CustomerResponse;
import com.customerhub.model.dto.CustomerSearchRequest;
import com.customerhub.model.dto.CustomerUpdateRequest;
import com.customerhub.model.dto.PagedResponse;
import com.customerhub.model.entity.Customer;
import com.customerhub.query.CustomerListQuery;
import com.customerhub.query.CustomerQueryEngine;
import com.customerhub.store.CustomerStore;
import com.customerhub.util.CustomerMapper;
import com.customerhub.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Service for customer lifecycle: create, read, search, update, soft delete.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerService {

    private static final String RESOURCE = "Customer";

    private final CustomerStore customerStore;
    private final CustomerQueryEngine queryEngine;
    private final EmailUniquenessGuard uniquenessGuard;
    private final SoftDeleteManager softDeleteManager;
    private final CustomerValidator validator;
    private final Clock clock;

    /**
     * Create a customer.
     *
     * @param request Customer data
     * @param actor Who creates it, may be null
     * @return The created customer
     */
    public Mono<CustomerResponse> createCustomer(CustomerCreateRequest request, String actor) {
        return validator.validate(request)
                .flatMap(valid -> uniquenessGuard.ensureAvailable(valid.getEmail(), null)
                        .then(Mono.defer(() -> {
                            LocalDateTime now = LocalDateTime.now(clock);
                            Customer customer = Customer.builder()
                                    .id(UUID.randomUUID())
                                    .name(valid.getName())
                                    .email(valid.getEmail())
                                    .phone(valid.getPhone())
                                    .address(valid.getAddress())
                                    .deleted(false)
                                    .createdAt(now)
                                    .updatedAt(now)
                                    .createdBy(actor)
                                    .updatedBy(actor)
                                    .build();
                            return customerStore.insert(customer);
                        })))
                .doOnNext(saved -> log.info("Created customer {}", saved.getId()))
                .map(CustomerMapper::toResponse);
    }

    /**
     * Get an active customer.
     *
     * @param id Customer ID
     * @return Customer response
     */
    public Mono<CustomerResponse> getCustomer(UUID id) {
        return findActive(id).map(CustomerMapper::toResponse);
    }

    /**
     * Search active customers, one page at a time.
     * Pages are 1-based; a page below 1 is read as the first page.
     *
     * @param request Search parameters
     * @return Paginated customers
     */
    public Mono<PagedResponse<CustomerResponse>> searchCustomers(CustomerSearchRequest request) {
        int page = Math.max(1, request.getPage());
        int pageSize = request.getPageSize();

        CustomerListQuery query = CustomerListQuery.builder()
                .skip((long) (page - 1) * Math.max(0, pageSize))
                .take(pageSize)
                .searchTerm(request.getSearch())
                .emailFilter(request.getEmail())
                .dateFrom(request.getDateFrom())
                .dateTo(request.getDateTo())
                .sortBy(request.getSortBy())
                .sortOrder(request.getSortOrder())
                .build();

        return queryEngine.list(query)
                .map(result -> CustomerMapper.toPagedResponse(result, page, pageSize));
    }

    /**
     * Update the editable fields of an active customer.
     *
     * @param id Customer ID
     * @param request New field values
     * @param actor Who updates it, may be null
     * @return The updated customer
     */
    public Mono<CustomerResponse> updateCustomer(UUID id, CustomerUpdateRequest request, String actor) {
        return validator.validate(request)
                .flatMap(valid -> findActive(id)
                        .flatMap(existing -> {
                            Mono<Void> emailCheck = Objects.equals(existing.getEmail(), valid.getEmail())
                                    ? Mono.empty()
                                    : uniquenessGuard.ensureAvailable(valid.getEmail(), id);

                            return emailCheck.then(Mono.defer(() -> {
                                Customer updated = existing.toBuilder()
                                        .name(valid.getName())
                                        .email(valid.getEmail())
                                        .phone(valid.getPhone())
                                        .address(valid.getAddress())
                                        .updatedAt(Timestamps.notBefore(LocalDateTime.now(clock), existing.getCreatedAt()))
                                        .updatedBy(actor != null ? actor : existing.getUpdatedBy())
                                        .build();
                                return customerStore.update(updated);
                            }));
                        }))
                .doOnNext(saved -> log.info("Updated customer {}", saved.getId()))
                .map(CustomerMapper::toResponse);
    }

    /**
     * Soft-delete an active customer.
     *
     * @param id Customer ID
     * @param actor Who deletes it, may be null
     * @return Mono<Void>
     */
    public Mono<Void> deleteCustomer(UUID id, String actor) {
        return findActive(id)
                .flatMap(customer -> softDeleteManager.softDelete(customer, actor))
                .then();
    }

    private Mono<Customer> findActive(UUID id) {
        return customerStore.findById(id)
                .filter(customer -> !customer.isDeleted())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException(RESOURCE, id.toString())));
    }
}
