package com.customerhub.controller;

import com.customerhub.model.dto.BulkCreateRequest;
import com.customerhub.model.dto.BulkCreateResponse;
import com.customerhub.model.dto.CustomerCreateRequest;
import com.customerhub.model.dto.CustomerResponse;
import com.customerhub.model.dto.CustomerSearchRequest;
import com.customerhub.model.dto.CustomerUpdateRequest;
import com.customerhub.model.dto.PagedResponse;
import com.customerhub.service.BulkCreateCoordinator;
import com.customerhub.service.CustomerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Controller for customer search and management.
 */
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    static final String ACTOR_HEADER = "X-Actor";

    private final CustomerService customerService;
    private final BulkCreateCoordinator bulkCreateCoordinator;

    @GetMapping
    public Mono<PagedResponse<CustomerResponse>> searchCustomers(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int pageSize,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String email,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTo,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder) {
        CustomerSearchRequest request = CustomerSearchRequest.builder()
                .page(page)
                .pageSize(pageSize)
                .search(search)
                .email(email)
                .dateFrom(dateFrom)
                .dateTo(dateTo)
                .sortBy(sortBy)
                .sortOrder(sortOrder)
                .build();
        return customerService.searchCustomers(request);
    }

    @GetMapping("/{id}")
    public Mono<CustomerResponse> getCustomer(@PathVariable UUID id) {
        return customerService.getCustomer(id);
    }

    @PostMapping
    public Mono<ResponseEntity<CustomerResponse>> createCustomer(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor,
            @Valid @RequestBody CustomerCreateRequest request) {
        return customerService.createCustomer(request, actor)
                .map(created -> ResponseEntity
                        .created(URI.create("/api/customers/" + created.getId()))
                        .body(created));
    }

    @PutMapping("/{id}")
    public Mono<CustomerResponse> updateCustomer(
            @PathVariable UUID id,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor,
            @Valid @RequestBody CustomerUpdateRequest request) {
        return customerService.updateCustomer(id, request, actor);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteCustomer(
            @PathVariable UUID id,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        return customerService.deleteCustomer(id, actor);
    }

    @PostMapping("/bulk")
    public Mono<BulkCreateResponse> bulkCreate(
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor,
            @Valid @RequestBody BulkCreateRequest request) {
        return bulkCreateCoordinator.bulkCreate(request.getCount(), actor);
    }
}
