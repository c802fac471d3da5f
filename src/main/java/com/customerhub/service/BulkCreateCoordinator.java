package com.customerhub.service;

import com.customerhub.exception.DuplicateResourceException;
import com.customerhub.exception.InvalidRequestException;
import com.customerhub.model.dto.BulkCreateError;
import com.customerhub.model.dto.BulkCreateResponse;
import com.customerhub.model.dto.CustomerCreateRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates a batch of generated customers where every item succeeds or fails on its own.
 *
 * Items go through the same path as a single create. Conflicts and validation
 * failures become entries of the result; earlier successes are never rolled back.
 * Store failures are not item failures and fail the whole call.
 */
@Slf4j
@Component
public class BulkCreateCoordinator {

    private final CustomerService customerService;
    private final RandomCustomerGenerator customerGenerator;
    private final int maxCount;
    private final int concurrency;

    public BulkCreateCoordinator(CustomerService customerService,
                                 RandomCustomerGenerator customerGenerator,
                                 @Value("${customerhub.bulk.max-count:1000}") int maxCount,
                                 @Value("${customerhub.bulk.concurrency:1}") int concurrency) {
        this.customerService = customerService;
        this.customerGenerator = customerGenerator;
        this.maxCount = maxCount;
        this.concurrency = Math.max(1, concurrency);
    }

    /**
     * Generate and create {@code count} random customers.
     *
     * @param count Number of customers, between 1 and the configured maximum
     * @param actor Who triggers the run, may be null
     * @return Per-item results in index order
     */
    public Mono<BulkCreateResponse> bulkCreate(int count, String actor) {
        if (count < 1 || count > maxCount) {
            return Mono.error(new InvalidRequestException("Count must be between 1 and " + maxCount));
        }

        return Mono.fromCallable(() -> customerGenerator.generateCustomers(count))
                .flatMapMany(candidates -> Flux.range(0, count)
                        .flatMapSequential(index -> attempt(index, candidates.get(index), actor), concurrency))
                .collectList()
                .map(BulkCreateCoordinator::summarize)
                .doOnNext(response -> log.info("Bulk create finished: {} created, {} failed",
                        response.getSuccessCount(), response.getFailureCount()));
    }

    private Mono<CreateOutcome> attempt(int index, CustomerCreateRequest candidate, String actor) {
        return customerService.createCustomer(candidate, actor)
                .map(created -> CreateOutcome.succeeded(index, created))
                .onErrorResume(BulkCreateCoordinator::isItemFailure, error -> {
                    log.warn("Bulk create item {} rejected: {}", index, error.getMessage());
                    return Mono.just(CreateOutcome.failed(index, error.getMessage()));
                });
    }

    static boolean isItemFailure(Throwable error) {
        return error instanceof DuplicateResourceException || error instanceof InvalidRequestException;
    }

    static BulkCreateResponse summarize(List<CreateOutcome> outcomes) {
        List<CreateOutcome> succeeded = outcomes.stream()
                .filter(CreateOutcome::isSucceeded)
                .collect(Collectors.toList());
        List<BulkCreateError> errors = outcomes.stream()
                .filter(outcome -> !outcome.isSucceeded())
                .map(outcome -> BulkCreateError.builder()
                        .index(outcome.getIndex())
                        .message(outcome.getErrorMessage())
                        .build())
                .collect(Collectors.toList());

        return BulkCreateResponse.builder()
                .successCount(succeeded.size())
                .failureCount(errors.size())
                .createdCustomers(succeeded.stream()
                        .map(CreateOutcome::getCustomer)
                        .collect(Collectors.toList()))
                .errors(errors)
                .build();
    }
}
