package com.customerhub.service;

import com.customerhub.model.entity.Customer;
import com.customerhub.store.CustomerStore;
import com.customerhub.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Marks customers as deleted instead of removing them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SoftDeleteManager {

    private final CustomerStore customerStore;
    private final Clock clock;

    /**
     * Flag a customer as deleted and persist it.
     * Deleting an already deleted customer only refreshes its update stamp.
     *
     * @param customer Customer to delete
     * @param actor Who deletes it, may be null
     * @return The stored customer
     */
    public Mono<Customer> softDelete(Customer customer, String actor) {
        LocalDateTime now = LocalDateTime.now(clock);
        Customer deleted = customer.toBuilder()
                .deleted(true)
                .updatedAt(Timestamps.notBefore(now, customer.getCreatedAt()))
                .updatedBy(actor != null ? actor : customer.getUpdatedBy())
                .build();
        return customerStore.update(deleted)
                .doOnNext(saved -> log.info("Soft-deleted customer {}", saved.getId()));
    }
}
