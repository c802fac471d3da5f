package com.customerhub.repository;

import com.customerhub.model.entity.Customer;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for Customer entities.
 *
 * Inserts go through R2dbcEntityTemplate since ids are assigned by the service,
 * which {@code save} would treat as an update.
 */
@Repository
public interface CustomerRepository extends ReactiveCrudRepository<Customer, UUID> {

    /**
     * Find the active customer holding an email.
     */
    Mono<Customer> findFirstByEmailAndDeletedFalse(String email);

    /**
     * Find the most recent customer with an email, deleted or not.
     */
    Mono<Customer> findFirstByEmailOrderByCreatedAtDesc(String email);
}
