package com.customerhub.store;

import com.customerhub.model.entity.Customer;
import com.customerhub.query.CustomerOrder;
import com.customerhub.query.CustomerPage;
import com.customerhub.query.CustomerPredicate;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Durable keyed storage for customers; the only holder of consistency authority.
 *
 * Implementations must reject a write that would leave two active customers
 * with the same email, independently of any check done by callers.
 */
public interface CustomerStore {

    /**
     * Persist a new customer.
     *
     * @return The stored customer, or a {@code DuplicateResourceException} on an active email clash
     */
    Mono<Customer> insert(Customer customer);

    /**
     * Replace an existing customer.
     *
     * @return The stored customer; {@code ResourceNotFoundException} if the id is unknown,
     *         {@code DuplicateResourceException} on an active email clash
     */
    Mono<Customer> update(Customer customer);

    /**
     * Find a customer by id, including soft-deleted ones.
     */
    Mono<Customer> findById(UUID id);

    /**
     * Find a customer by exact email.
     *
     * @param activeOnly Ignore soft-deleted customers
     */
    Mono<Customer> findByEmail(String email, boolean activeOnly);

    /**
     * Select one window of the customers matching a predicate.
     *
     * @return The window, with the count of all matching customers
     */
    Mono<CustomerPage> query(CustomerPredicate predicate, CustomerOrder order, long skip, int take);

    /**
     * Cheap round trip used by health checks.
     */
    Mono<Boolean> ping();
}
