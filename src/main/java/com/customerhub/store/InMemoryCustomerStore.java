package com.customerhub.store;

import com.customerhub.exception.DuplicateResourceException;
import com.customerhub.exception.ResourceNotFoundException;
import com.customerhub.model.entity.Customer;
import com.customerhub.query.CustomerOrder;
import com.customerhub.query.CustomerPage;
import com.customerhub.query.CustomerPredicate;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Customer store backed by a map, for local runs and tests.
 *
 * Writes hold the store lock across the email check and the write, which gives
 * the same guarantee as the partial unique index of the SQL store.
 * Records are copied on the way in and out.
 */
@Slf4j
public class InMemoryCustomerStore implements CustomerStore {

    private static final String RESOURCE = "Customer";

    private final Map<UUID, Customer> customers = new LinkedHashMap<>();

    @Override
    public Mono<Customer> insert(Customer customer) {
        return Mono.fromCallable(() -> {
            synchronized (customers) {
                if (customers.containsKey(customer.getId())) {
                    throw new DuplicateResourceException(RESOURCE, customer.getId().toString());
                }
                ensureNoActiveClash(customer);
                customers.put(customer.getId(), copy(customer));
                return copy(customer);
            }
        });
    }

    @Override
    public Mono<Customer> update(Customer customer) {
        return Mono.fromCallable(() -> {
            synchronized (customers) {
                if (!customers.containsKey(customer.getId())) {
                    throw new ResourceNotFoundException(RESOURCE, customer.getId().toString());
                }
                ensureNoActiveClash(customer);
                customers.put(customer.getId(), copy(customer));
                return copy(customer);
            }
        });
    }

    @Override
    public Mono<Customer> findById(UUID id) {
        return Mono.fromCallable(() -> {
            synchronized (customers) {
                Customer found = customers.get(id);
                return found == null ? null : copy(found);
            }
        });
    }

    @Override
    public Mono<Customer> findByEmail(String email, boolean activeOnly) {
        return Mono.fromCallable(() -> {
            synchronized (customers) {
                return customers.values().stream()
                        .filter(c -> Objects.equals(c.getEmail(), email))
                        .filter(c -> !activeOnly || !c.isDeleted())
                        .max(Comparator.comparing(Customer::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                        .map(InMemoryCustomerStore::copy)
                        .orElse(null);
            }
        });
    }

    @Override
    public Mono<CustomerPage> query(CustomerPredicate predicate, CustomerOrder order, long skip, int take) {
        return Mono.fromCallable(() -> {
            List<Customer> matching;
            synchronized (customers) {
                matching = customers.values().stream()
                        .filter(predicate::test)
                        .map(InMemoryCustomerStore::copy)
                        .collect(Collectors.toList());
            }
            List<Customer> window = matching.stream()
                    .sorted(order.comparator())
                    .skip(skip)
                    .limit(take)
                    .collect(Collectors.toList());
            return new CustomerPage(window, matching.size());
        });
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(true);
    }

    /**
     * Number of stored records, deleted ones included.
     */
    public int size() {
        synchronized (customers) {
            return customers.size();
        }
    }

    private void ensureNoActiveClash(Customer candidate) {
        if (candidate.isDeleted()) {
            return;
        }
        boolean clash = customers.values().stream()
                .anyMatch(existing -> !existing.isDeleted()
                        && !existing.getId().equals(candidate.getId())
                        && Objects.equals(existing.getEmail(), candidate.getEmail()));
        if (clash) {
            log.debug("Rejected write of customer {}: active email clash", candidate.getId());
            throw new DuplicateResourceException(RESOURCE, candidate.getEmail());
        }
    }

    private static Customer copy(Customer customer) {
        return customer.toBuilder().build();
    }
}
