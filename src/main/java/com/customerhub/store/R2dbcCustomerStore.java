package com.customerhub.store;

import com.customerhub.exception.DuplicateResourceException;
import com.customerhub.exception.ResourceNotFoundException;
import com.customerhub.model.entity.Customer;
import com.customerhub.query.CustomerOrder;
import com.customerhub.query.CustomerPage;
import com.customerhub.query.CustomerPredicate;
import com.customerhub.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Query;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Customer store on PostgreSQL through Spring Data R2DBC.
 *
 * Email uniqueness among active rows is enforced by the partial unique index
 * {@code ux_customers_email_active}; its violations surface as
 * {@link DuplicateResourceException}.
 */
@Slf4j
@RequiredArgsConstructor
public class R2dbcCustomerStore implements CustomerStore {

    private static final String RESOURCE = "Customer";

    private final R2dbcEntityTemplate template;
    private final CustomerRepository customerRepository;
    private final DatabaseClient databaseClient;

    @Override
    public Mono<Customer> insert(Customer customer) {
        return template.insert(customer)
                .onErrorMap(DataIntegrityViolationException.class,
                        e -> new DuplicateResourceException(RESOURCE, customer.getEmail(), e));
    }

    @Override
    public Mono<Customer> update(Customer customer) {
        return template.update(customer)
                .onErrorMap(DataIntegrityViolationException.class,
                        e -> new DuplicateResourceException(RESOURCE, customer.getEmail(), e))
                .onErrorResume(TransientDataAccessResourceException.class, e -> missingRowOrFailure(customer, e));
    }

    // R2dbcEntityTemplate reports an update that touched no row as a transient resource failure,
    // and so does the driver for a connection that went away. Only a missing row is a 404.
    private Mono<Customer> missingRowOrFailure(Customer customer, TransientDataAccessResourceException error) {
        return customerRepository.existsById(customer.getId())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.<Customer>error(error);
                    }
                    log.debug("Update of unknown customer {}", customer.getId());
                    return Mono.<Customer>error(new ResourceNotFoundException(RESOURCE, customer.getId().toString()));
                });
    }

    @Override
    public Mono<Customer> findById(UUID id) {
        return customerRepository.findById(id);
    }

    @Override
    public Mono<Customer> findByEmail(String email, boolean activeOnly) {
        return activeOnly
                ? customerRepository.findFirstByEmailAndDeletedFalse(email)
                : customerRepository.findFirstByEmailOrderByCreatedAtDesc(email);
    }

    @Override
    public Mono<CustomerPage> query(CustomerPredicate predicate, CustomerOrder order, long skip, int take) {
        Query filter = Query.query(predicate.toCriteria());
        return template.count(filter, Customer.class)
                .flatMap(total -> {
                    if (total == 0 || skip >= total) {
                        return Mono.just(new CustomerPage(List.of(), total));
                    }
                    Query window = filter.sort(order.toSort()).offset(skip).limit(take);
                    return template.select(Customer.class)
                            .matching(window)
                            .all()
                            .collectList()
                            .map(items -> new CustomerPage(items, total));
                });
    }

    @Override
    public Mono<Boolean> ping() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .map(row -> true)
                .defaultIfEmpty(false);
    }
}
