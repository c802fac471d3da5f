package com.customerhub.query;

import com.customerhub.exception.InvalidRequestException;
import com.customerhub.store.CustomerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Runs customer listings: filter, count, sort, then window.
 */
@Slf4j
@Component
public class CustomerQueryEngine {

    private final CustomerStore customerStore;
    private final CustomerFilterPipeline filterPipeline;
    private final CustomerSortResolver sortResolver;
    private final int maxPageSize;

    public CustomerQueryEngine(CustomerStore customerStore,
                               CustomerFilterPipeline filterPipeline,
                               CustomerSortResolver sortResolver,
                               @Value("${customerhub.query.max-page-size:100}") int maxPageSize) {
        this.customerStore = customerStore;
        this.filterPipeline = filterPipeline;
        this.sortResolver = sortResolver;
        this.maxPageSize = maxPageSize;
    }

    /**
     * List active customers matching the query.
     *
     * @param query Listing parameters; negative skip is treated as 0
     * @return The requested window and the total number of matches
     */
    public Mono<CustomerPage> list(CustomerListQuery query) {
        return Mono.defer(() -> {
            int take = query.getTake();
            if (take <= 0) {
                return Mono.error(new InvalidRequestException("Page size must be greater than 0"));
            }
            if (take > maxPageSize) {
                return Mono.error(new InvalidRequestException("Page size cannot exceed " + maxPageSize));
            }
            long skip = Math.max(0L, query.getSkip());

            CustomerPredicate predicate = filterPipeline.build(query);
            CustomerOrder order = sortResolver.resolve(query.getSortBy(), query.getSortOrder());

            log.debug("Listing customers where [{}] order by [{}] skip {} take {}", predicate, order, skip, take);
            return customerStore.query(predicate, order, skip, take);
        });
    }
}
