package com.customerhub.query;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the filter of a customer listing from its optional parameters.
 *
 * Clause order is fixed: active, search term, exact email, date from, date to.
 * The active clause is always present.
 */
@Component
public class CustomerFilterPipeline {

    public CustomerPredicate build(CustomerListQuery query) {
        List<CustomerPredicate> clauses = new ArrayList<>();
        clauses.add(CustomerPredicate.active());

        if (StringUtils.hasText(query.getSearchTerm())) {
            clauses.add(CustomerPredicate.nameOrEmailContains(query.getSearchTerm()));
        }
        if (StringUtils.hasText(query.getEmailFilter())) {
            clauses.add(CustomerPredicate.emailEquals(query.getEmailFilter()));
        }
        if (query.getDateFrom() != null) {
            clauses.add(CustomerPredicate.createdOnOrAfter(query.getDateFrom()));
        }
        if (query.getDateTo() != null) {
            clauses.add(CustomerPredicate.createdOnOrBefore(query.getDateTo()));
        }

        return CustomerPredicate.allOf(clauses);
    }
}
