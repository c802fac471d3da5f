package com.customerhub.query;

import com.customerhub.model.entity.Customer;
import org.springframework.data.relational.core.dialect.Escaper;
import org.springframework.data.relational.core.query.Criteria;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Composable filter over customers.
 *
 * Every predicate carries two equivalent renderings: an in-memory matcher and a
 * Spring Data Relational {@link Criteria}. Stores pick whichever they can execute,
 * so both must agree on every record.
 */
public final class CustomerPredicate {

    private static final CustomerPredicate MATCH_ALL =
            new CustomerPredicate("all", customer -> true, Criteria.empty(), List.of());

    private final String description;
    private final Predicate<Customer> matcher;
    private final Criteria criteria;
    private final List<CustomerPredicate> clauses;

    private CustomerPredicate(String description, Predicate<Customer> matcher,
                              Criteria criteria, List<CustomerPredicate> clauses) {
        this.description = description;
        this.matcher = matcher;
        this.criteria = criteria;
        this.clauses = clauses;
    }

    /**
     * Customers that have not been soft-deleted.
     */
    public static CustomerPredicate active() {
        return new CustomerPredicate("active",
                customer -> !customer.isDeleted(),
                Criteria.where("deleted").isFalse(),
                List.of());
    }

    /**
     * Customers whose name or email contains {@code term}, ignoring case.
     * LIKE wildcards inside the term match literally.
     */
    public static CustomerPredicate nameOrEmailContains(String term) {
        Objects.requireNonNull(term, "term");
        String needle = term.toLowerCase(Locale.ROOT);
        String pattern = "%" + Escaper.DEFAULT.escape(term) + "%";
        return new CustomerPredicate("nameOrEmailContains('" + term + "')",
                customer -> containsIgnoreCase(customer.getName(), needle)
                        || containsIgnoreCase(customer.getEmail(), needle),
                Criteria.where("name").like(pattern).ignoreCase(true)
                        .or("email").like(pattern).ignoreCase(true),
                List.of());
    }

    /**
     * Customers whose stored email equals {@code email} exactly.
     */
    public static CustomerPredicate emailEquals(String email) {
        Objects.requireNonNull(email, "email");
        return new CustomerPredicate("emailEquals('" + email + "')",
                customer -> email.equals(customer.getEmail()),
                Criteria.where("email").is(email),
                List.of());
    }

    /**
     * Customers created at or after {@code from}.
     */
    public static CustomerPredicate createdOnOrAfter(LocalDateTime from) {
        Objects.requireNonNull(from, "from");
        return new CustomerPredicate("createdAt >= " + from,
                customer -> customer.getCreatedAt() != null && !customer.getCreatedAt().isBefore(from),
                Criteria.where("createdAt").greaterThanOrEquals(from),
                List.of());
    }

    /**
     * Customers created at or before {@code to}.
     */
    public static CustomerPredicate createdOnOrBefore(LocalDateTime to) {
        Objects.requireNonNull(to, "to");
        return new CustomerPredicate("createdAt <= " + to,
                customer -> customer.getCreatedAt() != null && !customer.getCreatedAt().isAfter(to),
                Criteria.where("createdAt").lessThanOrEquals(to),
                List.of());
    }

    /**
     * Conjunction of the given clauses, kept in the given order.
     */
    public static CustomerPredicate allOf(List<CustomerPredicate> clauses) {
        if (clauses.isEmpty()) {
            return MATCH_ALL;
        }
        if (clauses.size() == 1) {
            return clauses.get(0);
        }
        List<CustomerPredicate> copy = List.copyOf(clauses);

        Predicate<Customer> matcher = customer -> true;
        for (CustomerPredicate clause : copy) {
            matcher = matcher.and(clause.matcher);
        }

        Criteria criteria = copy.get(0).criteria;
        for (CustomerPredicate clause : copy.subList(1, copy.size())) {
            criteria = criteria.and(clause.criteria);
        }

        String description = copy.stream()
                .map(CustomerPredicate::toString)
                .collect(Collectors.joining(" AND "));
        return new CustomerPredicate(description, matcher, criteria, copy);
    }

    public boolean test(Customer customer) {
        return matcher.test(customer);
    }

    public Criteria toCriteria() {
        return criteria;
    }

    /**
     * Clauses of a conjunction in evaluation order; empty for a single clause.
     */
    public List<CustomerPredicate> clauses() {
        return clauses;
    }

    @Override
    public String toString() {
        return description;
    }

    private static boolean containsIgnoreCase(String value, String lowerCaseNeedle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerCaseNeedle);
    }
}
