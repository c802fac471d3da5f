package com.customerhub.query;

import com.customerhub.model.entity.Customer;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;

/**
 * Customer properties a listing can be sorted by.
 *
 * Text fields order by UTF-16 code unit, so upper case sorts before lower case.
 * The SQL schema declares {@code name} and {@code email} with {@code COLLATE "C"}
 * to give the database the same order.
 */
public enum CustomerSortField {

    NAME("name", Comparator.comparing(Customer::getName, Comparator.nullsLast(Comparator.naturalOrder()))),
    EMAIL("email", Comparator.comparing(Customer::getEmail, Comparator.nullsLast(Comparator.naturalOrder()))),
    CREATED_AT("createdAt", Comparator.comparing(Customer::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));

    private final String property;
    private final Comparator<Customer> comparator;

    CustomerSortField(String property, Comparator<Customer> comparator) {
        this.property = property;
        this.comparator = comparator;
    }

    public String getProperty() {
        return property;
    }

    public Comparator<Customer> getComparator() {
        return comparator;
    }

    /**
     * Look up a field by its request key, ignoring case. A padded key is unknown.
     */
    public static Optional<CustomerSortField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(field -> field.property.equalsIgnoreCase(key))
                .findFirst();
    }
}
