package com.customerhub.query;

import com.customerhub.model.entity.Customer;
import lombok.Value;
import org.springframework.data.domain.Sort;

import java.util.Comparator;

/**
 * Resolved ordering of a customer listing.
 * Ties on the sort field are always broken by id ascending.
 */
@Value
public class CustomerOrder {

    public static final CustomerOrder DEFAULT = new CustomerOrder(CustomerSortField.CREATED_AT, Sort.Direction.DESC);

    private static final String TIE_BREAK_PROPERTY = "id";

    CustomerSortField field;
    Sort.Direction direction;

    public Comparator<Customer> comparator() {
        Comparator<Customer> primary = field.getComparator();
        if (direction.isDescending()) {
            primary = primary.reversed();
        }
        return primary.thenComparing(Customer::getId);
    }

    public Sort toSort() {
        return Sort.by(direction, field.getProperty())
                .and(Sort.by(Sort.Direction.ASC, TIE_BREAK_PROPERTY));
    }

    @Override
    public String toString() {
        return field.getProperty() + " " + direction.name().toLowerCase() + ", id asc";
    }
}
