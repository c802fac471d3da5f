package com.customerhub.query;

import com.customerhub.model.entity.Customer;
import lombok.Value;

import java.util.List;

/**
 * One window of a customer listing plus the number of records matching the
 * filter across all windows.
 */
@Value
public class CustomerPage {

    List<Customer> items;
    long totalCount;

    public static CustomerPage empty() {
        return new CustomerPage(List.of(), 0);
    }
}
