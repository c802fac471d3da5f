package com.customerhub.service;

import com.customerhub.model.dto.CustomerResponse;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one create attempt inside a bulk run: either the created customer
 * or the reason it was rejected, tagged with the attempt's position.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreateOutcome {

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    int index;
    Status status;
    CustomerResponse customer;
    String errorMessage;

    public static CreateOutcome succeeded(int index, CustomerResponse customer) {
        return new CreateOutcome(index, Status.SUCCEEDED, customer, null);
    }

    public static CreateOutcome failed(int index, String errorMessage) {
        return new CreateOutcome(index, Status.FAILED, null, errorMessage);
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }
}
