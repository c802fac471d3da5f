package com.customerhub.model.dto;

/**
 * Field constraints shared by the customer request DTOs.
 */
final class CustomerConstraints {

    // digits, spaces, plus, minus, dot and parentheses
    static final String PHONE_PATTERN = "^[0-9+().\\-\\s]*$";

    private CustomerConstraints() {
    }
}
