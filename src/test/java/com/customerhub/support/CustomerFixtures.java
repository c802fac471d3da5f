package com.customerhub.support;

import com.customerhub.model.entity.Customer;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Shared builders for customer tests.
 */
public final class CustomerFixtures {

    public static final LocalDateTime BASE_TIME = LocalDateTime.of(2026, 1, 15, 10, 15, 30);

    private CustomerFixtures() {
    }

    public static Customer customer(String name, String email, LocalDateTime createdAt) {
        return Customer.builder()
                .id(UUID.randomUUID())
                .name(name)
                .email(email)
                .phone("+1-555-0100")
                .address("1 Main St")
                .deleted(false)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    public static Customer customer(String name, String email) {
        return customer(name, email, BASE_TIME);
    }

    public static Customer deletedCustomer(String name, String email, LocalDateTime createdAt) {
        return customer(name, email, createdAt).toBuilder()
                .deleted(true)
                .build();
    }

    public static Clock fixedClock() {
        return Clock.fixed(BASE_TIME.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    public static Validator validator() {
        return Validation.buildDefaultValidatorFactory().getValidator();
    }
}
