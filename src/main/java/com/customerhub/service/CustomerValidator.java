package com.customerhub.service;

import com.customerhub.exception.InvalidRequestException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies the bean validation constraints of request DTOs inside the service layer,
 * so requests that never went through a controller are checked the same way.
 */
@Component
@RequiredArgsConstructor
public class CustomerValidator {

    private final Validator validator;

    /**
     * Validate a request.
     *
     * @return The request on success, {@link InvalidRequestException} listing every violation otherwise
     */
    public <T> Mono<T> validate(T request) {
        return Mono.fromCallable(() -> {
            if (request == null) {
                throw new InvalidRequestException("Validation failed: request body is required");
            }
            Set<ConstraintViolation<T>> violations = validator.validate(request);
            if (!violations.isEmpty()) {
                throw new InvalidRequestException("Validation failed: " + describe(violations));
            }
            return request;
        });
    }

    private static <T> String describe(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
                .sorted(Comparator.comparing((ConstraintViolation<T> v) -> v.getPropertyPath().toString())
                        .thenComparing(ConstraintViolation::getMessage))
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .collect(Collectors.joining(", "));
    }
}
