package com.customerhub.exception;

/**
 * Exception thrown when a write would give two active resources the same unique key.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String resource, String identifier) {
        super(String.format("%s with identifier '%s' already exists", resource, identifier));
    }

    public DuplicateResourceException(String resource, String identifier, Throwable cause) {
        super(String.format("%s with identifier '%s' already exists", resource, identifier), cause);
    }
}
