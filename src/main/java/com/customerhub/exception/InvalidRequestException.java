package com.customerhub.exception;

/**
 * Exception thrown when input is malformed or out of range.
 * Raised before any state is touched.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
