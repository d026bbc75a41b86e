package com.nextactiontracker.exception;

/**
 * Exception thrown when the tenant identifier is missing or is not a valid UUID.
 */
public class InvalidTenantException extends RuntimeException {

    public InvalidTenantException(String message) {
        super(message);
    }
}
