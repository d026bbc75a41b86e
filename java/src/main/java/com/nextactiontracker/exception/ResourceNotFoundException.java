package com.nextactiontracker.exception;

/**
 * Exception thrown when a requested resource is not found for the calling tenant.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, String identifier) {
        super(String.format("%s with identifier '%s' not found", resource, identifier));
    }
}
