package com.nextactiontracker.exception;

import lombok.Getter;

/**
 * Exception thrown when input violates a business rule. Carries the offending field.
 */
@Getter
public class ValidationFailedException extends RuntimeException {

    private final String field;

    public ValidationFailedException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }
}
