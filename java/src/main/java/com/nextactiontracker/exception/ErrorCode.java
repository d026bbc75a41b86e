package com.nextactiontracker.exception;

/**
 * Machine-readable error codes carried in {@code error_code} of every error response.
 */
public final class ErrorCode {

    public static final String INVALID_TENANT = "INVALID_TENANT";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String SERVER_ERROR = "SERVER_ERROR";

    private ErrorCode() {
    }
}
