package com.flagship.bookkeeping.common.exception;

/**
 * Thrown when a request is malformed: bad date, non-positive amount, unknown account
 * name with no fallback, inconsistent disposal, and so on.
 */
public class ValidationException extends BookkeepingException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
