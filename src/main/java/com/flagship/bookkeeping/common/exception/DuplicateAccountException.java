package com.flagship.bookkeeping.common.exception;

/**
 * Thrown when an account code or name collides with an existing account.
 */
public class DuplicateAccountException extends BookkeepingException {

    public DuplicateAccountException(String message) {
        super(message);
    }

    public DuplicateAccountException(String message, Throwable cause) {
        super(message, cause);
    }
}
