package com.flagship.bookkeeping.common.exception;

/**
 * Base exception for all bookkeeping engine errors.
 *
 * Engine operations propagate these synchronously; nothing inside the engine retries.
 */
public class BookkeepingException extends RuntimeException {

    public BookkeepingException(String message) {
        super(message);
    }

    public BookkeepingException(String message, Throwable cause) {
        super(message, cause);
    }
}
