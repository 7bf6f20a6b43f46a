package com.adharvest.listings.error;

/**
 * Network failure, timeout or rate limiting on a page fetch.
 * Retried with backoff; once the retry ceiling is hit the scope stops with an error.
 */
public class TransientFetchException extends RuntimeException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
