package com.adharvest.listings.error;

/**
 * The marketplace rejected the request outright. Stops the scope, no retry.
 */
public class FatalFetchException extends RuntimeException {

    public FatalFetchException(String message) {
        super(message);
    }
}
