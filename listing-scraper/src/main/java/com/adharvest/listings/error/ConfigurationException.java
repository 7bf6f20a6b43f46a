package com.adharvest.listings.error;

/**
 * Bad scope or filter input. Raised while preparing a run, before any page is
 * fetched, and never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
