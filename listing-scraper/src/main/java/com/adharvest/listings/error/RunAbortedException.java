package com.adharvest.listings.error;

/**
 * Thrown inside a scope worker once the run has been cancelled, either externally
 * or because the global error threshold was reached. Partial results are kept.
 */
public class RunAbortedException extends RuntimeException {

    public RunAbortedException(String reason) {
        super(reason);
    }
}
