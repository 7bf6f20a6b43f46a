package com.adharvest.listings.output;

/**
 * A sink could not write its file.
 */
public class OutputException extends RuntimeException {

    public OutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
