package com.frauddetection.hypersearch.exception;

/**
 * Thrown when a search configuration is invalid. The run loop is never entered.
 */
public class SearchConfigurationException extends RuntimeException {

    public SearchConfigurationException(String message) {
        super(message);
    }
}
