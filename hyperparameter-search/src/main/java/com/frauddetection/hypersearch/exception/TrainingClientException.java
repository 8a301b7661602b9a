package com.frauddetection.hypersearch.exception;

/**
 * Thrown by the training service binding when a training call does not yield a usable response.
 */
public class TrainingClientException extends RuntimeException {

    public TrainingClientException(String message) {
        super(message);
    }

    public TrainingClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
