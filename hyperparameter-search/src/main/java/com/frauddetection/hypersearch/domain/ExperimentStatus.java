package com.frauddetection.hypersearch.domain;

/**
 * Outcome of a single training attempt.
 */
public enum ExperimentStatus {
    COMPLETED,
    FAILED
}
