package com.frauddetection.hypersearch.domain;

/**
 * How strongly a parameter is expected to move the objective metric.
 */
public enum Sensitivity {
    LOW,
    MEDIUM,
    HIGH
}
