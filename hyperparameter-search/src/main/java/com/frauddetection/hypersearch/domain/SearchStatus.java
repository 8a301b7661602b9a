package com.frauddetection.hypersearch.domain;

/**
 * Status enum for the search lifecycle.
 * IDLE -> RUNNING -> {COMPLETED | STOPPED}; reset returns any state to IDLE.
 */
public enum SearchStatus {
    IDLE,
    RUNNING,
    STOPPED,
    COMPLETED
}
