package com.frauddetection.hypersearch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a run left the RUNNING state.
 */
public enum TerminationReason {
    MAX_EXPERIMENTS_REACHED,
    EARLY_STOPPED,
    STOPPED_BY_USER,
    INTERNAL_ERROR;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
