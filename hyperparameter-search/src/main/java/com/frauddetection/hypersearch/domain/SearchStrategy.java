package com.frauddetection.hypersearch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * How candidates are chosen. Only independent uniform random sampling is supported.
 */
public enum SearchStrategy {
    RANDOM;

    @JsonCreator
    public static SearchStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Search strategy is required");
        }
        try {
            return SearchStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported search strategy: " + value, e);
        }
    }
}
