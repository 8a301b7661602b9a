package com.frauddetection.hypersearch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Model families the training service can fit.
 */
public enum ModelFamily {
    /** Gradient-boosted decision trees. */
    LIGHTGBM,
    /** Dimensionality-reduction anomaly detector. */
    PCA,
    /** Weighted ensemble of LIGHTGBM and PCA. */
    ENSEMBLE;

    /**
     * Lenient lookup accepting any casing, e.g. "LightGBM" or "ensemble".
     */
    @JsonCreator
    public static ModelFamily fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Model family is required");
        }
        try {
            return ModelFamily.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown model family: " + value, e);
        }
    }
}
