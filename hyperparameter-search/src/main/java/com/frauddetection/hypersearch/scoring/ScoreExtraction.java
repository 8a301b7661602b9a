package com.frauddetection.hypersearch.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Result of normalizing a training payload: the score plus where it came from.
 * {@code metrics} is null when no metrics structure could be located.
 */
@Value
public class ScoreExtraction {

    double score;
    JsonNode metrics;
    String resolvedField;

    public boolean isMetricsFound() {
        return metrics != null;
    }

    static ScoreExtraction noMetrics() {
        return new ScoreExtraction(0.0, null, null);
    }
}
