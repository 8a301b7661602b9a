package com.frauddetection.hypersearch.domain;

import lombok.Value;

/**
 * Whether the best score has flattened out over the most recent experiments.
 */
@Value
public class ConvergenceAnalysis {
    boolean converging;
    double stabilityScore;

    public static ConvergenceAnalysis insufficientData() {
        return new ConvergenceAnalysis(false, 0.0);
    }
}
