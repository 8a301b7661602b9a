package com.frauddetection.hypersearch.domain;

import lombok.Value;

/**
 * Best and current score after a given experiment.
 */
@Value
public class ConvergencePoint {
    int iteration;
    double bestScore;
    double currentScore;
}
