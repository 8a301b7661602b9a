package com.frauddetection.hypersearch.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only snapshot of a search, taken between iterations.
 */
@Value
@Builder
public class SearchState {

    Long searchId;
    SearchStatus status;
    ModelFamily modelFamily;
    ObjectiveMetric objectiveMetric;

    @Builder.Default
    List<ExperimentRecord> experiments = List.of();

    ExperimentRecord bestExperiment;
    int currentIndex;
    int maxExperiments;
    int completedCount;
    int failedCount;
    double progressPercent;
    long elapsedMs;
    long estimatedRemainingMs;
    boolean stopRequested;

    // max - min over the trailing early-stopping window; null until the window is full
    Double trailingImprovement;

    TerminationReason terminationReason;

    @Builder.Default
    List<ConvergencePoint> convergence = List.of();
}
