package com.frauddetection.hypersearch.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one training attempt. Immutable once created.
 * A FAILED record always has score 0 and empty rawMetrics.
 */
@Value
@Builder
public class ExperimentRecord {

    int experimentId;
    CandidateConfiguration parameters;
    double score;

    @Builder.Default
    Map<String, Object> rawMetrics = Map.of();

    ExperimentStatus status;
    Instant startedAt;
    long executionTimeMs;
    String trainedModelReference;
    String failureReason;

    public boolean isCompleted() {
        return status == ExperimentStatus.COMPLETED;
    }
}
