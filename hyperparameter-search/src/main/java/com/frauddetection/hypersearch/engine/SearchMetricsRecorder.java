package com.frauddetection.hypersearch.engine;

/**
 * Sink for search lifecycle and experiment outcome counts.
 */
public interface SearchMetricsRecorder {

    void recordSearchStarted();

    void recordSearchCompleted();

    void recordSearchStopped();

    void recordSearchEarlyStopped();

    void recordExperimentCompleted(long executionTimeMs);

    void recordExperimentFailed(long executionTimeMs);

    void recordMetricsMissing();
}
