package com.frauddetection.hypersearch.service;

import com.frauddetection.hypersearch.engine.SearchMetricsRecorder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking search and experiment metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class SearchMetricsService implements SearchMetricsRecorder {

    private final Counter searchesStartedCounter;
    private final Counter searchesCompletedCounter;
    private final Counter searchesStoppedCounter;
    private final Counter searchesEarlyStoppedCounter;
    private final Counter experimentsCompletedCounter;
    private final Counter experimentsFailedCounter;
    private final Counter experimentsNoMetricsCounter;
    private final Timer experimentTimer;

    public SearchMetricsService(MeterRegistry meterRegistry) {
        this.searchesStartedCounter = Counter.builder("hypersearch.searches.started")
                .description("Total number of search runs started")
                .register(meterRegistry);

        this.searchesCompletedCounter = Counter.builder("hypersearch.searches.completed")
                .description("Search runs that used their whole experiment budget")
                .register(meterRegistry);

        this.searchesStoppedCounter = Counter.builder("hypersearch.searches.stopped")
                .description("Search runs stopped by the caller or by an internal error")
                .register(meterRegistry);

        this.searchesEarlyStoppedCounter = Counter.builder("hypersearch.searches.early_stopped")
                .description("Search runs halted because scores stagnated")
                .register(meterRegistry);

        this.experimentsCompletedCounter = Counter.builder("hypersearch.experiments.completed")
                .description("Training attempts that returned a result")
                .register(meterRegistry);

        this.experimentsFailedCounter = Counter.builder("hypersearch.experiments.failed")
                .description("Training attempts that failed")
                .register(meterRegistry);

        this.experimentsNoMetricsCounter = Counter.builder("hypersearch.experiments.no_metrics")
                .description("Completed attempts whose result carried no recognizable metrics")
                .register(meterRegistry);

        this.experimentTimer = Timer.builder("hypersearch.experiment.duration")
                .description("Wall time of one training attempt")
                .register(meterRegistry);

        log.info("SearchMetricsService initialized with Micrometer metrics");
    }

    @Override
    public void recordSearchStarted() {
        searchesStartedCounter.increment();
    }

    @Override
    public void recordSearchCompleted() {
        searchesCompletedCounter.increment();
    }

    @Override
    public void recordSearchStopped() {
        searchesStoppedCounter.increment();
    }

    @Override
    public void recordSearchEarlyStopped() {
        searchesEarlyStoppedCounter.increment();
    }

    /**
     * Record a successful training attempt with its wall time.
     */
    @Override
    public void recordExperimentCompleted(long executionTimeMs) {
        experimentsCompletedCounter.increment();
        experimentTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordExperimentFailed(long executionTimeMs) {
        experimentsFailedCounter.increment();
        experimentTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordMetricsMissing() {
        experimentsNoMetricsCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Searches=%d, Experiments completed=%d, failed=%d, AvgExecTime=%.2fs",
                (long) searchesStartedCounter.count(),
                (long) experimentsCompletedCounter.count(),
                (long) experimentsFailedCounter.count(),
                experimentTimer.mean(TimeUnit.SECONDS));
    }
}
