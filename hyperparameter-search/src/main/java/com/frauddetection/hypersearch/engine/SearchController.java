package com.frauddetection.hypersearch.engine;

import com.frauddetection.hypersearch.catalog.ParameterCatalog;
import com.frauddetection.hypersearch.domain.CandidateConfiguration;
import com.frauddetection.hypersearch.domain.ConvergencePoint;
import com.frauddetection.hypersearch.domain.ExperimentRecord;
import com.frauddetection.hypersearch.domain.ParameterDefinition;
import com.frauddetection.hypersearch.domain.ParameterRange;
import com.frauddetection.hypersearch.domain.SearchConfiguration;
import com.frauddetection.hypersearch.domain.SearchState;
import com.frauddetection.hypersearch.domain.SearchStatus;
import com.frauddetection.hypersearch.domain.TerminationReason;
import com.frauddetection.hypersearch.exception.SearchConfigurationException;
import com.frauddetection.hypersearch.exception.SearchStateException;
import com.frauddetection.hypersearch.sampling.ParameterSpaceSampler;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one search: IDLE -> RUNNING -> COMPLETED | STOPPED, and back to IDLE on reset.
 * <p>
 * Experiments run strictly one at a time. A stop request is cooperative: it is checked
 * before each new candidate is dispatched, so an in-flight experiment always completes
 * and is recorded. A reset while running discards whatever the abandoned loop would
 * record afterwards.
 * <p>
 * State mutations and snapshots are serialized on an internal lock, so observers never
 * see a half-recorded experiment.
 */
@Slf4j
public class SearchController {

    private final Long searchId;
    private final ParameterCatalog catalog;
    private final ParameterSpaceSampler sampler;
    private final ExperimentRunner experimentRunner;
    private final EarlyStoppingController earlyStoppingController;
    private final SearchConfigurationValidator validator;
    private final SearchMetricsRecorder metricsService;
    private final long iterationPauseMs;

    private final List<SearchStateListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Object lock = new Object();

    // guarded by lock
    private SearchStatus status = SearchStatus.IDLE;
    private SearchConfiguration configuration;
    private Map<String, ParameterRange> ranges;
    private ExperimentLog experimentLog;
    private final BestResultTracker bestResultTracker = new BestResultTracker();
    private final List<ConvergencePoint> convergence = new ArrayList<>();
    private int currentIndex;
    private long startedAtMs;
    private long finishedAtMs;
    private TerminationReason terminationReason;
    private long generation;
    private boolean loopActive;

    public SearchController(Long searchId,
                            ParameterCatalog catalog,
                            ParameterSpaceSampler sampler,
                            ExperimentRunner experimentRunner,
                            EarlyStoppingController earlyStoppingController,
                            SearchMetricsRecorder metricsService,
                            long iterationPauseMs) {
        this.searchId = searchId;
        this.catalog = catalog;
        this.sampler = sampler;
        this.experimentRunner = experimentRunner;
        this.earlyStoppingController = earlyStoppingController;
        this.validator = new SearchConfigurationValidator(catalog);
        this.metricsService = metricsService;
        this.iterationPauseMs = iterationPauseMs;
    }

    /**
     * Validate and store the configuration for the next run. Not allowed while running.
     */
    public void configure(SearchConfiguration configuration, Map<String, ParameterRange> overrides) {
        synchronized (lock) {
            if (status == SearchStatus.RUNNING) {
                throw new SearchStateException("Cannot reconfigure a running search", status);
            }
            this.ranges = validator.validate(configuration, overrides);
            this.configuration = configuration;
            log.info("Search {} configured: family={}, metric={}, maxExperiments={}, enabled parameters={}",
                    searchId, configuration.getModelFamily(), configuration.getObjectiveMetric().getWireName(),
                    configuration.getMaxExperiments(),
                    ranges.values().stream().filter(ParameterRange::isEnabled).count());
        }
    }

    /**
     * Run the whole search on the calling thread and return once it has finished.
     */
    public SearchState start() {
        long runGeneration = beginRun();
        runLoop(runGeneration);
        return snapshot();
    }

    /**
     * Start the search on the given executor and return immediately.
     */
    public SearchState startAsync(Executor executor) {
        long runGeneration = beginRun();
        try {
            executor.execute(() -> runLoop(runGeneration));
        } catch (RejectedExecutionException e) {
            log.warn("Search {} could not be scheduled: {}", searchId, e.getMessage());
            synchronized (lock) {
                if (runGeneration == generation) {
                    generation++;
                    status = SearchStatus.IDLE;
                    startedAtMs = 0;
                }
                loopActive = false;
            }
            throw e;
        }
        return snapshot();
    }

    /**
     * Ask a running search to halt before its next experiment.
     */
    public void stop() {
        synchronized (lock) {
            if (status != SearchStatus.RUNNING) {
                throw new SearchStateException("Search " + searchId + " is not running", status);
            }
            stopRequested.set(true);
            log.info("Search {} stop requested after {} experiments", searchId, currentIndex);
        }
    }

    /**
     * Clear all results and return to IDLE. The configuration is kept.
     */
    public void reset() {
        synchronized (lock) {
            if (status == SearchStatus.RUNNING) {
                log.warn("Search {} reset while running, abandoning the current run", searchId);
                stopRequested.set(true);
            }
            generation++;
            status = SearchStatus.IDLE;
            experimentLog = null;
            bestResultTracker.reset();
            convergence.clear();
            currentIndex = 0;
            startedAtMs = 0;
            finishedAtMs = 0;
            terminationReason = null;
            log.info("Search {} reset", searchId);
        }
    }

    public void addListener(SearchStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SearchStateListener listener) {
        listeners.remove(listener);
    }

    public SearchState snapshot() {
        synchronized (lock) {
            List<ExperimentRecord> experiments = experimentLog != null ? experimentLog.records() : List.of();
            int maxExperiments = configuration != null ? configuration.getMaxExperiments() : 0;
            int completed = (int) experiments.stream().filter(ExperimentRecord::isCompleted).count();

            long elapsedMs = 0;
            if (status == SearchStatus.RUNNING) {
                elapsedMs = System.currentTimeMillis() - startedAtMs;
            } else if (startedAtMs > 0 && finishedAtMs >= startedAtMs) {
                elapsedMs = finishedAtMs - startedAtMs;
            }

            long estimatedRemainingMs = 0;
            if (status == SearchStatus.RUNNING && currentIndex > 0) {
                estimatedRemainingMs = elapsedMs / currentIndex * (maxExperiments - currentIndex);
            }

            Double trailingImprovement = null;
            if (configuration != null) {
                OptionalDouble range = earlyStoppingController.trailingRange(
                        experiments, configuration.getEarlyStoppingPatience());
                trailingImprovement = range.isPresent() ? range.getAsDouble() : null;
            }

            return SearchState.builder()
                    .searchId(searchId)
                    .status(status)
                    .modelFamily(configuration != null ? configuration.getModelFamily() : null)
                    .objectiveMetric(configuration != null ? configuration.getObjectiveMetric() : null)
                    .experiments(experiments)
                    .bestExperiment(bestResultTracker.getBest())
                    .currentIndex(currentIndex)
                    .maxExperiments(maxExperiments)
                    .completedCount(completed)
                    .failedCount(experiments.size() - completed)
                    .progressPercent(maxExperiments > 0 ? currentIndex * 100.0 / maxExperiments : 0.0)
                    .elapsedMs(elapsedMs)
                    .estimatedRemainingMs(estimatedRemainingMs)
                    .stopRequested(status == SearchStatus.RUNNING && stopRequested.get())
                    .trailingImprovement(trailingImprovement)
                    .terminationReason(terminationReason)
                    .convergence(List.copyOf(convergence))
                    .build();
        }
    }

    public SearchStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public Long getSearchId() {
        return searchId;
    }

    public SearchConfiguration getConfiguration() {
        synchronized (lock) {
            return configuration;
        }
    }

    /**
     * Copy of the resolved parameter ranges, or an empty map before configuration.
     */
    public Map<String, ParameterRange> getRanges() {
        synchronized (lock) {
            return ranges != null ? SearchConfigurationValidator.copyAll(ranges) : Map.of();
        }
    }

    private long beginRun() {
        synchronized (lock) {
            if (status == SearchStatus.RUNNING) {
                throw new SearchStateException("Search " + searchId + " is already running", status);
            }
            if (loopActive) {
                throw new SearchStateException(
                        "Search " + searchId + " is still finishing an abandoned experiment", status);
            }
            if (configuration == null) {
                throw new SearchConfigurationException("Search " + searchId + " has not been configured");
            }

            experimentLog = new ExperimentLog(configuration.getMaxExperiments());
            bestResultTracker.reset();
            convergence.clear();
            currentIndex = 0;
            terminationReason = null;
            stopRequested.set(false);
            startedAtMs = System.currentTimeMillis();
            finishedAtMs = 0;
            status = SearchStatus.RUNNING;
            loopActive = true;
            generation++;

            metricsService.recordSearchStarted();
            log.info("Search {} started: family={}, metric={}, budget={}", searchId,
                    configuration.getModelFamily(), configuration.getObjectiveMetric().getWireName(),
                    configuration.getMaxExperiments());
            return generation;
        }
    }

    private void runLoop(long runGeneration) {
        MDC.put("searchId", String.valueOf(searchId));

        SearchConfiguration runConfiguration;
        Map<String, ParameterRange> runRanges;
        ExperimentLog runLog;
        synchronized (lock) {
            runConfiguration = configuration;
            runRanges = SearchConfigurationValidator.copyAll(ranges);
            runLog = experimentLog;
        }
        List<ParameterDefinition> definitions = catalog.definitionsFor(runConfiguration.getModelFamily());

        try {
            for (int index = 1; index <= runConfiguration.getMaxExperiments(); index++) {
                if (stopRequested.get()) {
                    finish(runGeneration, TerminationReason.STOPPED_BY_USER);
                    return;
                }

                CandidateConfiguration candidate = sampler.sample(definitions, runRanges);
                ExperimentRecord record = experimentRunner.run(candidate, runConfiguration, runLog);

                boolean halt;
                synchronized (lock) {
                    if (runGeneration != generation) {
                        log.info("Discarding experiment {} of an abandoned run", record.getExperimentId());
                        return;
                    }
                    currentIndex = index;
                    bestResultTracker.offer(record);
                    ExperimentRecord best = bestResultTracker.getBest();
                    convergence.add(new ConvergencePoint(index, best != null ? best.getScore() : 0.0,
                            record.getScore()));
                    halt = runConfiguration.isEarlyStoppingEnabled()
                            && earlyStoppingController.shouldStop(runLog.records(),
                            runConfiguration.getEarlyStoppingPatience());
                }
                notifyListeners();

                if (halt) {
                    log.info("Scores stagnated over the last {} experiments, stopping early",
                            runConfiguration.getEarlyStoppingPatience());
                    finish(runGeneration, TerminationReason.EARLY_STOPPED);
                    return;
                }

                if (index < runConfiguration.getMaxExperiments()) {
                    pause();
                }
            }
            finish(runGeneration, TerminationReason.MAX_EXPERIMENTS_REACHED);
        } catch (RuntimeException e) {
            log.error("Search {} failed unexpectedly: {}", searchId, e.getMessage(), e);
            finish(runGeneration, TerminationReason.INTERNAL_ERROR);
        } finally {
            synchronized (lock) {
                loopActive = false;
            }
            MDC.remove("searchId");
        }
    }

    private void finish(long runGeneration, TerminationReason reason) {
        synchronized (lock) {
            if (runGeneration != generation) {
                return;
            }
            status = reason == TerminationReason.MAX_EXPERIMENTS_REACHED
                    ? SearchStatus.COMPLETED
                    : SearchStatus.STOPPED;
            terminationReason = reason;
            finishedAtMs = System.currentTimeMillis();

            switch (reason) {
                case MAX_EXPERIMENTS_REACHED -> metricsService.recordSearchCompleted();
                case EARLY_STOPPED -> metricsService.recordSearchEarlyStopped();
                default -> metricsService.recordSearchStopped();
            }

            ExperimentRecord best = bestResultTracker.getBest();
            log.info("Search {} {} after {} experiments ({}), best score {}", searchId,
                    status.name().toLowerCase(), currentIndex, reason,
                    best != null ? String.format("%.4f", best.getScore()) : "n/a");
        }
        notifyListeners();
    }

    private void pause() {
        if (iterationPauseMs <= 0) {
            return;
        }
        try {
            Thread.sleep(iterationPauseMs);
        } catch (InterruptedException e) {
            log.warn("Search {} interrupted while pausing, treating as stop", searchId);
            stopRequested.set(true);
            Thread.currentThread().interrupt();
        }
    }

    private void notifyListeners() {
        if (listeners.isEmpty()) {
            return;
        }
        SearchState state = snapshot();
        for (SearchStateListener listener : listeners) {
            try {
                listener.onStateChanged(state);
            } catch (RuntimeException e) {
                log.warn("Search state listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
