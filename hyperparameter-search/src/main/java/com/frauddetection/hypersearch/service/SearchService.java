package com.frauddetection.hypersearch.service;

import com.frauddetection.hypersearch.catalog.ParameterCatalog;
import com.frauddetection.hypersearch.controller.dto.SearchAnalysisResponse;
import com.frauddetection.hypersearch.controller.dto.SearchConfigurationRequest;
import com.frauddetection.hypersearch.domain.ExperimentRecord;
import com.frauddetection.hypersearch.domain.SearchState;
import com.frauddetection.hypersearch.domain.SearchStatus;
import com.frauddetection.hypersearch.engine.EarlyStoppingController;
import com.frauddetection.hypersearch.engine.ExperimentRunner;
import com.frauddetection.hypersearch.engine.SearchAnalysis;
import com.frauddetection.hypersearch.engine.SearchController;
import com.frauddetection.hypersearch.exception.SearchNotFoundException;
import com.frauddetection.hypersearch.exception.SearchStateException;
import com.frauddetection.hypersearch.sampling.ParameterSpaceSampler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Service for managing independent hyperparameter searches.
 * Each search owns its own SearchController; runs are hosted on a bounded executor.
 */
@Service
@Slf4j
public class SearchService {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final ParameterCatalog catalog;
    private final ParameterSpaceSampler sampler;
    private final ExperimentRunner experimentRunner;
    private final EarlyStoppingController earlyStoppingController;
    private final SearchMetricsService metricsService;
    private final ExecutorService searchExecutorService;
    private final long iterationPauseMs;

    private final Map<Long, SearchController> searches = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    public SearchService(ParameterCatalog catalog,
                         ParameterSpaceSampler sampler,
                         ExperimentRunner experimentRunner,
                         EarlyStoppingController earlyStoppingController,
                         SearchMetricsService metricsService,
                         @Qualifier("searchExecutorService") ExecutorService searchExecutorService,
                         @Value("${hypersearch.search.iteration-pause-ms:0}") long iterationPauseMs) {
        this.catalog = catalog;
        this.sampler = sampler;
        this.experimentRunner = experimentRunner;
        this.earlyStoppingController = earlyStoppingController;
        this.metricsService = metricsService;
        this.searchExecutorService = searchExecutorService;
        this.iterationPauseMs = iterationPauseMs;
    }

    /**
     * Create and configure a new search. Invalid configurations are rejected before
     * the search is registered.
     */
    public SearchState createSearch(SearchConfigurationRequest request) {
        Long searchId = idSequence.incrementAndGet();
        SearchController controller = new SearchController(searchId, catalog, sampler, experimentRunner,
                earlyStoppingController, metricsService, iterationPauseMs);

        controller.configure(request.toConfiguration(), request.getParameterRanges());
        searches.put(searchId, controller);

        log.info("Created search {} for {}", searchId, request.getModelFamily());
        return controller.snapshot();
    }

    public SearchState startSearch(Long searchId) {
        SearchController controller = find(searchId);
        try {
            return controller.startAsync(searchExecutorService);
        } catch (RejectedExecutionException e) {
            throw new SearchStateException("Too many searches running, try again later", controller.getStatus());
        }
    }

    public SearchState stopSearch(Long searchId) {
        SearchController controller = find(searchId);
        controller.stop();
        return controller.snapshot();
    }

    public SearchState resetSearch(Long searchId) {
        SearchController controller = find(searchId);
        controller.reset();
        return controller.snapshot();
    }

    public SearchState getSearch(Long searchId) {
        return find(searchId).snapshot();
    }

    public List<SearchState> listSearches() {
        List<SearchState> states = new ArrayList<>();
        searches.values().forEach(controller -> states.add(controller.snapshot()));
        return states;
    }

    public List<ExperimentRecord> topExperiments(Long searchId, int count) {
        return SearchAnalysis.topExperiments(find(searchId).snapshot().getExperiments(), count);
    }

    public SearchAnalysisResponse analyze(Long searchId) {
        SearchState state = find(searchId).snapshot();
        return SearchAnalysisResponse.builder()
                .searchId(searchId)
                .experimentCount(state.getExperiments().size())
                .parameterImportance(SearchAnalysis.parameterImportance(state.getExperiments()))
                .parameterCorrelations(SearchAnalysis.parameterCorrelations(state.getExperiments()))
                .convergence(SearchAnalysis.convergenceAnalysis(state.getConvergence()))
                .build();
    }

    /**
     * Discard a search. A running search must be stopped first.
     */
    public void deleteSearch(Long searchId) {
        SearchController controller = find(searchId);
        if (controller.getStatus() == SearchStatus.RUNNING) {
            throw new SearchStateException("Cannot delete running search " + searchId, SearchStatus.RUNNING);
        }
        searches.remove(searchId);
        log.info("Deleted search {}", searchId);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping all running searches...");

        searches.values().stream()
                .filter(controller -> controller.getStatus() == SearchStatus.RUNNING)
                .forEach(controller -> {
                    try {
                        controller.stop();
                    } catch (SearchStateException e) {
                        log.debug("Search {} finished before stop: {}", controller.getSearchId(), e.getMessage());
                    }
                });

        searchExecutorService.shutdown();

        try {
            if (!searchExecutorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Searches did not finish their in-flight experiments, forcing shutdown");
                searchExecutorService.shutdownNow();
            } else {
                log.info("All searches stopped gracefully");
            }
            log.info(metricsService.getMetricsSummary());
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for searches to stop", e);
            searchExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private SearchController find(Long searchId) {
        SearchController controller = searches.get(searchId);
        if (controller == null) {
            throw new SearchNotFoundException(searchId);
        }
        return controller;
    }
}
