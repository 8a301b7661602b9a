package com.frauddetection.hypersearch.controller;

import com.frauddetection.hypersearch.controller.dto.SearchAnalysisResponse;
import com.frauddetection.hypersearch.controller.dto.SearchConfigurationRequest;
import com.frauddetection.hypersearch.domain.ExperimentRecord;
import com.frauddetection.hypersearch.domain.SearchState;
import com.frauddetection.hypersearch.service.SearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for hyperparameter search operations.
 */
@RestController
@RequestMapping("/searches")
@RequiredArgsConstructor
@Slf4j
public class TuningController {

    private final SearchService searchService;

    /**
     * Configure a new search.
     *
     * @param request model family, objective, budget and parameter range overrides
     * @return the initial IDLE snapshot
     */
    @PostMapping
    public ResponseEntity<SearchState> createSearch(@Valid @RequestBody SearchConfigurationRequest request) {

        log.info("POST /searches - Family: {}, Budget: {}",
                request.getModelFamily(), request.getMaxExperiments());

        SearchState state = searchService.createSearch(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(state);
    }

    @GetMapping
    public ResponseEntity<List<SearchState>> listSearches() {
        return ResponseEntity.ok(searchService.listSearches());
    }

    @GetMapping("/{searchId}")
    public ResponseEntity<SearchState> getSearch(@PathVariable Long searchId) {
        return ResponseEntity.ok(searchService.getSearch(searchId));
    }

    /**
     * Start the search in the background.
     */
    @PostMapping("/{searchId}/start")
    public ResponseEntity<SearchState> startSearch(@PathVariable Long searchId) {

        log.info("POST /searches/{}/start", searchId);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(searchService.startSearch(searchId));
    }

    /**
     * Request a cooperative stop. The in-flight experiment is allowed to finish.
     */
    @PostMapping("/{searchId}/stop")
    public ResponseEntity<SearchState> stopSearch(@PathVariable Long searchId) {

        log.info("POST /searches/{}/stop", searchId);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(searchService.stopSearch(searchId));
    }

    @PostMapping("/{searchId}/reset")
    public ResponseEntity<SearchState> resetSearch(@PathVariable Long searchId) {

        log.info("POST /searches/{}/reset", searchId);

        return ResponseEntity.ok(searchService.resetSearch(searchId));
    }

    @GetMapping("/{searchId}/top")
    public ResponseEntity<List<ExperimentRecord>> topExperiments(@PathVariable Long searchId,
                                                                 @RequestParam(defaultValue = "5") int count) {
        return ResponseEntity.ok(searchService.topExperiments(searchId, count));
    }

    @GetMapping("/{searchId}/analysis")
    public ResponseEntity<SearchAnalysisResponse> analyze(@PathVariable Long searchId) {
        return ResponseEntity.ok(searchService.analyze(searchId));
    }

    @DeleteMapping("/{searchId}")
    public ResponseEntity<Void> deleteSearch(@PathVariable Long searchId) {

        log.info("DELETE /searches/{}", searchId);

        searchService.deleteSearch(searchId);
        return ResponseEntity.noContent().build();
    }
}
