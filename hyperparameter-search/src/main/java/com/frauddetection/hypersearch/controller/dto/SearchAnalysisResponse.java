package com.frauddetection.hypersearch.controller.dto;

import com.frauddetection.hypersearch.domain.ConvergenceAnalysis;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTO for the post-hoc analysis of a search's experiments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchAnalysisResponse {

    private Long searchId;
    private int experimentCount;
    private Map<String, Double> parameterImportance;
    private Map<String, Map<String, Double>> parameterCorrelations;
    private ConvergenceAnalysis convergence;
}
