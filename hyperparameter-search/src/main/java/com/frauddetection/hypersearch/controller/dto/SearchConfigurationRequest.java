package com.frauddetection.hypersearch.controller.dto;

import com.frauddetection.hypersearch.domain.ModelFamily;
import com.frauddetection.hypersearch.domain.ObjectiveMetric;
import com.frauddetection.hypersearch.domain.ParameterRange;
import com.frauddetection.hypersearch.domain.SearchConfiguration;
import com.frauddetection.hypersearch.domain.SearchStrategy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request DTO for configuring a new search.
 * Omitted settings fall back to the {@link SearchConfiguration} defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchConfigurationRequest {

    @NotNull(message = "Model family is required")
    private ModelFamily modelFamily;

    private ObjectiveMetric objectiveMetric;

    private SearchStrategy searchStrategy;

    @Min(value = 1, message = "maxExperiments must be at least 1")
    private Integer maxExperiments;

    @Min(value = 2, message = "crossValidationFolds must be at least 2")
    private Integer crossValidationFolds;

    private Boolean earlyStoppingEnabled;

    @Min(value = 1, message = "earlyStoppingPatience must be at least 1")
    private Integer earlyStoppingPatience;

    // parameter name -> override; parameters not listed keep their catalog range
    @Builder.Default
    private Map<String, ParameterRange> parameterRanges = new LinkedHashMap<>();

    public SearchConfiguration toConfiguration() {
        SearchConfiguration.SearchConfigurationBuilder builder = SearchConfiguration.builder()
                .modelFamily(modelFamily);
        if (objectiveMetric != null) {
            builder.objectiveMetric(objectiveMetric);
        }
        if (searchStrategy != null) {
            builder.searchStrategy(searchStrategy);
        }
        if (maxExperiments != null) {
            builder.maxExperiments(maxExperiments);
        }
        if (crossValidationFolds != null) {
            builder.crossValidationFolds(crossValidationFolds);
        }
        if (earlyStoppingEnabled != null) {
            builder.earlyStoppingEnabled(earlyStoppingEnabled);
        }
        if (earlyStoppingPatience != null) {
            builder.earlyStoppingPatience(earlyStoppingPatience);
        }
        return builder.build();
    }
}
