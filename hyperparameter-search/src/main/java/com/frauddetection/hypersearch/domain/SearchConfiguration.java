package com.frauddetection.hypersearch.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for one search run. Immutable once the run starts.
 */
@Value
@Builder(toBuilder = true)
public class SearchConfiguration {

    ModelFamily modelFamily;

    @Builder.Default
    ObjectiveMetric objectiveMetric = ObjectiveMetric.F1;

    @Builder.Default
    SearchStrategy searchStrategy = SearchStrategy.RANDOM;

    @Builder.Default
    int maxExperiments = 20;

    @Builder.Default
    int crossValidationFolds = 5;

    @Builder.Default
    boolean earlyStoppingEnabled = true;

    @Builder.Default
    int earlyStoppingPatience = 3;
}
