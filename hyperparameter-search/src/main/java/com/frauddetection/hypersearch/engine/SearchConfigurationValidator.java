package com.frauddetection.hypersearch.engine;

import com.frauddetection.hypersearch.catalog.ParameterCatalog;
import com.frauddetection.hypersearch.domain.ParameterDefinition;
import com.frauddetection.hypersearch.domain.ParameterRange;
import com.frauddetection.hypersearch.domain.ParameterType;
import com.frauddetection.hypersearch.domain.SearchConfiguration;
import com.frauddetection.hypersearch.exception.SearchConfigurationException;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a configuration before a run and resolves the effective parameter ranges:
 * catalog defaults with the caller's overrides merged on top, in catalog order.
 */
@RequiredArgsConstructor
public class SearchConfigurationValidator {

    private final ParameterCatalog catalog;

    public Map<String, ParameterRange> validate(SearchConfiguration configuration,
                                                Map<String, ParameterRange> overrides) {
        if (configuration == null) {
            throw new SearchConfigurationException("Search configuration is required");
        }
        if (configuration.getModelFamily() == null) {
            throw new SearchConfigurationException("Model family is required");
        }
        if (configuration.getObjectiveMetric() == null) {
            throw new SearchConfigurationException("Objective metric is required");
        }
        if (configuration.getSearchStrategy() == null) {
            throw new SearchConfigurationException("Search strategy is required");
        }
        if (configuration.getMaxExperiments() < 1) {
            throw new SearchConfigurationException(
                    "maxExperiments must be at least 1, was " + configuration.getMaxExperiments());
        }
        if (configuration.getEarlyStoppingPatience() < 1) {
            throw new SearchConfigurationException(
                    "earlyStoppingPatience must be at least 1, was " + configuration.getEarlyStoppingPatience());
        }
        if (configuration.getCrossValidationFolds() < 2) {
            throw new SearchConfigurationException(
                    "crossValidationFolds must be at least 2, was " + configuration.getCrossValidationFolds());
        }

        Map<String, ParameterRange> ranges = catalog.defaultRanges(configuration.getModelFamily());

        if (overrides != null) {
            for (Map.Entry<String, ParameterRange> entry : overrides.entrySet()) {
                if (!ranges.containsKey(entry.getKey())) {
                    throw new SearchConfigurationException("Unknown parameter '" + entry.getKey()
                            + "' for model family " + configuration.getModelFamily());
                }
                if (entry.getValue() != null) {
                    ranges.put(entry.getKey(), copyOf(entry.getValue()));
                }
            }
        }

        int enabled = 0;
        for (ParameterDefinition definition : catalog.definitionsFor(configuration.getModelFamily())) {
            ParameterRange range = ranges.get(definition.getName());
            if (!range.isEnabled()) {
                continue;
            }
            enabled++;
            if (definition.isNumeric()) {
                checkBounds(definition, range);
            }
        }

        if (enabled == 0) {
            throw new SearchConfigurationException("At least one parameter must be enabled");
        }
        return ranges;
    }

    private static void checkBounds(ParameterDefinition definition, ParameterRange range) {
        if (range.getMin() == null || range.getMax() == null) {
            throw new SearchConfigurationException("Parameter '" + definition.getName()
                    + "' is enabled but has no min/max bounds");
        }
        if (!Double.isFinite(range.getMin()) || !Double.isFinite(range.getMax())) {
            throw new SearchConfigurationException("Parameter '" + definition.getName()
                    + "' bounds must be finite numbers");
        }
        if (range.getMin() > range.getMax()) {
            throw new SearchConfigurationException("Parameter '" + definition.getName()
                    + "' has min " + range.getMin() + " greater than max " + range.getMax());
        }
        if (definition.getType() == ParameterType.INT) {
            if (range.getMin() < Integer.MIN_VALUE || range.getMax() > Integer.MAX_VALUE) {
                throw new SearchConfigurationException("Parameter '" + definition.getName()
                        + "' bounds must lie within " + Integer.MIN_VALUE + ".." + Integer.MAX_VALUE);
            }
            if (Math.ceil(range.getMin()) > Math.floor(range.getMax())) {
                throw new SearchConfigurationException("Parameter '" + definition.getName()
                        + "' range [" + range.getMin() + ", " + range.getMax() + "] contains no integer");
            }
        } else if (!Double.isFinite(range.getMax() - range.getMin())) {
            throw new SearchConfigurationException("Parameter '" + definition.getName()
                    + "' range is too wide to sample");
        }
    }

    private static ParameterRange copyOf(ParameterRange range) {
        List<Object> allowedValues = range.getAllowedValues() != null
                ? new ArrayList<>(range.getAllowedValues())
                : new ArrayList<>();
        return ParameterRange.builder()
                .enabled(range.isEnabled())
                .min(range.getMin())
                .max(range.getMax())
                .step(range.getStep())
                .allowedValues(allowedValues)
                .build();
    }

    /**
     * Deep copy of resolved ranges, so a running search never sees later edits.
     */
    static Map<String, ParameterRange> copyAll(Map<String, ParameterRange> ranges) {
        Map<String, ParameterRange> copy = new LinkedHashMap<>();
        ranges.forEach((name, range) -> copy.put(name, copyOf(range)));
        return copy;
    }
}
