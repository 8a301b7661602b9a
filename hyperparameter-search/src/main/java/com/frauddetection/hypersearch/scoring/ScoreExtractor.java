package com.frauddetection.hypersearch.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.frauddetection.hypersearch.domain.ObjectiveMetric;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Normalizes a training result payload of unstable shape into one scalar score.
 * <p>
 * The metrics structure is located by trying an ordered list of accessors, first
 * match wins: {@code metrics}, {@code basicMetrics}, {@code Metrics}, {@code BasicMetrics},
 * the same four names under {@code data}, and finally the payload itself when it carries
 * a recognizable metric field. The objective is then resolved through the alias table on
 * {@link ObjectiveMetric}. Missing or non-numeric values score 0; nothing is thrown.
 */
@Slf4j
public class ScoreExtractor {

    static final List<String> METRICS_FIELDS = List.of("metrics", "basicMetrics", "Metrics", "BasicMetrics");
    static final String DATA_FIELD = "data";

    private static final List<UnaryOperator<JsonNode>> LOCATORS;

    static {
        List<UnaryOperator<JsonNode>> locators = new ArrayList<>();
        for (String field : METRICS_FIELDS) {
            locators.add(payload -> payload.get(field));
        }
        for (String field : METRICS_FIELDS) {
            locators.add(payload -> payload.path(DATA_FIELD).get(field));
        }
        locators.add(payload -> containsRecognizableMetric(payload) ? payload : null);
        LOCATORS = Collections.unmodifiableList(locators);
    }

    public double extractScore(JsonNode payload, ObjectiveMetric objectiveMetric) {
        return extract(payload, objectiveMetric).getScore();
    }

    public ScoreExtraction extract(JsonNode payload, ObjectiveMetric objectiveMetric) {
        Optional<JsonNode> located = locateMetrics(payload);
        if (located.isEmpty()) {
            log.warn("No metrics located in training result, scoring 0 for {}", objectiveMetric.getWireName());
            return ScoreExtraction.noMetrics();
        }

        JsonNode metrics = located.get();
        for (String alias : objectiveMetric.getAliases()) {
            JsonNode value = metrics.get(alias);
            if (value != null && !value.isNull()) {
                return new ScoreExtraction(toFiniteDouble(alias, value), metrics, alias);
            }
        }

        log.debug("Objective {} not present in metrics {}", objectiveMetric.getWireName(), metrics);
        return new ScoreExtraction(0.0, metrics, null);
    }

    public Optional<JsonNode> locateMetrics(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        for (UnaryOperator<JsonNode> locator : LOCATORS) {
            JsonNode candidate = locator.apply(payload);
            if (candidate != null && candidate.isObject()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean containsRecognizableMetric(JsonNode node) {
        for (ObjectiveMetric metric : ObjectiveMetric.values()) {
            for (String alias : metric.getAliases()) {
                if (node.has(alias)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static double toFiniteDouble(String field, JsonNode value) {
        double parsed;
        if (value.isNumber()) {
            parsed = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Metric {} is not numeric: '{}'", field, value.asText());
                return 0.0;
            }
        } else {
            log.warn("Metric {} has unsupported type {}", field, value.getNodeType());
            return 0.0;
        }
        return Double.isFinite(parsed) ? parsed : 0.0;
    }
}
