package com.frauddetection.hypersearch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Scalar metric used to rank experiments.
 * Each metric carries the ordered list of field names the training service
 * has been seen to use for it; the first alias present in a payload wins.
 */
public enum ObjectiveMetric {
    ACCURACY("accuracy", List.of("accuracy", "Accuracy")),
    PRECISION("precision", List.of("precision", "Precision")),
    RECALL("recall", List.of("recall", "Recall")),
    F1("f1", List.of("f1Score", "f1_score", "F1Score", "f1", "F1")),
    AUC("auc", List.of("auc", "AUC", "Auc")),
    AUC_PR("auc_pr", List.of("aucPr", "aucpr", "auc_pr", "AUCPR", "AucPr"));

    private final String wireName;
    private final List<String> aliases;

    ObjectiveMetric(String wireName, List<String> aliases) {
        this.wireName = wireName;
        this.aliases = aliases;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public List<String> getAliases() {
        return aliases;
    }

    /**
     * Accepts the wire name, the enum name, or "f1_score" for F1.
     */
    @JsonCreator
    public static ObjectiveMetric fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Objective metric is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("f1_score".equals(normalized) || "f1score".equals(normalized)) {
            return F1;
        }
        return Arrays.stream(values())
                .filter(m -> m.wireName.equals(normalized) || m.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown objective metric: " + value));
    }
}
