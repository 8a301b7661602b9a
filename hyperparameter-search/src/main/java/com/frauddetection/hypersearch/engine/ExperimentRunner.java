package com.frauddetection.hypersearch.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frauddetection.hypersearch.domain.CandidateConfiguration;
import com.frauddetection.hypersearch.domain.ExperimentRecord;
import com.frauddetection.hypersearch.domain.ExperimentStatus;
import com.frauddetection.hypersearch.domain.SearchConfiguration;
import com.frauddetection.hypersearch.exception.TrainingClientException;
import com.frauddetection.hypersearch.infrastructure.TrainingClient;
import com.frauddetection.hypersearch.scoring.ScoreExtraction;
import com.frauddetection.hypersearch.scoring.ScoreExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a single training attempt for a candidate and turns the outcome into an
 * {@link ExperimentRecord}. Every call appends exactly one record to the log,
 * whether the attempt succeeded or not; no error escapes to the caller.
 */
@RequiredArgsConstructor
@Slf4j
public class ExperimentRunner {

    private static final TypeReference<Map<String, Object>> METRICS_TYPE = new TypeReference<>() {
    };

    private static final List<String> MODEL_REFERENCE_FIELDS = List.of("actualModelName", "modelId");

    private static final int MAX_FAILURE_REASON_LENGTH = 1000;

    private final TrainingClient trainingClient;
    private final ScoreExtractor scoreExtractor;
    private final SearchMetricsRecorder metricsService;
    private final ObjectMapper objectMapper;

    public ExperimentRecord run(CandidateConfiguration candidate, SearchConfiguration configuration,
                                ExperimentLog experimentLog) {
        int experimentId = experimentLog.nextExperimentId();
        MDC.put("experimentId", String.valueOf(experimentId));

        try {
            ExperimentRecord record = execute(experimentId, candidate, configuration);
            experimentLog.append(record);
            return record;
        } finally {
            MDC.remove("experimentId");
        }
    }

    private ExperimentRecord execute(int experimentId, CandidateConfiguration candidate,
                                     SearchConfiguration configuration) {
        Instant startedAt = Instant.now();
        long startTime = System.currentTimeMillis();

        log.info("Started with {}", candidate.values());

        JsonNode payload;
        try {
            payload = trainingClient.train(configuration.getModelFamily(), candidate);
        } catch (TrainingClientException e) {
            log.warn("Training failed: {}", e.getMessage());
            return failed(experimentId, candidate, startedAt, startTime, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error during training: {}", e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return failed(experimentId, candidate, startedAt, startTime, message);
        }

        String failureReason = reportedFailure(payload);
        if (failureReason != null) {
            log.warn("Training service reported failure: {}", failureReason);
            return failed(experimentId, candidate, startedAt, startTime, failureReason);
        }

        ScoreExtraction extraction = scoreExtractor.extract(payload, configuration.getObjectiveMetric());
        Map<String, Object> rawMetrics = Map.of();
        if (extraction.isMetricsFound()) {
            rawMetrics = Collections.unmodifiableMap(
                    new LinkedHashMap<>(objectMapper.convertValue(extraction.getMetrics(), METRICS_TYPE)));
        } else {
            metricsService.recordMetricsMissing();
        }

        long executionTimeMs = System.currentTimeMillis() - startTime;
        metricsService.recordExperimentCompleted(executionTimeMs);

        log.info("Completed in {}ms, {} = {}", executionTimeMs,
                configuration.getObjectiveMetric().getWireName(), String.format("%.4f", extraction.getScore()));

        return ExperimentRecord.builder()
                .experimentId(experimentId)
                .parameters(candidate)
                .score(extraction.getScore())
                .rawMetrics(rawMetrics)
                .status(ExperimentStatus.COMPLETED)
                .startedAt(startedAt)
                .executionTimeMs(executionTimeMs)
                .trainedModelReference(modelReference(payload))
                .build();
    }

    private ExperimentRecord failed(int experimentId, CandidateConfiguration candidate, Instant startedAt,
                                    long startTime, String reason) {
        long executionTimeMs = System.currentTimeMillis() - startTime;
        metricsService.recordExperimentFailed(executionTimeMs);

        String failureReason = reason != null ? reason : "Unknown training failure";
        if (failureReason.length() > MAX_FAILURE_REASON_LENGTH) {
            failureReason = failureReason.substring(0, MAX_FAILURE_REASON_LENGTH - 3) + "...";
        }

        return ExperimentRecord.builder()
                .experimentId(experimentId)
                .parameters(candidate)
                .score(0.0)
                .status(ExperimentStatus.FAILED)
                .startedAt(startedAt)
                .executionTimeMs(executionTimeMs)
                .failureReason(failureReason)
                .build();
    }

    /**
     * Failure reported inside a 2xx payload: a missing body, a truthy {@code error}
     * field or {@code success: false}.
     */
    private static String reportedFailure(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return "Training service returned no result";
        }

        JsonNode error = payload.get("error");
        if (isTruthy(error)) {
            return error.isTextual() ? error.asText() : error.toString();
        }

        JsonNode success = payload.get("success");
        if (success != null && success.isBoolean() && !success.booleanValue()) {
            JsonNode message = payload.get("message");
            return message != null && message.isTextual() && !message.asText().isBlank()
                    ? message.asText()
                    : "Training service reported success=false";
        }
        return null;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0;
        }
        return true;
    }

    private static String modelReference(JsonNode payload) {
        for (JsonNode container : new JsonNode[]{payload, payload.get("data")}) {
            if (container == null || !container.isObject()) {
                continue;
            }
            for (String field : MODEL_REFERENCE_FIELDS) {
                JsonNode value = container.get(field);
                if (value != null && !value.isNull() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
        }
        return null;
    }
}
