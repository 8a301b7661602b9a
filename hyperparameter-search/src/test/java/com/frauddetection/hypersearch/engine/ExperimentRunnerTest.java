package com.frauddetection.hypersearch.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frauddetection.hypersearch.domain.CandidateConfiguration;
import com.frauddetection.hypersearch.domain.ExperimentRecord;
import com.frauddetection.hypersearch.domain.ExperimentStatus;
import com.frauddetection.hypersearch.domain.ModelFamily;
import com.frauddetection.hypersearch.domain.ObjectiveMetric;
import com.frauddetection.hypersearch.domain.SearchConfiguration;
import com.frauddetection.hypersearch.exception.TrainingClientException;
import com.frauddetection.hypersearch.infrastructure.TrainingClient;
import com.frauddetection.hypersearch.scoring.ScoreExtractor;
import com.frauddetection.hypersearch.service.SearchMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExperimentRunner outcome handling.
 */
@ExtendWith(MockitoExtension.class)
class ExperimentRunnerTest {

    @Mock
    private TrainingClient trainingClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private ExperimentRunner runner;
    private ExperimentLog experimentLog;

    private final CandidateConfiguration candidate = new CandidateConfiguration(
            Map.of("componentCount", 10, "anomalyThreshold", 2.5));

    private final SearchConfiguration configuration = SearchConfiguration.builder()
            .modelFamily(ModelFamily.PCA)
            .objectiveMetric(ObjectiveMetric.F1)
            .maxExperiments(3)
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        runner = new ExperimentRunner(trainingClient, new ScoreExtractor(),
                new SearchMetricsService(meterRegistry), objectMapper);
        experimentLog = new ExperimentLog(3);
    }

    @Test
    void testRun_Success() throws Exception {
        // Arrange
        when(trainingClient.train(eq(ModelFamily.PCA), any())).thenReturn(objectMapper.readTree(
                "{\"success\": true, \"actualModelName\": \"pca-20240101\", "
                        + "\"metrics\": {\"f1Score\": 0.74, \"accuracy\": 0.98}}"));

        // Act
        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        // Assert
        assertEquals(1, record.getExperimentId());
        assertEquals(ExperimentStatus.COMPLETED, record.getStatus());
        assertEquals(0.74, record.getScore());
        assertEquals(0.98, record.getRawMetrics().get("accuracy"));
        assertEquals("pca-20240101", record.getTrainedModelReference());
        assertSame(candidate, record.getParameters());
        assertNotNull(record.getStartedAt());
        assertNull(record.getFailureReason());
        assertEquals(1, experimentLog.size());
        assertEquals(1.0, meterRegistry.counter("hypersearch.experiments.completed").count());
        verify(trainingClient).train(ModelFamily.PCA, candidate);
    }

    @Test
    void testRun_ModelIdUnderData() throws Exception {
        when(trainingClient.train(any(), any())).thenReturn(objectMapper.readTree(
                "{\"data\": {\"modelId\": 42, \"metrics\": {\"F1Score\": 0.5}}}"));

        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        assertEquals("42", record.getTrainedModelReference());
        assertEquals(0.5, record.getScore());
    }

    @Test
    void testRun_ClientErrorProducesFailedRecord() {
        // Arrange
        when(trainingClient.train(any(), any()))
                .thenThrow(new TrainingClientException("Training service returned 500: boom"));

        // Act
        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        // Assert
        assertEquals(ExperimentStatus.FAILED, record.getStatus());
        assertEquals(0.0, record.getScore());
        assertTrue(record.getRawMetrics().isEmpty());
        assertEquals("Training service returned 500: boom", record.getFailureReason());
        assertEquals(1, experimentLog.size());
        assertEquals(1.0, meterRegistry.counter("hypersearch.experiments.failed").count());
    }

    @Test
    void testRun_UnexpectedExceptionProducesFailedRecord() {
        when(trainingClient.train(any(), any())).thenThrow(new IllegalStateException("bad state"));

        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        assertEquals(ExperimentStatus.FAILED, record.getStatus());
        assertEquals("bad state", record.getFailureReason());
    }

    @Test
    void testRun_TruthyErrorFieldProducesFailedRecord() throws Exception {
        when(trainingClient.train(any(), any())).thenReturn(objectMapper.readTree(
                "{\"error\": \"Dataset not loaded\", \"metrics\": {\"f1Score\": 0.9}}"));

        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        assertEquals(ExperimentStatus.FAILED, record.getStatus());
        assertEquals(0.0, record.getScore());
        assertTrue(record.getRawMetrics().isEmpty());
        assertEquals("Dataset not loaded", record.getFailureReason());
    }

    @Test
    void testRun_FalsyErrorFieldIsIgnored() throws Exception {
        when(trainingClient.train(any(), any())).thenReturn(objectMapper.readTree(
                "{\"error\": \"\", \"metrics\": {\"f1Score\": 0.9}}"));

        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        assertEquals(ExperimentStatus.COMPLETED, record.getStatus());
        assertEquals(0.9, record.getScore());
    }

    @Test
    void testRun_SuccessFalseProducesFailedRecord() throws Exception {
        when(trainingClient.train(any(), any())).thenReturn(objectMapper.readTree(
                "{\"success\": false, \"message\": \"Training timed out\"}"));

        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        assertEquals(ExperimentStatus.FAILED, record.getStatus());
        assertEquals("Training timed out", record.getFailureReason());
    }

    @Test
    void testRun_NullPayloadProducesFailedRecord() {
        when(trainingClient.train(any(), any())).thenReturn(null);

        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        assertEquals(ExperimentStatus.FAILED, record.getStatus());
        assertEquals(0.0, record.getScore());
    }

    @Test
    void testRun_NoMetricsCompletesWithZeroScore() throws Exception {
        when(trainingClient.train(any(), any())).thenReturn(objectMapper.readTree("{\"success\": true}"));

        ExperimentRecord record = runner.run(candidate, configuration, experimentLog);

        assertEquals(ExperimentStatus.COMPLETED, record.getStatus());
        assertEquals(0.0, record.getScore());
        assertTrue(record.getRawMetrics().isEmpty());
        assertEquals(1.0, meterRegistry.counter("hypersearch.experiments.no_metrics").count());
    }

    @Test
    void testRun_IdsFollowLogPosition() throws Exception {
        when(trainingClient.train(any(), any()))
                .thenReturn(objectMapper.readTree("{\"metrics\": {\"f1\": 0.1}}"))
                .thenThrow(new TrainingClientException("down"))
                .thenReturn(objectMapper.readTree("{\"metrics\": {\"f1\": 0.3}}"));

        ExperimentRecord first = runner.run(candidate, configuration, experimentLog);
        ExperimentRecord second = runner.run(candidate, configuration, experimentLog);
        ExperimentRecord third = runner.run(candidate, configuration, experimentLog);

        assertEquals(1, first.getExperimentId());
        assertEquals(2, second.getExperimentId());
        assertEquals(3, third.getExperimentId());
        assertEquals(3, experimentLog.records().size());
        assertEquals(ExperimentStatus.FAILED, experimentLog.records().get(1).getStatus());
    }

    @Test
    void testRun_ReportsOutcomesThroughRecorder() throws Exception {
        // Arrange
        SearchMetricsRecorder recorder = mock(SearchMetricsRecorder.class);
        ExperimentRunner recordingRunner = new ExperimentRunner(trainingClient, new ScoreExtractor(), recorder,
                objectMapper);
        when(trainingClient.train(any(), any()))
                .thenReturn(objectMapper.readTree("{\"metrics\": {\"f1\": 0.4}}"))
                .thenThrow(new TrainingClientException("down"));

        // Act
        recordingRunner.run(candidate, configuration, experimentLog);
        recordingRunner.run(candidate, configuration, experimentLog);

        // Assert
        verify(recorder).recordExperimentCompleted(anyLong());
        verify(recorder).recordExperimentFailed(anyLong());
        verify(recorder, never()).recordMetricsMissing();
    }
}
