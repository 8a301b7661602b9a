package com.frauddetection.hypersearch.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frauddetection.hypersearch.controller.dto.SearchAnalysisResponse;
import com.frauddetection.hypersearch.controller.dto.SearchConfigurationRequest;
import com.frauddetection.hypersearch.domain.CandidateConfiguration;
import com.frauddetection.hypersearch.domain.ConvergenceAnalysis;
import com.frauddetection.hypersearch.domain.ExperimentRecord;
import com.frauddetection.hypersearch.domain.ExperimentStatus;
import com.frauddetection.hypersearch.domain.ModelFamily;
import com.frauddetection.hypersearch.domain.ObjectiveMetric;
import com.frauddetection.hypersearch.domain.SearchState;
import com.frauddetection.hypersearch.domain.SearchStatus;
import com.frauddetection.hypersearch.exception.SearchConfigurationException;
import com.frauddetection.hypersearch.exception.SearchNotFoundException;
import com.frauddetection.hypersearch.exception.SearchStateException;
import com.frauddetection.hypersearch.service.SearchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for TuningController and its error mapping.
 */
@WebMvcTest(TuningController.class)
class TuningControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private SearchService searchService;

    @Test
    void testCreateSearch_Success() throws Exception {
        // Arrange
        when(searchService.createSearch(any())).thenReturn(idleState(1L));

        // Act & Assert
        mockMvc.perform(post("/searches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelFamily\":\"lightgbm\",\"objectiveMetric\":\"f1_score\","
                                + "\"maxExperiments\":10,\"parameterRanges\":{\"numberOfTrees\":"
                                + "{\"enabled\":true,\"min\":100,\"max\":500,\"step\":100}}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.searchId").value(1))
                .andExpect(jsonPath("$.status").value("IDLE"))
                .andExpect(jsonPath("$.objectiveMetric").value("f1"))
                .andExpect(jsonPath("$.experiments").isEmpty());

        verify(searchService).createSearch(argThat(request ->
                request.getModelFamily() == ModelFamily.LIGHTGBM
                        && request.getObjectiveMetric() == ObjectiveMetric.F1
                        && request.getParameterRanges().get("numberOfTrees").getMax() == 500.0));
    }

    @Test
    void testCreateSearch_MissingModelFamily() throws Exception {
        mockMvc.perform(post("/searches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SearchConfigurationRequest())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("modelFamily")));

        verifyNoInteractions(searchService);
    }

    @Test
    void testCreateSearch_NonPositiveBudget() throws Exception {
        mockMvc.perform(post("/searches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelFamily\":\"PCA\",\"maxExperiments\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testCreateSearch_UnknownModelFamily() throws Exception {
        mockMvc.perform(post("/searches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelFamily\":\"xgboost\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testCreateSearch_ConfigurationError() throws Exception {
        when(searchService.createSearch(any()))
                .thenThrow(new SearchConfigurationException("At least one parameter must be enabled"));

        mockMvc.perform(post("/searches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"modelFamily\":\"PCA\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value("At least one parameter must be enabled"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void testGetSearch_NotFound() throws Exception {
        when(searchService.getSearch(7L)).thenThrow(new SearchNotFoundException(7L));

        mockMvc.perform(get("/searches/7"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Search not found: 7"));
    }

    @Test
    void testStartSearch_Accepted() throws Exception {
        when(searchService.startSearch(1L)).thenReturn(SearchState.builder()
                .searchId(1L)
                .status(SearchStatus.RUNNING)
                .maxExperiments(10)
                .build());

        mockMvc.perform(post("/searches/1/start"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void testStartSearch_AlreadyRunningConflict() throws Exception {
        when(searchService.startSearch(1L))
                .thenThrow(new SearchStateException("Search 1 is already running", SearchStatus.RUNNING));

        mockMvc.perform(post("/searches/1/start"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void testStopSearch_Accepted() throws Exception {
        when(searchService.stopSearch(1L)).thenReturn(SearchState.builder()
                .searchId(1L)
                .status(SearchStatus.RUNNING)
                .stopRequested(true)
                .build());

        mockMvc.perform(post("/searches/1/stop"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.stopRequested").value(true));
    }

    @Test
    void testResetSearch_Ok() throws Exception {
        when(searchService.resetSearch(1L)).thenReturn(idleState(1L));

        mockMvc.perform(post("/searches/1/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IDLE"));
    }

    @Test
    void testTopExperiments() throws Exception {
        ExperimentRecord record = ExperimentRecord.builder()
                .experimentId(4)
                .parameters(new CandidateConfiguration(Map.of("componentCount", 15)))
                .score(0.91)
                .rawMetrics(Map.of("auc", 0.91))
                .status(ExperimentStatus.COMPLETED)
                .trainedModelReference("pca-4")
                .build();
        when(searchService.topExperiments(1L, 3)).thenReturn(List.of(record));

        mockMvc.perform(get("/searches/1/top").param("count", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].experimentId").value(4))
                .andExpect(jsonPath("$[0].parameters.componentCount").value(15))
                .andExpect(jsonPath("$[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$[0].trainedModelReference").value("pca-4"));
    }

    @Test
    void testAnalysis() throws Exception {
        when(searchService.analyze(1L)).thenReturn(SearchAnalysisResponse.builder()
                .searchId(1L)
                .experimentCount(6)
                .parameterImportance(Map.of("componentCount", 0.8))
                .parameterCorrelations(Map.of())
                .convergence(new ConvergenceAnalysis(true, 0.99))
                .build());

        mockMvc.perform(get("/searches/1/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.parameterImportance.componentCount").value(0.8))
                .andExpect(jsonPath("$.convergence.converging").value(true));
    }

    @Test
    void testDeleteSearch() throws Exception {
        mockMvc.perform(delete("/searches/1"))
                .andExpect(status().isNoContent());

        verify(searchService).deleteSearch(1L);
    }

    @Test
    void testDeleteSearch_RunningConflict() throws Exception {
        doThrow(new SearchStateException("Cannot delete running search 1", SearchStatus.RUNNING))
                .when(searchService).deleteSearch(1L);

        mockMvc.perform(delete("/searches/1"))
                .andExpect(status().isConflict());
    }

    private static SearchState idleState(Long searchId) {
        return SearchState.builder()
                .searchId(searchId)
                .status(SearchStatus.IDLE)
                .modelFamily(ModelFamily.LIGHTGBM)
                .objectiveMetric(ObjectiveMetric.F1)
                .maxExperiments(10)
                .build();
    }
}
