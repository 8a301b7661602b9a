package com.frauddetection.hypersearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frauddetection.hypersearch.engine.EarlyStoppingController;
import com.frauddetection.hypersearch.engine.ExperimentRunner;
import com.frauddetection.hypersearch.infrastructure.TrainingClient;
import com.frauddetection.hypersearch.sampling.ParameterSpaceSampler;
import com.frauddetection.hypersearch.scoring.ScoreExtractor;
import com.frauddetection.hypersearch.service.SearchMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Wires the stateless search engine components shared by every search.
 */
@Configuration
@Slf4j
public class SearchEngineConfig {

    @Bean
    public ParameterSpaceSampler parameterSpaceSampler(
            @Value("${hypersearch.search.random-seed:#{null}}") Long randomSeed) {
        if (randomSeed != null) {
            log.info("Sampling with fixed random seed {}", randomSeed);
            return new ParameterSpaceSampler(new Random(randomSeed));
        }
        return new ParameterSpaceSampler();
    }

    @Bean
    public ScoreExtractor scoreExtractor() {
        return new ScoreExtractor();
    }

    @Bean
    public EarlyStoppingController earlyStoppingController(
            @Value("${hypersearch.early-stopping.exclude-failed:false}") boolean excludeFailed) {
        return new EarlyStoppingController(excludeFailed);
    }

    @Bean
    public ExperimentRunner experimentRunner(TrainingClient trainingClient,
                                             ScoreExtractor scoreExtractor,
                                             SearchMetricsService metricsService,
                                             ObjectMapper objectMapper) {
        return new ExperimentRunner(trainingClient, scoreExtractor, metricsService, objectMapper);
    }
}
