package com.frauddetection.hypersearch;

import com.frauddetection.hypersearch.catalog.ParameterCatalog;
import com.frauddetection.hypersearch.infrastructure.TrainingClient;
import com.frauddetection.hypersearch.service.SearchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
class HyperparameterSearchApplicationTests {

    @Autowired
    private SearchService searchService;

    @Autowired
    private TrainingClient trainingClient;

    @Autowired
    private ParameterCatalog parameterCatalog;

    @Test
    void contextLoads() {
        assertNotNull(searchService);
        assertNotNull(trainingClient);
        assertNotNull(parameterCatalog);
    }
}
