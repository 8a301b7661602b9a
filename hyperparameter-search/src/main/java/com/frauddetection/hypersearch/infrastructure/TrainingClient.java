package com.frauddetection.hypersearch.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.frauddetection.hypersearch.domain.CandidateConfiguration;
import com.frauddetection.hypersearch.domain.ModelFamily;

/**
 * Binding to the external training service.
 */
public interface TrainingClient {

    /**
     * Train one model with the given configuration. Blocks until the service answers.
     *
     * @param modelFamily the model family to fit
     * @param candidate   the full training configuration
     * @return the raw result payload, shape not guaranteed
     * @throws com.frauddetection.hypersearch.exception.TrainingClientException if no usable response arrives
     */
    JsonNode train(ModelFamily modelFamily, CandidateConfiguration candidate);
}
