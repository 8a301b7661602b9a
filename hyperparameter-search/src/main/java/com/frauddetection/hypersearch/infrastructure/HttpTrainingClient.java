package com.frauddetection.hypersearch.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frauddetection.hypersearch.domain.CandidateConfiguration;
import com.frauddetection.hypersearch.domain.ModelFamily;
import com.frauddetection.hypersearch.exception.TrainingClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP implementation of TrainingClient.
 * POSTs the candidate as a JSON object to one endpoint per model family and
 * returns the body as an opaque JSON tree.
 */
@Component
@Slf4j
public class HttpTrainingClient implements TrainingClient {

    private static final List<String> ERROR_MESSAGE_FIELDS = List.of("message", "error", "title");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Map<ModelFamily, String> paths;

    public HttpTrainingClient(
            @Qualifier("trainingRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Value("${hypersearch.training.base-url:http://localhost:5112}") String baseUrl,
            @Value("${hypersearch.training.paths.lightgbm:/api/Model/train/lightgbm-config}") String lightgbmPath,
            @Value("${hypersearch.training.paths.pca:/api/Model/train/pca-config}") String pcaPath,
            @Value("${hypersearch.training.paths.ensemble:/api/Model/train/ensemble-config}") String ensemblePath) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.paths = new EnumMap<>(ModelFamily.class);
        this.paths.put(ModelFamily.LIGHTGBM, lightgbmPath);
        this.paths.put(ModelFamily.PCA, pcaPath);
        this.paths.put(ModelFamily.ENSEMBLE, ensemblePath);
    }

    @Override
    public JsonNode train(ModelFamily modelFamily, CandidateConfiguration candidate) {
        if (modelFamily == null || candidate == null) {
            throw new IllegalArgumentException("Model family and candidate are required");
        }

        String url = baseUrl + paths.get(modelFamily);
        log.info("POST {} with {} parameters", url, candidate.size());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    url, new HttpEntity<>(candidate.values(), headers), String.class);

            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new TrainingClientException("Training service returned an empty body for " + modelFamily);
            }
            return objectMapper.readTree(body);

        } catch (HttpStatusCodeException e) {
            String detail = errorMessage(e.getResponseBodyAsString());
            log.warn("Training service answered {} for {}: {}", e.getStatusCode().value(), modelFamily, detail);
            throw new TrainingClientException(
                    "Training service returned " + e.getStatusCode().value() + ": " + detail, e);
        } catch (ResourceAccessException e) {
            log.error("Training service unreachable at {}: {}", url, e.getMessage());
            throw new TrainingClientException("Training service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("Training call failed for {}: {}", modelFamily, e.getMessage(), e);
            throw new TrainingClientException("Training call failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            log.warn("Training service returned unreadable JSON for {}: {}", modelFamily, e.getOriginalMessage());
            throw new TrainingClientException("Unreadable training response", e);
        }
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            for (String field : ERROR_MESSAGE_FIELDS) {
                JsonNode message = node.get(field);
                if (message != null && message.isTextual() && !message.asText().isBlank()) {
                    return message.asText();
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
