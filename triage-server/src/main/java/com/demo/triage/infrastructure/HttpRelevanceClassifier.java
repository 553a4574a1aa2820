package com.demo.triage.infrastructure;

import com.demo.triage.domain.ClassificationResult;
import com.demo.triage.exception.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Classifier backed by the remote model service ({@code POST /classify}).
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.classifier.mode", havingValue = "http")
public class HttpRelevanceClassifier implements RelevanceClassifier {

    static final String COLLABORATOR = "classifier";

    private final AiServiceClient client;

    @Autowired
    public HttpRelevanceClassifier(RestTemplate restTemplate,
                                   @Value("${triage.classifier.urls:http://model-service:8000}") String urls) {
        this.client = new AiServiceClient(COLLABORATOR, restTemplate, urls);
    }

    HttpRelevanceClassifier(AiServiceClient client) {
        this.client = client;
    }

    @Override
    public ClassificationResult classify(String text) {
        ClassificationResult result = client.post("/classify", Map.of("text", text), ClassificationResult.class);
        if (!result.isWellFormed()) {
            log.warn("Malformed classification: label={}, confidence={}, relevant={}",
                    result.getLabel(), result.getConfidence(), result.getRelevant());
            throw new CollaboratorException(COLLABORATOR, "malformed classification response");
        }
        return result;
    }

    public Map<String, Object> checkHealth() {
        return client.checkHealth();
    }
}
