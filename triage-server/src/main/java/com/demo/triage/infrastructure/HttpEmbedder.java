package com.demo.triage.infrastructure;

import com.demo.triage.exception.CollaboratorException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Embedder backed by the remote model service ({@code POST /embed}).
 *
 * The first vector received fixes the dimension; any later vector of another length
 * is rejected as malformed.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "triage.embedder.mode", havingValue = "http")
public class HttpEmbedder implements Embedder {

    static final String COLLABORATOR = "embedder";

    private final AiServiceClient client;
    private final AtomicInteger dimension;

    @Autowired
    public HttpEmbedder(RestTemplate restTemplate,
                        @Value("${triage.embedder.urls:http://model-service:8000}") String urls,
                        @Value("${triage.embedder.dimension:0}") int expectedDimension) {
        this(new AiServiceClient(COLLABORATOR, restTemplate, urls), expectedDimension);
    }

    HttpEmbedder(AiServiceClient client, int expectedDimension) {
        this.client = client;
        this.dimension = new AtomicInteger(Math.max(expectedDimension, 0));
    }

    @Override
    public double[] embed(String text) {
        EmbeddingResponse response = client.post("/embed", Map.of("text", text), EmbeddingResponse.class);
        double[] vector = response.getEmbedding();
        if (vector == null || vector.length == 0) {
            throw new CollaboratorException(COLLABORATOR, "response has no embedding");
        }
        for (double v : vector) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new CollaboratorException(COLLABORATOR, "embedding contains non-finite values");
            }
        }
        dimension.compareAndSet(0, vector.length);
        if (vector.length != dimension.get()) {
            throw new CollaboratorException(COLLABORATOR,
                    "embedding dimension " + vector.length + " != " + dimension.get());
        }
        return vector;
    }

    public Map<String, Object> checkHealth() {
        return client.checkHealth();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EmbeddingResponse {
        private double[] embedding;
    }
}
