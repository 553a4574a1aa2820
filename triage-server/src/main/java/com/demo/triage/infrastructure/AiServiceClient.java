package com.demo.triage.infrastructure;

import com.demo.triage.exception.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin client for a pool of model service nodes.
 * A failed request is retried once on every other node before giving up.
 */
@Slf4j
public class AiServiceClient {

    private final String collaborator;
    private final RestTemplate restTemplate;
    private final List<String> serviceUrls;
    private final AtomicInteger currentIndex = new AtomicInteger(0);

    public AiServiceClient(String collaborator, RestTemplate restTemplate, String serviceUrlsConfig) {
        this.collaborator = collaborator;
        this.restTemplate = restTemplate;
        this.serviceUrls = parseUrls(serviceUrlsConfig);
        if (serviceUrls.isEmpty()) {
            throw new IllegalArgumentException("No service URLs configured for " + collaborator);
        }
        log.info("AiServiceClient initialized: collaborator={}, nodes={}", collaborator, serviceUrls);
    }

    private static List<String> parseUrls(String urlsConfig) {
        List<String> urls = new ArrayList<>();
        if (urlsConfig == null) {
            return urls;
        }
        for (String url : urlsConfig.split(",")) {
            String trimmed = url.trim();
            if (!trimmed.isEmpty()) {
                urls.add(trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed);
            }
        }
        return urls;
    }

    /**
     * Candidate order for one request: round-robin start node, then the rest in ring order.
     */
    private List<String> candidateUrls() {
        int start = Math.floorMod(currentIndex.getAndIncrement(), serviceUrls.size());
        List<String> ordered = new ArrayList<>(serviceUrls);
        Collections.rotate(ordered, -start);
        return ordered;
    }

    /**
     * POST a JSON body and map the response.
     *
     * @throws CollaboratorException when every node failed or returned an empty body
     */
    public <T> T post(String path, Object body, Class<T> responseType) {
        List<String> candidates = candidateUrls();
        RestClientException lastException = null;

        for (int attempt = 0; attempt < candidates.size(); attempt++) {
            String fullUrl = candidates.get(attempt) + path;
            try {
                HttpHeaders headers = new HttpHeaders();
                headers.setContentType(MediaType.APPLICATION_JSON);
                ResponseEntity<T> response = restTemplate.exchange(
                        fullUrl, HttpMethod.POST, new HttpEntity<>(body, headers), responseType);

                if (response.getBody() == null) {
                    throw new CollaboratorException(collaborator, "empty response from " + fullUrl);
                }
                log.debug("Model service request successful: collaborator={}, url={}, status={}",
                        collaborator, fullUrl, response.getStatusCode());
                return response.getBody();

            } catch (RestClientException e) {
                lastException = e;
                log.warn("Model service request failed: collaborator={}, url={}, attempt={}/{}, error={}",
                        collaborator, fullUrl, attempt + 1, candidates.size(), e.getMessage());
            }
        }

        throw new CollaboratorException(collaborator,
                "all " + candidates.size() + " nodes failed", lastException);
    }

    /**
     * Reachability of every node, for the health endpoint.
     */
    public Map<String, Object> checkHealth() {
        Map<String, Object> status = new HashMap<>();
        List<Map<String, Object>> nodes = new ArrayList<>();
        int healthy = 0;
        for (String url : serviceUrls) {
            Map<String, Object> node = new HashMap<>();
            node.put("url", url);
            try {
                ResponseEntity<String> response = restTemplate.getForEntity(url + "/health", String.class);
                node.put("status", "healthy");
                node.put("http_status", response.getStatusCode().value());
                healthy++;
            } catch (RestClientException e) {
                node.put("status", "unhealthy");
                node.put("error", e.getMessage());
            }
            nodes.add(node);
        }
        status.put("collaborator", collaborator);
        status.put("healthy_nodes", healthy);
        status.put("total_nodes", serviceUrls.size());
        status.put("nodes", nodes);
        return status;
    }
}
