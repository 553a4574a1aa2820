package com.demo.triage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * RestTemplate for the model service collaborators
 */
@Configuration
public class RestTemplateConfig {

    /**
     * Model services sometimes answer JSON with a text/plain content type, so the
     * Jackson converter is registered first and accepts any text type.
     * Timeouts bound how long a message can sit in a collaborator call.
     */
    @Bean
    public RestTemplate restTemplate(ObjectMapper objectMapper,
                                     @Value("${triage.collaborators.connect-timeout-ms:2000}") int connectTimeoutMs,
                                     @Value("${triage.collaborators.read-timeout-ms:15000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        RestTemplate restTemplate = new RestTemplate(requestFactory);

        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter(objectMapper);
        jsonConverter.setSupportedMediaTypes(List.of(
                MediaType.APPLICATION_JSON,
                MediaType.TEXT_PLAIN,
                new MediaType("application", "*+json"),
                new MediaType("text", "*")
        ));
        restTemplate.getMessageConverters().add(0, jsonConverter);

        return restTemplate;
    }
}
