package com.demo.triage.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(MatcherProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Workers for asynchronous ingestion. Classifier and embedder calls block here,
     * outside the match lock.
     */
    @Bean(name = "ingestionExecutor", destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(@Value("${triage.ingestion.worker-threads:4}") int workerThreads) {
        return Executors.newFixedThreadPool(workerThreads, new CustomizableThreadFactory("ingestion-"));
    }
}
