package com.example.messaging.chat.config;

import com.example.messaging.shared.config.AppProperties;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    public static final String BACKEND_CIRCUIT_BREAKER = "messagingBackend";
    public static final String UPLOAD_BULKHEAD = "attachmentUpload";

    @Bean
    public CircuitBreaker messagingBackendCircuitBreaker(CircuitBreakerRegistry registry) {
        // Instance settings come from resilience4j.circuitbreaker.instances.messagingBackend
        return registry.circuitBreaker(BACKEND_CIRCUIT_BREAKER);
    }

    /**
     * One permit per upload channel. An upload that finds no free channel fails instead of queueing.
     */
    @Bean
    public Bulkhead attachmentUploadBulkhead(BulkheadRegistry registry, AppProperties appProperties) {
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(appProperties.getUpload().getMaxConcurrent())
                .maxWaitDuration(Duration.ZERO)
                .build();
        return registry.bulkhead(UPLOAD_BULKHEAD, config);
    }
}
