package com.example.messaging.chat.config;

import com.example.messaging.shared.config.AppProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class CaffeineConfig {

    /**
     * Reconciliation fingerprint to the ids of local pending messages carrying it.
     * Entries expire so a message that is never echoed does not pin memory.
     */
    @Bean
    public Cache<String, List<String>> pendingFingerprintCache(AppProperties appProperties) {
        AppProperties.Reconciliation reconciliation = appProperties.getReconciliation();
        return Caffeine.newBuilder()
                .maximumSize(reconciliation.getPendingFingerprintMaxSize())
                .expireAfterWrite(reconciliation.getPendingFingerprintTtl())
                .recordStats()
                .build();
    }
}
