package com.example.messaging.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Bean
    @ConfigurationProperties(prefix = "messaging")
    public AppProperties appProperties() {
        // Binding of messaging.session.*, messaging.upload.*, etc. is done by @ConfigurationProperties
        return new AppProperties();
    }
}
