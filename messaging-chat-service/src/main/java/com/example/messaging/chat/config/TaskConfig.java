package com.example.messaging.chat.config;

import com.example.messaging.shared.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class TaskConfig {

    /**
     * Fixed pool of platform threads for calls to the backing service.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler backendScheduler(AppProperties appProperties) {
        return Schedulers.newParallel("backend-io-", appProperties.getBackend().getIoThreads());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
