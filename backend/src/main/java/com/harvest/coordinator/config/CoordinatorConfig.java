package com.harvest.coordinator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class CoordinatorConfig {

    @Bean(name = "jobRunExecutor", destroyMethod = "shutdown")
    public ExecutorService jobRunExecutor(CoordinatorProperties properties) {
        return Executors.newFixedThreadPool(properties.getMaxConcurrentJobs());
    }

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(CoordinatorProperties properties) {
        int size = Math.max(2, properties.getFetch().getConcurrency() * properties.getMaxConcurrentJobs());
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CoordinatorProperties properties) {
        int size = Math.max(4, properties.getFetch().getConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "eventDispatchExecutor", destroyMethod = "shutdown")
    public ExecutorService eventDispatchExecutor(CoordinatorProperties properties) {
        return Executors.newFixedThreadPool(properties.getEvents().getDispatchThreads());
    }

    @Bean(name = "samplerExecutor", destroyMethod = "shutdownNow")
    public ScheduledExecutorService samplerExecutor() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "resource-sampler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
