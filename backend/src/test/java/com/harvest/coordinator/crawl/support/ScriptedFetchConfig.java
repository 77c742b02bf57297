package com.harvest.coordinator.crawl.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class ScriptedFetchConfig {

    @Bean
    @Primary
    public ScriptedFetchWorker scriptedFetchWorker() {
        return new ScriptedFetchWorker();
    }
}
