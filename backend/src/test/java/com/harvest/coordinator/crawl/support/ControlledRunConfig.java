package com.harvest.coordinator.crawl.support;

import com.harvest.coordinator.crawl.model.CrawlJob;
import com.harvest.coordinator.crawl.service.CrawlPhaseHandler;
import com.harvest.coordinator.crawl.service.DeduplicatingPhaseHandler;
import com.harvest.coordinator.crawl.service.PhaseEvents;
import com.harvest.coordinator.crawl.state.CrawlSubstate;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import java.time.Instant;
import java.util.List;

/**
 * Scripted fetches plus a clock tests can move and a phase handler that throws in the substate
 * named by the job label {@value #FAIL_AT}.
 */
@TestConfiguration
@Import(ScriptedFetchConfig.class)
public class ControlledRunConfig {
    public static final String FAIL_AT = "fail-at";

    @Bean
    @Primary
    public MutableClock mutableClock() {
        return new MutableClock(Instant.now());
    }

    @Bean
    @Primary
    public CrawlPhaseHandler failingPhaseHandler(DeduplicatingPhaseHandler delegate) {
        return new CrawlPhaseHandler() {
            @Override
            public void handle(CrawlJob job, CrawlSubstate substate, List<String> completedUris, PhaseEvents events) {
                if (substate.name().equals(job.config().labels().get(FAIL_AT))) {
                    throw new IllegalStateException("Extractor unavailable in " + substate);
                }
                delegate.handle(job, substate, completedUris, events);
            }
        };
    }
}
