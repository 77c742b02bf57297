package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.model.StoredJob;
import com.harvest.coordinator.crawl.persistence.CrawlJobRepository;
import com.harvest.coordinator.crawl.state.CrawlState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Picks up jobs a previous process left unfinished. PAUSED jobs are registered for a later resume;
 * other non-terminal jobs are continued from their latest checkpoint when
 * {@code coordinator.recovery.auto-resume} is set, and failed otherwise.
 */
@Component
public class JobRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRecoveryRunner.class);

    private final CrawlJobRepository repository;
    private final CrawlJobOrchestrator orchestrator;
    private final CoordinatorProperties properties;

    public JobRecoveryRunner(
        CrawlJobRepository repository,
        CrawlJobOrchestrator orchestrator,
        CoordinatorProperties properties
    ) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping job recovery because database is unreachable");
            return;
        }

        List<CrawlState> unfinished = Arrays.stream(CrawlState.values())
            .filter(state -> !state.isTerminal())
            .toList();
        boolean autoResume = properties.getRecovery().isAutoResume();
        for (StoredJob stored : repository.findByStates(unfinished)) {
            String jobId = stored.job().jobId();
            CrawlState state = stored.state().currentState();
            try {
                if (state == CrawlState.PAUSED || !autoResume) {
                    orchestrator.markInterrupted(jobId);
                } else {
                    orchestrator.continueFromCheckpoint(jobId);
                }
                log.info("Recovered job {} found in {} (autoResume={})", jobId, state, autoResume);
            } catch (RuntimeException e) {
                log.warn("Unable to recover job {} found in {}", jobId, state, e);
            }
        }
    }
}
