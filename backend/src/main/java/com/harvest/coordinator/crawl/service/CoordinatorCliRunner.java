package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.iteration.IterationMode;
import com.harvest.coordinator.crawl.model.CrawlJobConfig;
import com.harvest.coordinator.crawl.model.JobView;
import com.harvest.coordinator.crawl.state.CrawlState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Runs a single job from {@code coordinator.cli.*} and waits for it to stop. */
@Component
public class CoordinatorCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CoordinatorCliRunner.class);
    private static final Duration POLL = Duration.ofSeconds(30);

    private final CoordinatorProperties properties;
    private final CrawlJobOrchestrator orchestrator;
    private final ConfigurableApplicationContext applicationContext;

    public CoordinatorCliRunner(
        CoordinatorProperties properties,
        CrawlJobOrchestrator orchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        CoordinatorProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }
        List<String> targets = Arrays.stream(cli.getTargets().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        IterationMode mode = IterationMode.valueOf(cli.getMode().trim().toUpperCase(Locale.ROOT));
        CrawlJobConfig config = CrawlJobConfig.defaults().withMaxPages(cli.getMaxPages());

        JobView job = orchestrator.submit(targets, mode, config);
        log.info("CLI submitted job {} with {} targets in {} mode", job.jobId(), targets.size(), job.mode());
        while (!job.state().isTerminal() && job.state() != CrawlState.PAUSED) {
            job = orchestrator.awaitRunner(job.jobId(), POLL);
        }
        log.info(
            "CLI job {} finished in {}: crawled={} failed={} skipped={} documents={} error={}",
            job.jobId(),
            job.state(),
            job.counters().urlsCrawled(),
            job.counters().urlsFailed(),
            job.counters().urlsSkipped(),
            job.counters().documentsFound(),
            job.error()
        );

        if (cli.isExitAfterRun()) {
            boolean completed = job.state() == CrawlState.COMPLETED;
            int exitCode = SpringApplication.exit(applicationContext, () -> completed ? 0 : 1);
            System.exit(exitCode);
        }
    }
}
