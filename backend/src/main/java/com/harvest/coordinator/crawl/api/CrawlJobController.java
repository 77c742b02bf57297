package com.harvest.coordinator.crawl.api;

import com.harvest.coordinator.crawl.checkpoint.CheckpointRecord;
import com.harvest.coordinator.crawl.checkpoint.CheckpointStatistics;
import com.harvest.coordinator.crawl.checkpoint.CheckpointType;
import com.harvest.coordinator.crawl.events.CrawlEvent;
import com.harvest.coordinator.crawl.events.EventKind;
import com.harvest.coordinator.crawl.iteration.ComparisonCsvWriter;
import com.harvest.coordinator.crawl.iteration.Iteration;
import com.harvest.coordinator.crawl.iteration.IterationComparison;
import com.harvest.coordinator.crawl.iteration.IterationMode;
import com.harvest.coordinator.crawl.metrics.CompletionEstimate;
import com.harvest.coordinator.crawl.metrics.MetricsSnapshot;
import com.harvest.coordinator.crawl.metrics.SeriesPoint;
import com.harvest.coordinator.crawl.metrics.SeriesWindow;
import com.harvest.coordinator.crawl.model.JobView;
import com.harvest.coordinator.crawl.service.CrawlJobOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/jobs")
public class CrawlJobController {
    private final CrawlJobOrchestrator orchestrator;

    public CrawlJobController(CrawlJobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<JobView> submit(@RequestBody SubmitJobRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Request body is required");
        }
        IterationMode mode = parseEnum(IterationMode.class, request.mode(), IterationMode.BASELINE, "mode");
        JobView job = orchestrator.submit(request.targets(), mode, request.config());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping
    public List<JobView> list(@RequestParam(name = "limit", required = false, defaultValue = "50") int limit) {
        return orchestrator.list(limit);
    }

    @GetMapping("/{jobId}")
    public JobView get(@PathVariable("jobId") String jobId) {
        return orchestrator.get(jobId);
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> delete(@PathVariable("jobId") String jobId) {
        orchestrator.delete(jobId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{jobId}/pause")
    public JobView pause(@PathVariable("jobId") String jobId) {
        return orchestrator.pause(jobId);
    }

    @PostMapping("/{jobId}/resume")
    public JobView resume(@PathVariable("jobId") String jobId) {
        return orchestrator.resume(jobId);
    }

    @PostMapping("/{jobId}/cancel")
    public JobView cancel(@PathVariable("jobId") String jobId) {
        return orchestrator.cancel(jobId);
    }

    @PostMapping("/{jobId}/continue")
    public JobView continueFromCheckpoint(@PathVariable("jobId") String jobId) {
        return orchestrator.continueFromCheckpoint(jobId);
    }

    @PostMapping("/{jobId}/iterations")
    public ResponseEntity<JobView> nextIteration(
        @PathVariable("jobId") String jobId,
        @RequestBody(required = false) NextIterationRequest request
    ) {
        IterationMode mode = parseEnum(
            IterationMode.class,
            request == null ? null : request.mode(),
            IterationMode.INCREMENTAL,
            "mode"
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.createNextIteration(jobId, mode));
    }

    @GetMapping("/{jobId}/iterations")
    public List<Iteration> iterations(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "chain", required = false, defaultValue = "false") boolean chain
    ) {
        return chain ? orchestrator.iterationChain(jobId) : orchestrator.iterations(jobId);
    }

    @GetMapping("/{jobId}/iterations/compare")
    public ResponseEntity<?> compare(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "baseline", required = false) Integer baseline,
        @RequestParam(name = "current", required = false) Integer current,
        @RequestParam(name = "format", required = false, defaultValue = "json") String format
    ) {
        IterationComparison comparison = orchestrator.compare(jobId, baseline, current);
        String normalized = format.trim().toLowerCase(Locale.ROOT);
        if ("csv".equals(normalized)) {
            String filename = "comparison-" + comparison.baselineIteration() + "-" + comparison.currentIteration() + ".csv";
            return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(ComparisonCsvWriter.toCsv(comparison));
        }
        if (!"json".equals(normalized)) {
            throw new ResponseStatusException(BAD_REQUEST, "format must be json or csv");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("comparison", comparison);
        body.put("summary", comparison.summary());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{jobId}/checkpoints")
    public List<CheckpointRecord> checkpoints(@PathVariable("jobId") String jobId) {
        return orchestrator.checkpoints(jobId);
    }

    @GetMapping("/{jobId}/checkpoints/stats")
    public CheckpointStatistics checkpointStatistics(@PathVariable("jobId") String jobId) {
        return orchestrator.checkpointStatistics(jobId);
    }

    @PostMapping("/{jobId}/checkpoints")
    public ResponseEntity<?> createCheckpoint(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "type", required = false) String type
    ) {
        CheckpointType checkpointType = parseEnum(CheckpointType.class, type, CheckpointType.MANUAL, "type");
        return orchestrator.createCheckpoint(jobId, checkpointType)
            .<ResponseEntity<?>>map(record -> ResponseEntity.status(HttpStatus.CREATED).body(record))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", "checkpoint_not_written",
                "message", "Job " + jobId + " is not live in this process or the write failed"
            )));
    }

    @PostMapping("/{jobId}/checkpoints/prune")
    public Map<String, Object> prune(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "keepLast", required = false, defaultValue = "5") int keepLast
    ) {
        int deleted = orchestrator.pruneCheckpoints(jobId, keepLast);
        return Map.of("jobId", jobId, "deleted", deleted, "keepLast", Math.max(1, keepLast));
    }

    @GetMapping("/{jobId}/events")
    public List<CrawlEvent> events(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "limit", required = false, defaultValue = "100") int limit,
        @RequestParam(name = "kind", required = false) String kind,
        @RequestParam(name = "since", required = false) String since
    ) {
        if (since != null && !since.isBlank()) {
            try {
                return orchestrator.eventsSince(jobId, Instant.parse(since.trim()));
            } catch (DateTimeParseException e) {
                throw new ResponseStatusException(BAD_REQUEST, "since must be an ISO-8601 instant");
            }
        }
        EventKind eventKind = parseEnum(EventKind.class, kind, null, "kind");
        return orchestrator.events(jobId, Math.max(1, limit), eventKind);
    }

    @GetMapping("/{jobId}/metrics")
    public MetricsSnapshot metrics(@PathVariable("jobId") String jobId) {
        return orchestrator.metrics(jobId);
    }

    @GetMapping("/{jobId}/metrics/series")
    public Map<String, List<SeriesPoint>> series(
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "window", required = false, defaultValue = "5m") String window
    ) {
        return orchestrator.series(jobId, SeriesWindow.parse(window));
    }

    @GetMapping("/{jobId}/estimate")
    public CompletionEstimate estimate(@PathVariable("jobId") String jobId) {
        return orchestrator.estimate(jobId);
    }

    private <E extends Enum<E>> E parseEnum(Class<E> type, String raw, E fallback, String name) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Unknown " + name + ": " + raw);
        }
    }
}
