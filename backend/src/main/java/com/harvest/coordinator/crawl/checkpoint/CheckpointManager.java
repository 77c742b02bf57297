package com.harvest.coordinator.crawl.checkpoint;

import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.events.CrawlEvent;
import com.harvest.coordinator.crawl.events.CrawlEventBus;
import com.harvest.coordinator.crawl.events.EventKind;
import com.harvest.coordinator.crawl.events.EventPayload;
import com.harvest.coordinator.crawl.events.Subscription;
import com.harvest.coordinator.crawl.model.FrontierEntry;
import com.harvest.coordinator.crawl.persistence.CheckpointRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes, lists, restores and prunes checkpoints.
 *
 * <p>The manager listens inline to {@code STATE_CHANGE}: entering PAUSED writes a PAUSE checkpoint,
 * FAILED an ERROR checkpoint and CANCELLED a final MANUAL checkpoint, all before the transition's
 * publisher continues.
 */
@Service
public class CheckpointManager {
    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);
    private static final int WRITE_ATTEMPTS = 2;

    private final CheckpointRepository repository;
    private final CheckpointCodec codec;
    private final CheckpointSource source;
    private final CrawlEventBus eventBus;
    private final CoordinatorProperties properties;
    private final Clock clock;
    private final Map<String, Integer> resumesInUse = new ConcurrentHashMap<>();
    private final Map<String, Object> jobLocks = new ConcurrentHashMap<>();
    private Subscription stateSubscription;

    public CheckpointManager(
        CheckpointRepository repository,
        CheckpointCodec codec,
        CheckpointSource source,
        CrawlEventBus eventBus,
        CoordinatorProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.codec = codec;
        this.source = source;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void subscribe() {
        stateSubscription = eventBus.subscribeInline(null, this::onEvent);
    }

    @PreDestroy
    void unsubscribe() {
        eventBus.unsubscribe(stateSubscription);
    }

    void onEvent(CrawlEvent event) {
        if (event.kind() != EventKind.STATE_CHANGE) {
            return;
        }
        EventPayload.StateChanged change = event.payloadAs(EventPayload.StateChanged.class);
        CheckpointType type = switch (change.to()) {
            case PAUSED -> CheckpointType.PAUSE;
            case FAILED -> CheckpointType.ERROR;
            case CANCELLED -> CheckpointType.MANUAL;
            default -> null;
        };
        if (type != null) {
            createCheckpoint(event.jobId(), type);
        }
    }

    /**
     * Captures and persists a checkpoint of a live job.
     *
     * @return the stored checkpoint, or empty if the job is not live or both write attempts failed
     */
    public Optional<CheckpointRecord> createCheckpoint(String jobId, CheckpointType type) {
        Optional<CheckpointPayload> captured = source.capture(jobId);
        if (captured.isEmpty()) {
            log.debug("Skipping {} checkpoint for job {}: job is not live", type, jobId);
            return Optional.empty();
        }
        return write(captured.get(), type);
    }

    public Optional<CheckpointRecord> write(CheckpointPayload payload, CheckpointType type) {
        String jobId = payload.jobId();
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= WRITE_ATTEMPTS; attempt++) {
            try {
                return Optional.of(writeOnce(payload, type));
            } catch (RuntimeException e) {
                lastFailure = e;
                if (attempt < WRITE_ATTEMPTS) {
                    log.warn("Checkpoint write for job {} failed, retrying: {}", jobId, e.getMessage());
                    if (!sleepBackoff()) {
                        break;
                    }
                }
            }
        }
        String message = lastFailure == null ? "unknown error" : lastFailure.getMessage();
        log.warn("Giving up on {} checkpoint for job {}", type, jobId, lastFailure);
        eventBus.publish(
            jobId,
            EventKind.WARNING,
            new EventPayload.Message("Checkpoint write failed", type + ": " + message)
        );
        return Optional.empty();
    }

    public Optional<CheckpointRecord> latest(String jobId) {
        return repository.findLatest(jobId);
    }

    public List<CheckpointRecord> list(String jobId) {
        return repository.findByJob(jobId);
    }

    /**
     * Decodes the newest checkpoint of a job.
     *
     * @return empty if the job has no checkpoint
     * @throws CheckpointCorruptException if the newest checkpoint cannot be decoded
     */
    public Optional<ResumeToken> resume(String jobId) {
        Optional<CheckpointRecord> latest = repository.findLatest(jobId);
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(resume(jobId, latest.get().checkpointId()));
    }

    public ResumeToken resume(String jobId, String checkpointId) {
        StoredCheckpoint stored = repository.findWithPayload(jobId, checkpointId)
            .orElseThrow(() -> new CheckpointCorruptException(checkpointId, "checkpoint does not exist"));
        CheckpointPayload decoded = codec.decode(checkpointId, stored.payload(), stored.payloadSha256());
        if (!jobId.equals(decoded.jobId())) {
            throw new CheckpointCorruptException(checkpointId, "payload belongs to job " + decoded.jobId());
        }
        resumesInUse.merge(checkpointId, 1, Integer::sum);
        return new ResumeToken(jobId, checkpointId, stored.record().type(), withoutCompleted(decoded), clock.instant());
    }

    /**
     * Walks checkpoints from newest to oldest and returns the first one that decodes. Corrupt
     * checkpoints are reported as WARNING events and skipped.
     *
     * @return empty when no usable checkpoint exists, in which case the caller reruns from scratch
     */
    public Optional<ResumeToken> resumeWithFallback(String jobId) {
        for (CheckpointRecord record : repository.findByJob(jobId)) {
            try {
                return Optional.of(resume(jobId, record.checkpointId()));
            } catch (CheckpointCorruptException e) {
                log.warn("Skipping corrupt checkpoint {} of job {}: {}", record.checkpointId(), jobId, e.getMessage());
                eventBus.publish(
                    jobId,
                    EventKind.WARNING,
                    new EventPayload.Message("Corrupt checkpoint skipped", e.getMessage())
                );
            }
        }
        return Optional.empty();
    }

    public void release(ResumeToken token) {
        if (token == null) {
            return;
        }
        resumesInUse.computeIfPresent(token.checkpointId(), (id, count) -> count <= 1 ? null : count - 1);
    }

    /**
     * Deletes all but the newest {@code keepLast} checkpoints. Checkpoints held by an unreleased
     * resume token are kept regardless.
     */
    public int prune(String jobId, int keepLast) {
        int keep = Math.max(1, keepLast);
        List<CheckpointRecord> all = repository.findByJob(jobId);
        if (all.size() <= keep) {
            return 0;
        }
        List<String> doomed = new ArrayList<>();
        for (CheckpointRecord record : all.subList(keep, all.size())) {
            if (!resumesInUse.containsKey(record.checkpointId())) {
                doomed.add(record.checkpointId());
            }
        }
        int deleted = repository.delete(jobId, doomed);
        if (deleted > 0) {
            log.info("Pruned {} checkpoints of job {} keeping {}", deleted, jobId, keep);
        }
        return deleted;
    }

    public CheckpointStatistics statistics(String jobId) {
        List<CheckpointRecord> all = repository.findByJob(jobId);
        Map<CheckpointType, Integer> byType = new EnumMap<>(CheckpointType.class);
        for (CheckpointType type : CheckpointType.values()) {
            byType.put(type, 0);
        }
        long totalBytes = 0;
        for (CheckpointRecord record : all) {
            byType.merge(record.type(), 1, Integer::sum);
            totalBytes += record.payloadSize();
        }
        CheckpointRecord latest = all.isEmpty() ? null : all.get(0);
        return new CheckpointStatistics(
            jobId,
            all.size(),
            byType,
            totalBytes,
            latest == null ? null : latest.checkpointId(),
            latest == null ? null : latest.state(),
            latest == null ? null : latest.createdAt()
        );
    }

    public int deleteAll(String jobId) {
        int deleted = repository.deleteAll(jobId);
        jobLocks.remove(jobId);
        return deleted;
    }

    private CheckpointRecord writeOnce(CheckpointPayload payload, CheckpointType type) {
        String jobId = payload.jobId();
        synchronized (jobLocks.computeIfAbsent(jobId, ignored -> new Object())) {
            int number = repository.nextCheckpointNumber(jobId);
            byte[] encoded = codec.encode(payload);
            CheckpointRecord record = new CheckpointRecord(
                CheckpointRecord.idFor(jobId, number),
                jobId,
                number,
                type,
                clock.instant(),
                payload.state().currentState(),
                payload.state().substate(),
                encoded.length
            );
            repository.insert(new StoredCheckpoint(record, encoded, codec.checksum(encoded)));
            log.info(
                "Wrote {} checkpoint {} for job {} state={} pending={} completed={} bytes={}",
                type,
                record.checkpointId(),
                jobId,
                record.state(),
                payload.pending().size(),
                payload.completed().size(),
                encoded.length
            );
            if (properties.getCheckpoint().isAutoPrune()) {
                try {
                    prune(jobId, properties.getCheckpoint().getKeepLast());
                } catch (RuntimeException e) {
                    log.warn("Pruning checkpoints of job {} failed after writing {}", jobId, record.checkpointId(), e);
                }
            }
            return record;
        }
    }

    private CheckpointPayload withoutCompleted(CheckpointPayload payload) {
        Set<String> finished = new HashSet<>(payload.completed());
        finished.addAll(payload.failed());
        List<FrontierEntry> pending = payload.pending().stream()
            .filter(entry -> !finished.contains(entry.uri()))
            .toList();
        List<FrontierEntry> pendingDocuments = payload.pendingDocuments().stream()
            .filter(entry -> !finished.contains(entry.uri()))
            .toList();
        return new CheckpointPayload(
            payload.jobId(),
            payload.lineageId(),
            payload.iterationNumber(),
            payload.state(),
            pending,
            pendingDocuments,
            payload.completed(),
            payload.failed(),
            payload.capturedAt()
        );
    }

    private boolean sleepBackoff() {
        long backoff = properties.getCheckpoint().getRetryBackoffMs();
        if (backoff <= 0) {
            return true;
        }
        try {
            Thread.sleep(backoff);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
