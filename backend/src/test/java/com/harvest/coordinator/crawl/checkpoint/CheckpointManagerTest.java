package com.harvest.coordinator.crawl.checkpoint;

import com.harvest.coordinator.config.CoordinatorConfig;
import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.events.CrawlEvent;
import com.harvest.coordinator.crawl.events.CrawlEventBus;
import com.harvest.coordinator.crawl.events.EventKind;
import com.harvest.coordinator.crawl.events.EventPayload;
import com.harvest.coordinator.crawl.model.FrontierEntry;
import com.harvest.coordinator.crawl.persistence.CheckpointRepository;
import com.harvest.coordinator.crawl.state.CrawlState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckpointManagerTest {
    private static final String JOB = "job-ckpt";
    private static final Instant NOW = Instant.parse("2026-02-01T09:00:00Z");

    @Mock
    private CheckpointRepository repository;
    @Mock
    private CheckpointSource source;

    private final CheckpointCodec codec = new CheckpointCodec(new CoordinatorConfig().objectMapper());
    private ExecutorService executor;
    private CrawlEventBus bus;
    private CheckpointManager manager;

    @BeforeEach
    void setUp() {
        CoordinatorProperties properties = new CoordinatorProperties();
        properties.getCheckpoint().setRetryBackoffMs(0);
        properties.getCheckpoint().setAutoPrune(false);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        executor = Executors.newSingleThreadExecutor();
        bus = new CrawlEventBus(properties, executor, clock);
        manager = new CheckpointManager(repository, codec, source, bus, properties, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void retriesOnceWhenTheFirstWriteFails() {
        when(source.capture(JOB)).thenReturn(Optional.of(CheckpointCodecTest.pausedPayload(JOB)));
        when(repository.nextCheckpointNumber(JOB)).thenReturn(3);
        doThrow(new DataAccessResourceFailureException("connection reset"))
            .doNothing()
            .when(repository).insert(any(StoredCheckpoint.class));

        Optional<CheckpointRecord> written = manager.createCheckpoint(JOB, CheckpointType.MANUAL);

        assertThat(written).isPresent();
        assertThat(written.get().checkpointId()).isEqualTo(JOB + "_ckpt_3");
        assertThat(written.get().state()).isEqualTo(CrawlState.PAUSED);
        assertThat(written.get().createdAt()).isEqualTo(NOW);
        verify(repository, times(2)).insert(any(StoredCheckpoint.class));
        assertThat(bus.byKind(JOB, EventKind.WARNING, 10)).isEmpty();
    }

    @Test
    void reportsWarningWhenBothWritesFail() {
        when(source.capture(JOB)).thenReturn(Optional.of(CheckpointCodecTest.pausedPayload(JOB)));
        when(repository.nextCheckpointNumber(JOB)).thenReturn(1);
        doThrow(new DataAccessResourceFailureException("disk full"))
            .when(repository).insert(any(StoredCheckpoint.class));

        Optional<CheckpointRecord> written = manager.createCheckpoint(JOB, CheckpointType.AUTO);

        assertThat(written).isEmpty();
        List<CrawlEvent> warnings = bus.byKind(JOB, EventKind.WARNING, 10);
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).payloadAs(EventPayload.Message.class).detail()).contains("AUTO").contains("disk full");
    }

    @Test
    void skipsJobsThatAreNotLive() {
        when(source.capture(JOB)).thenReturn(Optional.empty());

        assertThat(manager.createCheckpoint(JOB, CheckpointType.MANUAL)).isEmpty();
        verify(repository, never()).insert(any(StoredCheckpoint.class));
    }

    @Test
    void enteringPausedWritesPauseCheckpoint() {
        when(source.capture(JOB)).thenReturn(Optional.of(CheckpointCodecTest.pausedPayload(JOB)));
        when(repository.nextCheckpointNumber(JOB)).thenReturn(1);
        doNothing().when(repository).insert(any(StoredCheckpoint.class));

        manager.onEvent(stateChange(CrawlState.CRAWLING, CrawlState.PAUSED));
        manager.onEvent(stateChange(CrawlState.INITIALIZING, CrawlState.CRAWLING));

        ArgumentCaptor<StoredCheckpoint> stored = ArgumentCaptor.forClass(StoredCheckpoint.class);
        verify(repository).insert(stored.capture());
        assertThat(stored.getValue().record().type()).isEqualTo(CheckpointType.PAUSE);
        assertThat(stored.getValue().payloadSha256()).isEqualTo(codec.checksum(stored.getValue().payload()));
    }

    @Test
    void resumeDropsFinishedUrisFromPendingWork() {
        CheckpointPayload payload = new CheckpointPayload(
            JOB,
            JOB,
            0,
            CheckpointCodecTest.pausedPayload(JOB).state(),
            List.of(FrontierEntry.seed("https://a.test/1"), FrontierEntry.seed("https://a.test/2")),
            List.of(),
            List.of("https://a.test/1"),
            List.of(),
            NOW
        );
        String id = CheckpointRecord.idFor(JOB, 1);
        when(repository.findWithPayload(JOB, id)).thenReturn(Optional.of(stored(id, 1, codec.encode(payload), true)));

        ResumeToken token = manager.resume(JOB, id);

        assertThat(token.payload().pending()).extracting(FrontierEntry::uri).containsExactly("https://a.test/2");
        assertThat(token.type()).isEqualTo(CheckpointType.PAUSE);
    }

    @Test
    void fallbackSkipsCorruptCheckpointAndWarns() {
        String newest = CheckpointRecord.idFor(JOB, 2);
        String older = CheckpointRecord.idFor(JOB, 1);
        byte[] good = codec.encode(CheckpointCodecTest.pausedPayload(JOB));
        when(repository.findByJob(JOB)).thenReturn(List.of(record(newest, 2), record(older, 1)));
        when(repository.findWithPayload(JOB, newest))
            .thenReturn(Optional.of(stored(newest, 2, "garbage".getBytes(StandardCharsets.UTF_8), false)));
        when(repository.findWithPayload(JOB, older)).thenReturn(Optional.of(stored(older, 1, good, true)));

        Optional<ResumeToken> token = manager.resumeWithFallback(JOB);

        assertThat(token).isPresent();
        assertThat(token.get().checkpointId()).isEqualTo(older);
        assertThat(bus.byKind(JOB, EventKind.WARNING, 10)).hasSize(1);
    }

    @Test
    void pruneKeepsCheckpointsHeldByResumeToken() {
        List<CheckpointRecord> all = List.of(
            record(CheckpointRecord.idFor(JOB, 4), 4),
            record(CheckpointRecord.idFor(JOB, 3), 3),
            record(CheckpointRecord.idFor(JOB, 2), 2),
            record(CheckpointRecord.idFor(JOB, 1), 1)
        );
        String held = CheckpointRecord.idFor(JOB, 1);
        when(repository.findByJob(JOB)).thenReturn(all);
        when(repository.findWithPayload(JOB, held))
            .thenReturn(Optional.of(stored(held, 1, codec.encode(CheckpointCodecTest.pausedPayload(JOB)), true)));
        when(repository.delete(eq(JOB), anyCollection())).thenReturn(1);

        ResumeToken token = manager.resume(JOB, held);
        manager.prune(JOB, 2);
        verify(repository).delete(JOB, List.of(CheckpointRecord.idFor(JOB, 2)));

        manager.release(token);
        manager.prune(JOB, 2);
        verify(repository).delete(JOB, List.of(CheckpointRecord.idFor(JOB, 2), held));
    }

    @Test
    void statisticsCountByTypeAndReportLatest() {
        when(repository.findByJob(JOB)).thenReturn(List.of(record(CheckpointRecord.idFor(JOB, 2), 2), record(CheckpointRecord.idFor(JOB, 1), 1)));

        CheckpointStatistics statistics = manager.statistics(JOB);

        assertThat(statistics.total()).isEqualTo(2);
        assertThat(statistics.byType()).containsEntry(CheckpointType.PAUSE, 2).containsEntry(CheckpointType.AUTO, 0);
        assertThat(statistics.totalBytes()).isEqualTo(200);
        assertThat(statistics.latestCheckpointId()).isEqualTo(CheckpointRecord.idFor(JOB, 2));
    }

    private static CrawlEvent stateChange(CrawlState from, CrawlState to) {
        return new CrawlEvent(
            "evt-" + to,
            JOB,
            1,
            EventKind.STATE_CHANGE,
            null,
            NOW,
            new EventPayload.StateChanged(from, to, Duration.ofSeconds(1))
        );
    }

    private static CheckpointRecord record(String id, int number) {
        return new CheckpointRecord(id, JOB, number, CheckpointType.PAUSE, NOW.minusSeconds(10L - number), CrawlState.PAUSED, null, 100);
    }

    private StoredCheckpoint stored(String id, int number, byte[] payload, boolean withChecksum) {
        return new StoredCheckpoint(record(id, number), payload, withChecksum ? codec.checksum(payload) : null);
    }
}
