package com.harvest.coordinator.crawl.checkpoint;

import com.harvest.coordinator.config.CoordinatorConfig;
import com.harvest.coordinator.crawl.model.FrontierEntry;
import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.state.CrawlSubstate;
import com.harvest.coordinator.crawl.state.JobCounters;
import com.harvest.coordinator.crawl.state.JobStateSnapshot;
import com.harvest.coordinator.crawl.state.StateTransition;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointCodecTest {
    private static final Instant T0 = Instant.parse("2026-02-01T08:00:00Z");

    private final CheckpointCodec codec = new CheckpointCodec(new CoordinatorConfig().objectMapper());

    @Test
    void decodesWhatItEncodedIncludingHistoryAndFrontier() {
        CheckpointPayload payload = pausedPayload("job-codec");

        byte[] encoded = codec.encode(payload);
        CheckpointPayload decoded = codec.decode("job-codec_ckpt_1", encoded, codec.checksum(encoded));

        assertThat(decoded.state().currentState()).isEqualTo(CrawlState.PAUSED);
        assertThat(decoded.state().pausedSubstate()).isEqualTo(CrawlSubstate.DOWNLOADING_PAGES);
        assertThat(decoded.state().history()).extracting(StateTransition::duration)
            .containsExactly(Duration.ZERO, Duration.ofSeconds(2), Duration.ofSeconds(30));
        assertThat(decoded.state().counters()).isEqualTo(new JobCounters(4, 1, 0, 2));
        assertThat(decoded.pending()).containsExactly(
            FrontierEntry.seed("https://a.test/3"),
            new FrontierEntry("https://a.test/4", 1, "https://a.test/1", false)
        );
        assertThat(decoded.completed()).containsExactly("https://a.test/1", "https://a.test/2");
        assertThat(decoded.capturedAt()).isEqualTo(T0.plusSeconds(40));
    }

    @Test
    void checksumMismatchIsCorrupt() {
        byte[] encoded = codec.encode(pausedPayload("job-codec"));
        String checksum = codec.checksum(encoded);
        encoded[encoded.length / 2] ^= 0x5A;

        assertThatThrownBy(() -> codec.decode("job-codec_ckpt_2", encoded, checksum))
            .isInstanceOf(CheckpointCorruptException.class)
            .hasMessageContaining("checksum mismatch");
    }

    @Test
    void undecodableOrEmptyPayloadIsCorrupt() {
        assertThatThrownBy(() -> codec.decode("c1", "not gzip".getBytes(StandardCharsets.UTF_8), null))
            .isInstanceOf(CheckpointCorruptException.class);
        assertThatThrownBy(() -> codec.decode("c2", new byte[0], null))
            .isInstanceOf(CheckpointCorruptException.class)
            .hasMessageContaining("empty");
    }

    static CheckpointPayload pausedPayload(String jobId) {
        JobStateSnapshot state = new JobStateSnapshot(
            jobId,
            CrawlState.PAUSED,
            null,
            null,
            new JobCounters(4, 1, 0, 2),
            List.of(
                new StateTransition(null, CrawlState.QUEUED, T0, Duration.ZERO),
                new StateTransition(CrawlState.QUEUED, CrawlState.INITIALIZING, T0.plusSeconds(2), Duration.ofSeconds(2)),
                new StateTransition(CrawlState.INITIALIZING, CrawlState.PAUSED, T0.plusSeconds(32), Duration.ofSeconds(30))
            ),
            CrawlState.CRAWLING,
            CrawlSubstate.DOWNLOADING_PAGES,
            T0.plusSeconds(2),
            T0.plusSeconds(32),
            null
        );
        return new CheckpointPayload(
            jobId,
            jobId,
            0,
            state,
            List.of(
                FrontierEntry.seed("https://a.test/3"),
                new FrontierEntry("https://a.test/4", 1, "https://a.test/1", false)
            ),
            List.of(),
            List.of("https://a.test/1", "https://a.test/2"),
            List.of("https://a.test/5"),
            T0.plusSeconds(40)
        );
    }
}
