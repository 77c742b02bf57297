package com.harvest.coordinator.crawl.iteration;

import com.harvest.coordinator.crawl.fingerprint.FingerprintStore;
import com.harvest.coordinator.crawl.fingerprint.ResourceFingerprint;
import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;
import com.harvest.coordinator.crawl.support.ScriptedFetchConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Import(ScriptedFetchConfig.class)
class IterationManagerTest {
    private static final Instant AT = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private IterationManager manager;

    @Autowired
    private FingerprintStore fingerprints;

    @Test
    void incrementalNeedsCompletedBaseline() {
        String lineage = "lin-" + UUID.randomUUID();

        assertThatThrownBy(() -> manager.planNext(lineage, IterationMode.INCREMENTAL))
            .isInstanceOf(NoBaselineException.class)
            .hasMessageContaining(lineage);

        IterationManager.IterationContext first = manager.planNext(lineage, IterationMode.FULL);
        assertEquals(0, first.iterationNumber());
        assertEquals(IterationMode.BASELINE, first.mode());
        assertNull(first.parentIteration());

        manager.start("job-" + UUID.randomUUID(), first);
        assertThatThrownBy(() -> manager.planNext(lineage, IterationMode.INCREMENTAL))
            .isInstanceOf(NoBaselineException.class);
    }

    @Test
    void incrementalRunClassifiesAgainstParent() {
        String lineage = "lin-" + UUID.randomUUID();
        String u1 = "https://iter.test/1";
        String u2 = "https://iter.test/2";
        String u3 = "https://iter.test/3";
        String u4 = "https://iter.test/4";
        String u5 = "https://iter.test/5";

        String baselineJob = "job-" + UUID.randomUUID();
        manager.start(baselineJob, manager.planNext(lineage, IterationMode.BASELINE));
        for (String uri : List.of(u1, u2, u3, u4)) {
            assertEquals(ChangeType.NEW, manager.recordFingerprint(baselineJob, fingerprint(uri, "\"e-" + uri + "\"", "h-" + uri)));
        }
        assertEquals(new ComparisonSummary(4, 0, 0, 0), manager.finalizeIteration(baselineJob));

        IterationManager.IterationContext next = manager.planNext(lineage, IterationMode.INCREMENTAL);
        assertEquals(1, next.iterationNumber());
        assertEquals(0, next.parentIteration());
        String incrementalJob = "job-" + UUID.randomUUID();
        manager.start(incrementalJob, next);

        assertFalse(manager.shouldFetch(incrementalJob, u1, new ResourceValidators("\"e-" + u1 + "\"", null, null)));
        assertTrue(manager.shouldFetch(incrementalJob, u2, new ResourceValidators("\"changed\"", null, null)));
        assertTrue(manager.shouldFetch(incrementalJob, u5, ResourceValidators.none()));
        assertTrue(manager.shouldFetch(incrementalJob, u1));

        assertEquals(ChangeType.UNCHANGED, manager.recordFingerprint(incrementalJob, fingerprint(u1, "\"e-" + u1 + "\"", "h-" + u1)));
        assertEquals(ChangeType.MODIFIED, manager.recordFingerprint(incrementalJob, fingerprint(u2, "\"changed\"", "h-new")));
        assertEquals(ChangeType.UNCHANGED, manager.recordUnchanged(incrementalJob, u3));
        assertEquals(ChangeType.NEW, manager.recordFingerprint(incrementalJob, fingerprint(u5, null, "h-" + u5)));

        assertEquals(new ComparisonSummary(1, 1, 2, 1), manager.finalizeIteration(incrementalJob));
        assertEquals(2, fingerprints.countRecorded(lineage, 1));
        assertThat(fingerprints.effectiveSet(lineage, 1)).containsOnlyKeys(u1, u2, u3, u5);
        assertEquals(0, fingerprints.effectiveSet(lineage, 1).get(u1).iterationNumber());

        IterationComparison comparison = manager.compare(lineage, 0, 1);
        assertThat(comparison.newUris()).containsExactly(u5);
        assertThat(comparison.modifiedUris()).containsExactly(u2);
        assertThat(comparison.unchangedUris()).containsExactlyInAnyOrder(u1, u3);
        assertThat(comparison.deletedUris()).containsExactly(u4);
        assertEquals(ChangeType.DELETED, comparison.changeOf(u4));
    }

    @Test
    void chainFollowsParentsBaselineFirst() {
        String lineage = "lin-" + UUID.randomUUID();
        for (IterationMode mode : List.of(IterationMode.BASELINE, IterationMode.INCREMENTAL, IterationMode.FULL)) {
            String jobId = "job-" + UUID.randomUUID();
            manager.start(jobId, manager.planNext(lineage, mode));
            manager.recordFingerprint(jobId, fingerprint("https://chain.test/", null, "same"));
            manager.finalizeIteration(jobId);
        }

        List<Iteration> chain = manager.chain(lineage, 2);
        assertThat(chain).extracting(Iteration::iterationNumber).containsExactly(0, 1, 2);
        assertTrue(chain.get(0).isBaseline());
        assertThat(chain).allMatch(Iteration::isCompleted);
        assertEquals(3, manager.iterations(lineage).size());
        assertEquals(new ComparisonSummary(0, 0, 1, 0), manager.find(lineage, 2).orElseThrow().summary());
        assertThatThrownBy(() -> manager.compare(lineage, 0, 7)).isInstanceOf(IllegalArgumentException.class);
    }

    private static ResourceFingerprint fingerprint(String uri, String etag, String hash) {
        return new ResourceFingerprint(uri, 0, hash, etag, null, 100, AT);
    }
}
