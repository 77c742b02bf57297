package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.model.FrontierEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FrontierTest {
    private static final FrontierEntry A = FrontierEntry.seed("https://f.test/a");
    private static final FrontierEntry B = FrontierEntry.seed("https://f.test/b");
    private static final FrontierEntry C = new FrontierEntry("https://f.test/c", 1, "https://f.test/a", false);
    private static final FrontierEntry DOC = new FrontierEntry("https://f.test/r.pdf", 1, "https://f.test/a", true);

    @Test
    void acceptsEachUriOnceAndKeepsDocumentsApart() {
        Frontier frontier = new Frontier();

        assertThat(frontier.offer(A)).isTrue();
        assertThat(frontier.offer(DOC)).isTrue();
        assertThat(frontier.offer(FrontierEntry.seed(A.uri()))).isFalse();
        assertThat(frontier.offer(null)).isFalse();

        assertThat(frontier.hasPending(false)).isTrue();
        assertThat(frontier.hasPending(true)).isTrue();
        assertThat(frontier.poll(true)).contains(DOC);
        assertThat(frontier.poll(true)).isEmpty();
        assertThat(frontier.knownCount()).isEqualTo(2);
    }

    @Test
    void completedUrisAreNotOfferedAgain() {
        Frontier frontier = new Frontier();
        frontier.offer(A);
        frontier.poll(false);
        frontier.complete(A.uri());

        assertThat(frontier.offer(A)).isFalse();
        assertThat(frontier.isCompleted(A.uri())).isTrue();
        assertThat(frontier.inFlightCount()).isZero();
        assertThat(frontier.completedCount()).isEqualTo(1);
    }

    @Test
    void requeuePutsWorkBackAtTheHead() {
        Frontier frontier = new Frontier();
        frontier.offer(A);
        frontier.offer(B);

        assertThat(frontier.poll(false)).contains(A);
        frontier.requeue(A.uri());
        frontier.requeue("https://f.test/unknown");

        assertThat(frontier.inFlightCount()).isZero();
        assertThat(frontier.poll(false)).contains(A);
        assertThat(frontier.poll(false)).contains(B);
    }

    @Test
    void snapshotReportsInFlightAsPendingAndRestores() {
        Frontier frontier = new Frontier();
        frontier.offer(A);
        frontier.offer(B);
        frontier.offer(C);
        frontier.offer(DOC);
        frontier.poll(false);
        frontier.complete(A.uri());
        frontier.poll(false);

        Frontier.Snapshot snapshot = frontier.snapshot();
        assertThat(snapshot.pending()).containsExactly(B, C);
        assertThat(snapshot.pendingDocuments()).containsExactly(DOC);
        assertThat(snapshot.completed()).containsExactly(A.uri());

        Frontier restored = new Frontier();
        restored.restore(snapshot.pending(), snapshot.pendingDocuments(), snapshot.completed(), List.of("https://f.test/x"));

        assertThat(restored.pendingCount()).isEqualTo(3);
        assertThat(restored.offer(A)).isFalse();
        assertThat(restored.offer(FrontierEntry.seed("https://f.test/x"))).isFalse();
        assertThat(restored.poll(false)).contains(B);
        assertThat(restored.snapshot().failed()).containsExactly("https://f.test/x");
    }
}
