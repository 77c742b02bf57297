package com.harvest.coordinator.crawl.events;

import com.harvest.coordinator.config.CoordinatorProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlEventBusTest {
    private ExecutorService executor;
    private CrawlEventBus bus;

    @BeforeEach
    void setUp() {
        CoordinatorProperties properties = new CoordinatorProperties();
        properties.getEvents().setRingCapacity(5);
        properties.getEvents().setPerKindCapacity(2);
        executor = Executors.newFixedThreadPool(2);
        bus = new CrawlEventBus(properties, executor, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void assignsIncreasingSequencesAndKeepsBoundedHistory() {
        for (int i = 0; i < 8; i++) {
            bus.publish("job-a", EventKind.INFO, message("event " + i));
        }
        bus.publish("job-b", EventKind.INFO, message("other job"));

        List<CrawlEvent> history = bus.history("job-a");
        assertThat(history).hasSize(5);
        assertThat(history).extracting(CrawlEvent::sequence).containsExactly(4L, 5L, 6L, 7L, 8L);
        assertThat(bus.byKind("job-a", EventKind.INFO, 10)).hasSize(2);
        assertThat(bus.recent("job-a", 2)).extracting(CrawlEvent::sequence).containsExactly(7L, 8L);
        assertThat(bus.history("job-b")).singleElement()
            .satisfies(event -> assertThat(event.sequence()).isEqualTo(1L));
    }

    @Test
    void severityDefaultsFromKind() {
        CrawlEvent warning = bus.publish("job-a", EventKind.PAGE_FAILED, new EventPayload.PageFailed("https://x.test/", "http_500", 500));
        CrawlEvent escalated = bus.publish("job-a", EventKind.INFO, EventSeverity.ERROR, message("loud"));

        assertThat(warning.severity()).isEqualTo(EventSeverity.WARNING);
        assertThat(warning.family()).isEqualTo(EventFamily.DISCOVERY);
        assertThat(escalated.severity()).isEqualTo(EventSeverity.ERROR);
    }

    @Test
    void rejectsPayloadOfTheWrongShape() {
        assertThatThrownBy(() -> bus.publish("job-a", EventKind.PAGE_CRAWLED, message("not a page")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("PageCrawled");
        assertThat(bus.history("job-a")).isEmpty();
    }

    @Test
    void asyncSubscriberSeesEventsInPublishOrderAndSurvivesFailingPeer() {
        List<Long> received = new CopyOnWriteArrayList<>();
        bus.subscribeAll(event -> {
            throw new IllegalStateException("broken subscriber");
        });
        bus.subscribe("job-a", event -> received.add(event.sequence()));

        for (int i = 0; i < 50; i++) {
            bus.publish("job-a", EventKind.DEBUG, message("tick " + i));
        }
        bus.publish("job-b", EventKind.DEBUG, message("ignored"));

        assertThat(bus.awaitQuiescence(Duration.ofSeconds(5))).isTrue();
        assertThat(received).hasSize(50);
        for (int i = 0; i < received.size(); i++) {
            assertThat(received.get(i)).isEqualTo(i + 1L);
        }
    }

    @Test
    void inlineSubscriberRunsBeforePublishReturns() {
        List<EventKind> seen = new CopyOnWriteArrayList<>();
        bus.subscribeInline(null, event -> seen.add(event.kind()));

        bus.publish("job-a", EventKind.WARNING, message("now"));

        assertThat(seen).containsExactly(EventKind.WARNING);
    }

    @Test
    void unsubscribedHandlerReceivesNothingFurther() {
        List<CrawlEvent> received = new CopyOnWriteArrayList<>();
        Subscription subscription = bus.subscribeInline("job-a", received::add);
        bus.publish("job-a", EventKind.INFO, message("one"));

        assertThat(bus.unsubscribe(subscription)).isTrue();
        bus.publish("job-a", EventKind.INFO, message("two"));

        assertThat(received).hasSize(1);
        assertThat(subscription.isActive()).isFalse();
    }

    @Test
    void clearDropsHistoryAndJobSubscriptions() {
        List<CrawlEvent> received = new CopyOnWriteArrayList<>();
        bus.subscribeInline("job-a", received::add);
        bus.publish("job-a", EventKind.INFO, message("before"));

        bus.clear("job-a");
        bus.publish("job-a", EventKind.INFO, message("after"));

        assertThat(received).hasSize(1);
        assertThat(bus.history("job-a")).singleElement()
            .satisfies(event -> assertThat(event.sequence()).isEqualTo(1L));
    }

    private static EventPayload.Message message(String text) {
        return new EventPayload.Message(text, null);
    }
}
