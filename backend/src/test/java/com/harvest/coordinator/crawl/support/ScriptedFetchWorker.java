package com.harvest.coordinator.crawl.support;

import com.harvest.coordinator.crawl.fetch.FetchContext;
import com.harvest.coordinator.crawl.fetch.FetchOutcome;
import com.harvest.coordinator.crawl.fetch.FetchWorker;
import com.harvest.coordinator.crawl.fetch.RobotsRules;
import com.harvest.coordinator.crawl.fingerprint.ContentNormalizer;
import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory fetch worker for coordinator tests. Unknown URIs answer 200 with a body derived from the
 * URI. Tests use unique hosts, so scripts registered by one test never affect another.
 */
public class ScriptedFetchWorker implements FetchWorker {
    private static final String HTML = "text/html; charset=utf-8";

    private final Map<String, Page> pages = new ConcurrentHashMap<>();
    private final Map<String, Gate> gates = new ConcurrentHashMap<>();
    private final Map<String, RobotsRules> robots = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> probes = new ConcurrentHashMap<>();

    public record Page(int status, String body, String etag, List<String> links) {
    }

    public static String uniqueHost() {
        return "https://site-" + UUID.randomUUID().toString().substring(0, 8) + ".test";
    }

    public void page(String uri, String body, String etag, String... links) {
        pages.put(uri, new Page(200, body, etag, List.of(links)));
    }

    public void status(String uri, int status) {
        pages.put(uri, new Page(status, "", null, List.of()));
    }

    public void robots(String origin, RobotsRules rules) {
        robots.put(origin, rules);
    }

    /** The next fetch of {@code uri} blocks until {@link Gate#open()} is called. */
    public Gate block(String uri) {
        Gate gate = new Gate();
        gates.put(uri, gate);
        return gate;
    }

    public int fetchCount(String uri) {
        AtomicInteger count = fetches.get(uri);
        return count == null ? 0 : count.get();
    }

    public int probeCount(String uri) {
        AtomicInteger count = probes.get(uri);
        return count == null ? 0 : count.get();
    }

    @Override
    public FetchOutcome fetch(String uri, FetchContext context) {
        Gate gate = gates.remove(uri);
        if (gate != null) {
            gate.pass();
        }
        fetches.computeIfAbsent(uri, ignored -> new AtomicInteger()).incrementAndGet();
        Page page = pages.getOrDefault(uri, new Page(200, "<html><body>content of " + uri + "</body></html>", null, List.of()));
        if (page.status() != 200) {
            return new FetchOutcome(uri, page.status(), null, HTML, null, null, null, List.of(), Duration.ofMillis(1), null, null);
        }
        ResourceValidators previous = context.previous();
        if (page.etag() != null && Objects.equals(previous.etag(), page.etag())) {
            return new FetchOutcome(
                uri,
                304,
                null,
                HTML,
                page.etag(),
                null,
                previous.contentHash(),
                List.of(),
                Duration.ofMillis(1),
                null,
                null
            );
        }
        byte[] body = page.body().getBytes(StandardCharsets.UTF_8);
        return new FetchOutcome(
            uri,
            200,
            body,
            HTML,
            page.etag(),
            null,
            ContentNormalizer.contentHash(body, HTML),
            page.links(),
            Duration.ofMillis(1),
            null,
            null
        );
    }

    @Override
    public ResourceValidators probe(String uri) {
        probes.computeIfAbsent(uri, ignored -> new AtomicInteger()).incrementAndGet();
        Page page = pages.get(uri);
        if (page == null || page.etag() == null) {
            return ResourceValidators.none();
        }
        return new ResourceValidators(page.etag(), null, null);
    }

    @Override
    public RobotsRules robots(String origin) {
        return robots.getOrDefault(origin, RobotsRules.allowAll());
    }

    public static final class Gate {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch opened = new CountDownLatch(1);

        public boolean awaitEntered(Duration timeout) throws InterruptedException {
            return entered.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        public void open() {
            opened.countDown();
        }

        private void pass() {
            entered.countDown();
            try {
                opened.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
