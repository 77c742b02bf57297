package com.harvest.coordinator.crawl.fetch;

import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;
import com.harvest.coordinator.crawl.iteration.IterationMode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFetchWorkerTest {
    private MockWebServer server;
    private ExecutorService executor;
    private CoordinatorProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new CoordinatorProperties();
        properties.getFetch().setConcurrency(1);
        properties.getFetch().setPerHostDelayMs(1);
        properties.getFetch().setRequestTimeoutSeconds(5);
        properties.getFetch().setMaxRetries(2);
        properties.getFetch().setRetryBaseDelayMs(1);
        properties.getFetch().setRetryMaxDelayMs(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorThenSucceeds() {
        server.enqueue(new MockResponse().setResponseCode(503).setHeader("Retry-After", "0").setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "text/plain").setBody("ok"));

        FetchOutcome outcome = worker().fetch(server.url("/flaky").toString(), baseline());

        assertThat(outcome.statusCode()).isEqualTo(200);
        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.contentHash()).isNotBlank();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void clientErrorsAndBadUrlsAreNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));
        HttpFetchWorker worker = worker();

        FetchOutcome missing = worker.fetch(server.url("/gone").toString(), baseline());
        assertThat(missing.failureReason()).isEqualTo("http_404");
        assertThat(server.getRequestCount()).isEqualTo(1);

        FetchOutcome malformed = worker.fetch("not a url", baseline());
        assertThat(malformed.errorCode()).isEqualTo("invalid_url");
        assertThat(malformed.isSuccessful()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void conditionalRequestKeepsPriorValidatorsOnNotModified() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(304));
        ResourceValidators previous = new ResourceValidators("\"v1\"", "Mon, 05 Jan 2026 10:00:00 GMT", "hash-a");
        FetchContext context = new FetchContext("job-http", 1, IterationMode.INCREMENTAL, previous, false);

        FetchOutcome outcome = worker().fetch(server.url("/report").toString(), context);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("If-None-Match")).isEqualTo("\"v1\"");
        assertThat(request.getHeader("If-Modified-Since")).isEqualTo("Mon, 05 Jan 2026 10:00:00 GMT");
        assertThat(request.getHeader("User-Agent")).startsWith("harvest-coordinator/0.1");
        assertThat(outcome.isNotModified()).isTrue();
        assertThat(outcome.etag()).isEqualTo("\"v1\"");
        assertThat(outcome.contentHash()).isEqualTo("hash-a");
    }

    @Test
    void extractsAbsoluteHttpLinksFromHtml() {
        String html = """
            <html><body>
              <a href="/filings#latest">Filings</a>
              <a href="/filings">Filings again</a>
              <a href="https://other.test/annual.pdf">Annual</a>
              <a href="mailto:ir@example.test">Mail</a>
            </body></html>
            """;
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/html; charset=utf-8").setBody(html));

        FetchOutcome outcome = worker().fetch(server.url("/index").toString(), baseline());

        assertThat(outcome.links()).containsExactly(server.url("/filings").toString(), "https://other.test/annual.pdf");
    }

    @Test
    void linksAreDecodedWithTheDeclaredCharset() {
        String html = "<html><body><a href=\"/caf\u00e9\">Caf\u00e9</a></body></html>";
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html; charset=ISO-8859-1")
            .setBody(new okio.Buffer().write(html.getBytes(StandardCharsets.ISO_8859_1))));

        FetchOutcome outcome = worker().fetch(server.url("/latin").toString(), baseline());

        assertThat(outcome.links()).hasSize(1);
        assertThat(URLDecoder.decode(outcome.links().get(0), StandardCharsets.UTF_8)).endsWith("/caf\u00e9");
    }

    @Test
    void charsetFallsBackToUtf8() {
        assertThat(HttpFetchWorker.charsetOf("text/html; charset=\"windows-1252\"")).isEqualTo(Charset.forName("windows-1252"));
        assertThat(HttpFetchWorker.charsetOf("text/html")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(HttpFetchWorker.charsetOf("text/html; charset=no-such-set")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(HttpFetchWorker.charsetOf(null)).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void truncatesOversizedBodies() {
        properties.getFetch().setMaxBodyBytes(1024);
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/plain").setBody("x".repeat(5000)));

        FetchOutcome outcome = worker().fetch(server.url("/big").toString(), baseline());

        assertThat(outcome.contentLength()).isEqualTo(1024);
        assertThat(outcome.links()).isEmpty();
    }

    @Test
    void probeUsesHeadAndReturnsValidators() throws Exception {
        server.enqueue(new MockResponse().setHeader("ETag", "\"abc\"").setHeader("Last-Modified", "Tue, 06 Jan 2026 00:00:00 GMT"));

        ResourceValidators validators = worker().probe(server.url("/page").toString());

        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getMethod()).isEqualTo("HEAD");
        assertThat(validators.etag()).isEqualTo("\"abc\"");
        assertThat(validators.lastModified()).isEqualTo("Tue, 06 Jan 2026 00:00:00 GMT");
        assertThat(validators.hasContentHash()).isFalse();
    }

    @Test
    void robotsAreParsedOncePerOriginAndMissingRobotsAllowAll() throws Exception {
        server.enqueue(new MockResponse().setBody("User-agent: *\nDisallow: /private\n"));
        HttpFetchWorker worker = worker();
        String origin = "http://" + server.getHostName() + ":" + server.getPort();

        RobotsRules rules = worker.robots(origin);
        RobotsRules cached = worker.robots(origin);

        assertThat(rules.isPresent()).isTrue();
        assertThat(rules.allows(origin + "/private/x")).isFalse();
        assertThat(cached).isSameAs(rules);
        assertThat(server.getRequestCount()).isEqualTo(1);

        MockWebServer empty = new MockWebServer();
        try {
            empty.enqueue(new MockResponse().setResponseCode(404));
            empty.start();
            RobotsRules missing = worker.robots("http://" + empty.getHostName() + ":" + empty.getPort());
            assertThat(missing.isPresent()).isFalse();
            assertThat(missing.isAllowed("/private/x")).isTrue();
        } finally {
            shutdownQuietly(empty);
        }
    }

    private HttpFetchWorker worker() {
        return new HttpFetchWorker(properties, executor);
    }

    private static FetchContext baseline() {
        return new FetchContext("job-http", 0, IterationMode.BASELINE, ResourceValidators.none(), false);
    }

    private static void shutdownQuietly(MockWebServer server) {
        try {
            server.shutdown();
        } catch (Exception ignored) {
            // test cleanup
        }
    }
}
