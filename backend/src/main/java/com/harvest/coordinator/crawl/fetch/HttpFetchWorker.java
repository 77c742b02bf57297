package com.harvest.coordinator.crawl.fetch;

import com.harvest.coordinator.config.CoordinatorProperties;
import com.harvest.coordinator.crawl.fingerprint.ContentNormalizer;
import com.harvest.coordinator.crawl.fingerprint.ResourceValidators;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP worker with a global concurrency cap, a per-host delay, jittered retries and conditional
 * requests against the parent iteration's validators.
 */
@Service
public class HttpFetchWorker implements FetchWorker {
    private static final Logger log = LoggerFactory.getLogger(HttpFetchWorker.class);
    private static final Duration RATE_LIMIT_BACKOFF = Duration.ofSeconds(30);
    private static final String PAGE_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final CoordinatorProperties.Fetch properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();
    private final Map<String, RobotsRules> robotsCache = new ConcurrentHashMap<>();

    public HttpFetchWorker(
        CoordinatorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties.getFetch();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(
            Math.max(1, this.properties.getConcurrency() * Math.max(1, properties.getMaxConcurrentJobs()))
        );
    }

    @Override
    public FetchOutcome fetch(String uri, FetchContext context) {
        ResourceValidators previous = context == null ? ResourceValidators.none() : context.previous();
        int maxAttempts = Math.max(1, 1 + properties.getMaxRetries());
        FetchOutcome last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            last = executeOnce(uri, "GET", previous);
            if (!shouldRetry(last) || attempt >= maxAttempts) {
                break;
            }
            log.debug("Retrying {} after {} (attempt {}/{})", uri, last.failureReason(), attempt, maxAttempts);
            if (!sleepBackoff(attempt)) {
                break;
            }
        }
        return last;
    }

    @Override
    public ResourceValidators probe(String uri) {
        FetchOutcome head = executeOnce(uri, "HEAD", ResourceValidators.none());
        if (!head.isSuccessful()) {
            return ResourceValidators.none();
        }
        return new ResourceValidators(head.etag(), head.lastModified(), null);
    }

    @Override
    public RobotsRules robots(String origin) {
        if (origin == null || origin.isBlank()) {
            return RobotsRules.allowAll();
        }
        String key = origin.toLowerCase(Locale.ROOT);
        return robotsCache.computeIfAbsent(key, this::loadRobots);
    }

    private RobotsRules loadRobots(String origin) {
        FetchOutcome outcome = executeOnce(origin + "/robots.txt", "GET", ResourceValidators.none());
        if (!outcome.isSuccessful()) {
            log.info(
                "robots.txt unavailable origin={} status={} errorCode={} decision=allow_all",
                origin,
                outcome.statusCode(),
                outcome.errorCode()
            );
            return RobotsRules.allowAll();
        }
        String body = outcome.content() == null ? "" : new String(outcome.content(), StandardCharsets.UTF_8);
        return RobotsRules.parse(body, CoordinatorProperties.normalizeUserAgent(properties.getUserAgent()));
    }

    private FetchOutcome executeOnce(String url, String method, ResourceValidators previous) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return FetchOutcome.error(url, "invalid_url", "URL missing host or malformed", elapsed(startedAt));
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            enforcePerHostDelay(host);

            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", CoordinatorProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", PAGE_ACCEPT);
            if (previous.hasEtag()) {
                builder.header("If-None-Match", previous.etag());
            }
            if (previous.hasLastModified()) {
                builder.header("If-Modified-Since", previous.lastModified());
            }
            HttpRequest request = "HEAD".equals(method)
                ? builder.method("HEAD", HttpRequest.BodyPublishers.noBody()).build()
                : builder.GET().build();

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status == 429 || status == 503) {
                extendBackoff(host, retryAfter(response.headers()));
            }
            HttpHeaders headers = response.headers();
            String contentType = headers.firstValue("Content-Type").orElse(null);
            String etag = headers.firstValue("ETag").orElse(status == 304 ? previous.etag() : null);
            String lastModified = headers.firstValue("Last-Modified").orElse(status == 304 ? previous.lastModified() : null);
            byte[] body = truncate(response.body());
            String hash = null;
            List<String> links = List.of();
            if (status >= 200 && status < 300 && body != null && "GET".equals(method)) {
                hash = ContentNormalizer.contentHash(body, contentType);
                links = extractLinks(response.uri().toString(), body, contentType);
            } else if (status == 304) {
                hash = previous.contentHash();
            }
            return new FetchOutcome(
                url,
                status,
                body,
                contentType,
                etag,
                lastModified,
                hash,
                links,
                elapsed(startedAt),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return FetchOutcome.error(url, "timeout", e.getMessage(), elapsed(startedAt));
        } catch (IOException e) {
            return FetchOutcome.error(url, "io_error", e.getMessage(), elapsed(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.error(url, "interrupted", e.getMessage(), elapsed(startedAt));
        } catch (RuntimeException e) {
            return FetchOutcome.error(url, "http_error", e.getMessage(), elapsed(startedAt));
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private List<String> extractLinks(String baseUri, byte[] body, String contentType) {
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("html")) {
            return List.of();
        }
        Document document = Jsoup.parse(new String(body, charsetOf(contentType)), baseUri);
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String absolute = anchor.absUrl("href");
            if (absolute.isBlank()) {
                continue;
            }
            int fragment = absolute.indexOf('#');
            String link = fragment >= 0 ? absolute.substring(0, fragment) : absolute;
            if (link.startsWith("http://") || link.startsWith("https://")) {
                links.add(link);
            }
        }
        return new ArrayList<>(links);
    }

    /** The {@code charset} parameter of a Content-Type, UTF-8 when absent or unknown. */
    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String parameter : contentType.split(";")) {
            String trimmed = parameter.trim();
            if (!trimmed.regionMatches(true, 0, "charset=", 0, 8)) {
                continue;
            }
            String name = trimmed.substring(8).trim().replace("\"", "").replace("'", "");
            try {
                return Charset.forName(name);
            } catch (IllegalArgumentException e) {
                log.debug("Unknown charset {} in Content-Type {}", name, contentType);
                return StandardCharsets.UTF_8;
            }
        }
        return StandardCharsets.UTF_8;
    }

    private byte[] truncate(byte[] body) {
        int max = properties.getMaxBodyBytes();
        if (body == null || max <= 0 || body.length <= max) {
            return body;
        }
        return Arrays.copyOf(body, max);
    }

    private boolean shouldRetry(FetchOutcome outcome) {
        String errorCode = outcome.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = outcome.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(Math.max(0, properties.getPerHostDelayMs())));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private Duration retryAfter(HttpHeaders headers) {
        String value = headers.firstValue("Retry-After").orElse(null);
        if (value != null) {
            try {
                long seconds = Long.parseLong(value.trim());
                return Duration.ofSeconds(Math.max(0, Math.min(seconds, RATE_LIMIT_BACKOFF.getSeconds())));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric Retry-After value {}", value);
            }
        }
        return RATE_LIMIT_BACKOFF;
    }

    private Duration elapsed(Instant startedAt) {
        return Duration.between(startedAt, Instant.now());
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
