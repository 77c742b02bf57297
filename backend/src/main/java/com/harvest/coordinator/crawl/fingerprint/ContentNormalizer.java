package com.harvest.coordinator.crawl.fingerprint;

import com.harvest.coordinator.crawl.util.HashUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Produces content hashes that ignore markup-only churn. HTML is reduced to its visible text with
 * collapsed whitespace; anything else is hashed byte for byte.
 */
public final class ContentNormalizer {

    private ContentNormalizer() {
    }

    public static String contentHash(byte[] body, String contentType) {
        if (body == null) {
            return null;
        }
        if (isHtml(body, contentType)) {
            return HashUtils.sha256Hex(normalizeHtml(new String(body, StandardCharsets.UTF_8)));
        }
        return HashUtils.sha256Hex(body);
    }

    public static String normalizeHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html);
        document.select("script, style, noscript").remove();
        String title = document.title();
        String text = document.body() == null ? document.text() : document.body().text();
        return (title + " " + text).replaceAll("\\s+", " ").trim();
    }

    static boolean isHtml(byte[] body, String contentType) {
        if (contentType != null) {
            String normalized = contentType.toLowerCase(Locale.ROOT);
            return normalized.contains("text/html") || normalized.contains("application/xhtml");
        }
        int probe = Math.min(body.length, 256);
        String head = new String(body, 0, probe, StandardCharsets.UTF_8).trim().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html");
    }
}
