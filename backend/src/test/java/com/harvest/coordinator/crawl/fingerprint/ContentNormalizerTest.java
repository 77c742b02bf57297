package com.harvest.coordinator.crawl.fingerprint;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentNormalizerTest {

    @Test
    void htmlIsReducedToVisibleText() {
        String html = """
            <html><head><title>Reports</title><script>var x = 1;</script><style>p {}</style></head>
            <body><p>Annual   report</p>
            <noscript>enable js</noscript><div>2026</div></body></html>
            """;
        assertEquals("Reports Annual report 2026", ContentNormalizer.normalizeHtml(html));
    }

    @Test
    void markupOnlyChangesKeepTheSameHash() {
        byte[] first = "<html><body><p>Hello world</p><script>track(1)</script></body></html>".getBytes(StandardCharsets.UTF_8);
        byte[] second = "<html><body>\n  <div class=\"x\">Hello\n world</div><script>track(2)</script></body></html>"
            .getBytes(StandardCharsets.UTF_8);

        assertEquals(
            ContentNormalizer.contentHash(first, "text/html"),
            ContentNormalizer.contentHash(second, "text/html; charset=utf-8")
        );
    }

    @Test
    void nonHtmlIsHashedByteForByte() {
        byte[] first = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
        byte[] second = "a,b\n1,2 \n".getBytes(StandardCharsets.UTF_8);

        assertNotEquals(ContentNormalizer.contentHash(first, "text/csv"), ContentNormalizer.contentHash(second, "text/csv"));
        assertNull(ContentNormalizer.contentHash(null, "text/html"));
    }

    @Test
    void sniffsHtmlWithoutContentType() {
        byte[] body = "<!DOCTYPE html><html><body>x</body></html>".getBytes(StandardCharsets.UTF_8);
        assertTrue(ContentNormalizer.isHtml(body, null));
        assertFalse(ContentNormalizer.isHtml("%PDF-1.7".getBytes(StandardCharsets.UTF_8), null));
    }
}
