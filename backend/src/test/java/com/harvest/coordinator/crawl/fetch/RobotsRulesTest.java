package com.harvest.coordinator.crawl.fetch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RobotsRulesTest {
    private static final String AGENT = "harvest-coordinator/0.1 (+contact)";

    @Test
    void longestMatchWinsForWildcardUserAgent() {
        String robots =
            """
                User-agent: *
                Disallow: /private
                Allow: /private/public
                Sitemap: https://example.com/sitemap.xml
                """;

        RobotsRules rules = RobotsRules.parse(robots, AGENT);
        assertTrue(rules.isPresent());
        assertFalse(rules.isAllowed("/private/page"));
        assertTrue(rules.isAllowed("/private/public/page"));
        assertTrue(rules.isAllowed("/other"));
    }

    @Test
    void namedGroupReplacesWildcardGroup() {
        String robots =
            """
                User-agent: *
                Disallow: /

                User-agent: other-bot
                User-agent: Harvest-Coordinator
                Disallow: /drafts
                Crawl-delay: 2.5
                """;

        RobotsRules rules = RobotsRules.parse(robots, AGENT);
        assertTrue(rules.allows("https://example.com/reports/2026"));
        assertFalse(rules.allows("https://example.com/drafts/q1"));
        assertEquals(3, rules.getCrawlDelaySeconds());

        RobotsRules anonymous = RobotsRules.parse(robots, "somebody-else/1.0");
        assertFalse(anonymous.allows("https://example.com/reports/2026"));
    }

    @Test
    void allowWinsTieAndWildcardsMatch() {
        String robots =
            """
                User-agent: *
                Disallow: /files
                Allow: /files
                Disallow: /*.pdf$
                Disallow: /search?q=  # comment
                """;

        RobotsRules rules = RobotsRules.parse(robots, AGENT);
        assertTrue(rules.isAllowed("/files/list"));
        assertFalse(rules.allows("https://example.com/docs/annual.pdf"));
        assertTrue(rules.allows("https://example.com/docs/annual.pdf?download=1"));
        assertFalse(rules.allows("https://example.com/search?q=filings"));
        assertTrue(rules.allows("https://example.com/search"));
    }

    @Test
    void missingOrBlankRobotsAllowEverything() {
        RobotsRules missing = RobotsRules.allowAll();
        assertFalse(missing.isPresent());
        assertTrue(missing.allows("https://example.com/anything"));

        RobotsRules blank = RobotsRules.parse("  \n", AGENT);
        assertTrue(blank.isPresent());
        assertTrue(blank.isAllowed("/anything"));
        assertNull(blank.getCrawlDelaySeconds());

        assertFalse(RobotsRules.disallowAll().allows("https://example.com/"));
    }
}
