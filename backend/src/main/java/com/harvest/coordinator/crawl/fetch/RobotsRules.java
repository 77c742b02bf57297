package com.harvest.coordinator.crawl.fetch;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Allow/disallow rules from a robots.txt file for one user agent.
 *
 * <p>A group naming the agent's product token wins over the {@code *} group. Among matching rules
 * the longest path wins, and allow beats disallow on a tie.
 */
public class RobotsRules {
    private final List<Rule> rules;
    private final Integer crawlDelaySeconds;
    private final boolean present;

    public RobotsRules(List<Rule> rules, Integer crawlDelaySeconds, boolean present) {
        this.rules = List.copyOf(rules);
        this.crawlDelaySeconds = crawlDelaySeconds;
        this.present = present;
    }

    /** Rules for an origin without a robots.txt. */
    public static RobotsRules allowAll() {
        return new RobotsRules(List.of(), null, false);
    }

    public static RobotsRules disallowAll() {
        return new RobotsRules(List.of(new Rule("/", false)), null, true);
    }

    /** Whether a robots.txt was found and parsed. */
    public boolean isPresent() {
        return present;
    }

    public Integer getCrawlDelaySeconds() {
        return crawlDelaySeconds;
    }

    public boolean allows(String uri) {
        try {
            URI parsed = URI.create(uri);
            String path = parsed.getRawPath() == null || parsed.getRawPath().isEmpty() ? "/" : parsed.getRawPath();
            String query = parsed.getRawQuery();
            return isAllowed(query == null ? path : path + "?" + query);
        } catch (IllegalArgumentException e) {
            return isAllowed("/");
        }
    }

    public boolean isAllowed(String pathAndQuery) {
        if (rules.isEmpty()) {
            return true;
        }
        String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
        Rule best = null;
        for (Rule rule : rules) {
            if (!rule.matches(subject)) {
                continue;
            }
            if (best == null
                || rule.path().length() > best.path().length()
                || (rule.path().length() == best.path().length() && rule.allow() && !best.allow())) {
                best = rule;
            }
        }
        return best == null || best.allow();
    }

    public static RobotsRules parse(String robotsText, String userAgent) {
        if (robotsText == null || robotsText.isBlank()) {
            return new RobotsRules(List.of(), null, true);
        }
        String token = productToken(userAgent);

        List<Rule> wildcardRules = new ArrayList<>();
        List<Rule> agentRules = new ArrayList<>();
        Integer wildcardDelay = null;
        Integer agentDelay = null;
        boolean agentGroupSeen = false;

        List<String> groupAgents = new ArrayList<>();
        boolean collectingAgents = false;

        for (String rawLine : robotsText.split("\\R")) {
            int hash = rawLine.indexOf('#');
            String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
            int colon = line.indexOf(':');
            if (line.isEmpty() || colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            if ("user-agent".equals(key)) {
                if (!collectingAgents) {
                    groupAgents.clear();
                }
                groupAgents.add(value.toLowerCase(Locale.ROOT));
                collectingAgents = true;
                continue;
            }
            collectingAgents = false;

            boolean forAgent = token != null && groupAgents.stream().anyMatch(agent -> !agent.equals("*") && token.startsWith(agent));
            boolean forWildcard = groupAgents.contains("*");
            if (!forAgent && !forWildcard) {
                continue;
            }
            agentGroupSeen |= forAgent;
            List<Rule> target = forAgent ? agentRules : wildcardRules;
            switch (key) {
                case "allow", "disallow" -> {
                    if (!value.isBlank()) {
                        target.add(new Rule(value, "allow".equals(key)));
                    }
                }
                case "crawl-delay" -> {
                    Integer delay = parseDelay(value);
                    if (forAgent) {
                        agentDelay = delay;
                    } else {
                        wildcardDelay = delay;
                    }
                }
                default -> {
                    // sitemap and unknown directives are not used for access decisions
                }
            }
        }
        if (agentGroupSeen) {
            return new RobotsRules(agentRules, agentDelay, true);
        }
        return new RobotsRules(wildcardRules, wildcardDelay, true);
    }

    private static String productToken(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return null;
        }
        String first = userAgent.trim().split("[/\\s]", 2)[0];
        return first.toLowerCase(Locale.ROOT);
    }

    private static Integer parseDelay(String value) {
        try {
            return (int) Math.ceil(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public record Rule(String path, boolean allow) {
        public boolean matches(String candidate) {
            String normalized = path.startsWith("/") ? path : "/" + path;
            if (normalized.indexOf('*') < 0 && !normalized.endsWith("$")) {
                return candidate.startsWith(normalized);
            }
            StringBuilder regex = new StringBuilder("^");
            for (int i = 0; i < normalized.length(); i++) {
                char c = normalized.charAt(i);
                if (c == '*') {
                    regex.append(".*");
                } else if (c == '$' && i == normalized.length() - 1) {
                    regex.append('$');
                } else {
                    regex.append(Pattern.quote(String.valueOf(c)));
                }
            }
            return Pattern.compile(regex.toString()).matcher(candidate).find();
        }
    }
}
