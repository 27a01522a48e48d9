package webscan.crawler;

import java.util.*;

/**
 * {@code Disallow} prefixes that robots.txt declares for all user agents ({@code User-agent: *}).
 */
public final class RobotsRules {
    private static final RobotsRules ALLOW_ALL = new RobotsRules(List.of());

    private final List<String> disallowedPrefixes;

    private RobotsRules(List<String> disallowedPrefixes) {
        this.disallowedPrefixes = List.copyOf(disallowedPrefixes);
    }

    public static RobotsRules allowAll() {
        return ALLOW_ALL;
    }

    public static RobotsRules parse(String robotsTxt) {
        if (robotsTxt == null || robotsTxt.isBlank()) {
            return ALLOW_ALL;
        }

        List<String> prefixes = new ArrayList<>();
        Set<String> groupAgents = new HashSet<>();
        boolean lastWasAgent = false;

        for (String rawLine : robotsTxt.split("\\r?\\n")) {
            String line = rawLine;
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();
            int colon = line.indexOf(':');
            if (line.isEmpty() || colon < 0) {
                continue;
            }

            String directive = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            if (directive.equals("user-agent")) {
                // Consecutive User-agent lines share one group
                if (!lastWasAgent) {
                    groupAgents.clear();
                }
                groupAgents.add(value);
                lastWasAgent = true;
            } else {
                lastWasAgent = false;
                if (directive.equals("disallow") && !value.isEmpty() && groupAgents.contains("*")) {
                    prefixes.add(value);
                }
            }
        }
        return new RobotsRules(prefixes);
    }

    /**
     * @param pathAndQuery raw path, optionally followed by {@code ?query}
     */
    public boolean isAllowed(String pathAndQuery) {
        String target = pathAndQuery == null || pathAndQuery.isEmpty() ? "/" : pathAndQuery;
        for (String prefix : disallowedPrefixes) {
            if (target.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    public List<String> getDisallowedPrefixes() {
        return disallowedPrefixes;
    }
}
