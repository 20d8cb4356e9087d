package io.regtruth.pipeline.discovery.listing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Disallow prefixes from the {@code User-agent: *} group of a robots.txt file.
 */
public final class RobotsRules {

    private static final RobotsRules ALLOW_ALL = new RobotsRules(List.of());

    private final List<String> disallowed;

    private RobotsRules(List<String> disallowed) {
        this.disallowed = disallowed;
    }

    public static RobotsRules allowAll() {
        return ALLOW_ALL;
    }

    public static RobotsRules parse(String robotsTxt) {
        if (robotsTxt == null || robotsTxt.isBlank()) {
            return ALLOW_ALL;
        }
        List<String> disallowed = new ArrayList<>();
        boolean inWildcardGroup = false;
        boolean previousWasAgent = false;

        for (String rawLine : robotsTxt.split("\\r?\\n")) {
            String line = rawLine.contains("#") ? rawLine.substring(0, rawLine.indexOf('#')) : rawLine;
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String field = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            if (field.equals("user-agent")) {
                boolean wildcard = value.equals("*");
                inWildcardGroup = previousWasAgent ? inWildcardGroup || wildcard : wildcard;
                previousWasAgent = true;
                continue;
            }
            previousWasAgent = false;
            if (inWildcardGroup && field.equals("disallow") && !value.isEmpty()) {
                disallowed.add(value);
            }
        }
        return new RobotsRules(List.copyOf(disallowed));
    }

    public boolean isAllowed(String path) {
        String target = path == null || path.isEmpty() ? "/" : path;
        return disallowed.stream().noneMatch(target::startsWith);
    }
}
