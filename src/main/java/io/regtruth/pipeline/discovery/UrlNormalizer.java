package io.regtruth.pipeline.discovery;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical URL form used for deduplication: lowercase scheme and host, no fragment, no
 * tracking parameters, no trailing slash on non-root paths.
 */
public final class UrlNormalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content", "ref", "fbclid", "gclid");

    private UrlNormalizer() {
    }

    public static Optional<String> normalize(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return Optional.empty();
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return Optional.empty();
            }

            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            if (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }

            StringBuilder normalized = new StringBuilder()
                    .append(scheme).append("://")
                    .append(uri.getHost().toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1 && !isDefaultPort(scheme, uri.getPort())) {
                normalized.append(':').append(uri.getPort());
            }
            normalized.append(path);

            String query = stripTracking(uri.getRawQuery());
            if (!query.isEmpty()) {
                normalized.append('?').append(query);
            }
            return Optional.of(normalized.toString());

        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    public static Optional<String> resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return Optional.empty();
        }
        try {
            return normalize(new URI(baseUrl).resolve(href.trim()).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean isSameDomain(String a, String b) {
        String hostA = hostOf(a);
        return hostA != null && hostA.equals(hostOf(b));
    }

    public static String hostOf(String url) {
        try {
            String host = new URI(url).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String stripTracking(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        return Arrays.stream(rawQuery.split("&"))
                .filter(pair -> !pair.isEmpty())
                .filter(pair -> !TRACKING_PARAMS.contains(pair.split("=", 2)[0].toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining("&"));
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
    }
}
