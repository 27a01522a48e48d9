package webscan.crawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;

/**
 * Canonical form of URLs used for crawl bookkeeping and finding deduplication.
 *
 * <p>Normalization lower-cases scheme and host, drops default ports, resolves dot segments,
 * strips the fragment and any trailing slash (the root path stays {@code /}) and sorts
 * query parameters. Normalizing an already normalized URL returns it unchanged.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * @param url absolute http(s) URL
     * @return normalized URL
     * @throws IllegalArgumentException if the URL is not an absolute http(s) URL
     */
    public static String normalize(String url) {
        URI uri = parse(url);
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Not an http(s) URL: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(uri.getHost().toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port != -1 && !(scheme.equals("http") && port == 80) && !(scheme.equals("https") && port == 443)) {
            sb.append(':').append(port);
        }

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        sb.append(path);

        String query = sortQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Resolves a possibly relative reference against a page URL and normalizes the result.
     *
     * @return the normalized absolute URL, or empty if the reference is unusable
     */
    public static Optional<String> resolve(String baseUrl, String reference) {
        if (reference == null) {
            return Optional.empty();
        }
        String cleaned = reference.trim().replace("&amp;", "&").replace(" ", "%20");
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            String resolved = parse(baseUrl).resolve(cleaned).toString();
            return Optional.of(normalize(resolved));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Returns the URL without query string and fragment, normalized.
     */
    public static String withoutQuery(String url) {
        String normalized = normalize(url);
        int q = normalized.indexOf('?');
        return q >= 0 ? normalized.substring(0, q) : normalized;
    }

    static String sortQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        List<String> params = new ArrayList<>();
        for (String param : rawQuery.split("&")) {
            if (!param.isEmpty()) {
                params.add(param);
            }
        }
        params.sort(Comparator.comparing((String p) -> p.split("=", 2)[0]).thenComparing(p -> p));
        return String.join("&", params);
    }

    private static URI parse(String url) {
        if (url == null) {
            throw new IllegalArgumentException("URL cannot be null");
        }
        try {
            URI uri = new URI(url.trim()).normalize();
            if (!uri.isAbsolute()) {
                throw new IllegalArgumentException("URL is not absolute: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URL: " + url, e);
        }
    }
}
