package webscan.crawler;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts link candidates from HTML, inline JavaScript and CSS by pattern matching.
 */
public final class LinkExtractor {

    private static final List<Pattern> LINK_PATTERNS = List.of(
        // HTML attributes
        Pattern.compile("(?:href|src|action|data|location)\\s*=\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE),
        // JavaScript url/location assignments
        Pattern.compile("(?:url|location)\\s*[:=]\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE),
        // CSS url() references
        Pattern.compile("url\\(\\s*['\"]?([^'\")]+)['\"]?\\s*\\)", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> SKIPPED_PREFIXES = List.of(
        "#", "javascript:", "data:", "mailto:", "tel:", "sms:", "ftp:"
    );

    private LinkExtractor() {
    }

    /**
     * @param body page body
     * @param pageUrl URL the page was fetched from, used to resolve relative references
     * @return normalized absolute http(s) URLs in discovery order
     */
    public static Set<String> extract(String body, String pageUrl) {
        Set<String> links = new LinkedHashSet<>();
        if (body == null || body.isEmpty()) {
            return links;
        }

        for (Pattern pattern : LINK_PATTERNS) {
            Matcher matcher = pattern.matcher(body);
            while (matcher.find()) {
                String reference = matcher.group(1).trim();
                if (isSkipped(reference)) {
                    continue;
                }
                UrlNormalizer.resolve(pageUrl, reference)
                    .filter(LinkExtractor::isHttp)
                    .ifPresent(links::add);
            }
        }
        return links;
    }

    private static boolean isSkipped(String reference) {
        if (reference.isEmpty()) {
            return true;
        }
        String lower = reference.toLowerCase(Locale.ROOT);
        for (String prefix : SKIPPED_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isHttp(String url) {
        return url.startsWith("http://") || url.startsWith("https://");
    }
}
