package webscan.model;

/**
 * Snapshot of the request/response pair that produced a finding.
 * Response bodies are truncated to {@link #MAX_EXCERPT_LENGTH} characters.
 *
 * @param method HTTP method of the probe
 * @param url full probe URL
 * @param requestBody encoded request body, or null for bodiless requests
 * @param statusCode response status code
 * @param contentLength response body length in characters
 * @param elapsedMs response time in milliseconds
 * @param responseExcerpt leading part of the response body
 */
public record ExchangeSnapshot(
    String method,
    String url,
    String requestBody,
    int statusCode,
    int contentLength,
    long elapsedMs,
    String responseExcerpt
) {
    public static final int MAX_EXCERPT_LENGTH = 500;

    public static String excerpt(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_EXCERPT_LENGTH ? body.substring(0, MAX_EXCERPT_LENGTH) : body;
    }
}
