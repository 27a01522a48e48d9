package webscan.http;

import java.time.Duration;
import java.util.*;

/**
 * HTTP ответ, полученный в ответ на один запрос.
 * Содержит код статуса, заголовки, тело и время ответа.
 */
public final class HttpResponse {
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final Duration elapsed;
    private final String url;

    private HttpResponse(Builder builder) {
        this.statusCode = builder.statusCode;
        TreeMap<String, List<String>> headerCopy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        builder.headers.forEach((name, values) -> headerCopy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(headerCopy);
        this.body = builder.body != null ? builder.body : "";
        this.elapsed = builder.elapsed != null ? builder.elapsed : Duration.ZERO;
        this.url = builder.url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public String getUrl() {
        return url;
    }

    public int getContentLength() {
        return body.length();
    }

    public Optional<String> getHeader(String name) {
        List<String> values = headers.get(name);
        return values != null && !values.isEmpty()
            ? Optional.of(values.get(0))
            : Optional.empty();
    }

    public List<String> getHeaderValues(String name) {
        return headers.getOrDefault(name, List.of());
    }

    public String getContentType() {
        return getHeader("Content-Type").orElse("");
    }

    public boolean isHtml() {
        String contentType = getContentType().toLowerCase(Locale.ROOT);
        return contentType.contains("text/html") || contentType.contains("application/xhtml+xml");
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isRedirect() {
        return statusCode >= 300 && statusCode < 400 && getHeader("Location").isPresent();
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    public Optional<String> getLocation() {
        return isRedirect() ? getHeader("Location") : Optional.empty();
    }

    @Override
    public String toString() {
        return "HttpResponse{statusCode=" + statusCode +
               ", elapsed=" + elapsed.toMillis() + "ms" +
               ", bodyLength=" + body.length() + "}";
    }

    public static class Builder {
        private int statusCode;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private String body;
        private Duration elapsed;
        private String url;

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder headers(Map<String, List<String>> headers) {
            if (headers != null) {
                headers.forEach((name, values) -> {
                    if (name != null && values != null) {
                        this.headers.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values);
                    }
                });
            }
            return this;
        }

        public Builder addHeader(String name, String value) {
            this.headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public HttpResponse build() {
            return new HttpResponse(this);
        }
    }
}
