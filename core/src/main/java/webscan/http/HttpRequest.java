package webscan.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * HTTP запрос, отправляемый сканером.
 * Неизменяем после построения; заголовки сравниваются без учета регистра.
 */
public final class HttpRequest {
    public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final String method;
    private final String url;
    private final Map<String, String> headers;
    private final Map<String, String> cookies;
    private final String body;
    private final String contentType;
    private final Optional<TargetParameter> targetParameter;

    private HttpRequest(Builder builder) {
        this.url = Objects.requireNonNull(builder.url, "url cannot be null");
        this.method = Objects.requireNonNull(builder.method, "method cannot be null").toUpperCase(Locale.ROOT);
        TreeMap<String, String> headerCopy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headerCopy.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(headerCopy);
        this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cookies));
        this.body = builder.body;
        this.contentType = builder.contentType;
        this.targetParameter = Optional.ofNullable(builder.targetParameter);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HttpRequest get(String url) {
        return builder().url(url).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .method(method)
            .url(url)
            .headers(headers)
            .cookies(cookies)
            .body(body)
            .contentType(contentType);
        targetParameter.ifPresent(builder::targetParameter);
        return builder;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Map<String, String> getCookies() {
        return cookies;
    }

    public String getBody() {
        return body;
    }

    public String getContentType() {
        return contentType;
    }

    public Optional<TargetParameter> getTargetParameter() {
        return targetParameter;
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }

    /**
     * Returns the lower-cased host of the request URL, or an empty string if the URL has none.
     */
    public String getHost() {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /**
     * Кодирует параметры в формат application/x-www-form-urlencoded с сохранением порядка.
     *
     * @param params параметры формы или строки запроса
     * @return закодированная строка
     */
    public static String encodeForm(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
              .append('=')
              .append(URLEncoder.encode(entry.getValue() != null ? entry.getValue() : "", StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "HttpRequest{" + method + " " + url +
               (hasBody() ? ", bodyLength=" + body.length() : "") + "}";
    }

    public static class Builder {
        private String method = "GET";
        private String url;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private String body;
        private String contentType;
        private TargetParameter targetParameter;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder cookies(Map<String, String> cookies) {
            if (cookies != null) {
                this.cookies.putAll(cookies);
            }
            return this;
        }

        public Builder cookie(String name, String value) {
            this.cookies.put(name, value);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        /**
         * Sets a form-encoded body and the matching content type.
         */
        public Builder formBody(Map<String, String> fields) {
            this.body = encodeForm(fields);
            this.contentType = FORM_CONTENT_TYPE;
            return this;
        }

        public Builder targetParameter(TargetParameter targetParameter) {
            this.targetParameter = targetParameter;
            return this;
        }

        public HttpRequest build() {
            return new HttpRequest(this);
        }
    }
}
