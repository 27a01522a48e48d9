package webscan.scanner;

import webscan.crawler.DiscoveredForm;
import webscan.http.HttpRequest;
import webscan.http.TargetParameter;
import webscan.model.ParameterLocation;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Одна точка внедрения: параметр query, поле формы, сегмент пути или фрагмент URL.
 *
 * <p>Точка умеет построить запрос, в котором ее значение заменено нагрузкой,
 * сохраняя остальные параметры исходного запроса.
 */
public final class InjectionPoint {
    private final String url;
    private final String method;
    private final String name;
    private final ParameterLocation location;
    private final String originalValue;
    private final Map<String, String> parameters;
    private final int pathSegmentIndex;
    private final DiscoveredForm form;

    private InjectionPoint(Builder builder) {
        this.url = Objects.requireNonNull(builder.url, "url cannot be null");
        this.method = builder.method != null ? builder.method.toUpperCase(Locale.ROOT) : "GET";
        this.name = Objects.requireNonNull(builder.name, "name cannot be null");
        this.location = Objects.requireNonNull(builder.location, "location cannot be null");
        this.originalValue = builder.originalValue != null ? builder.originalValue : "";
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.pathSegmentIndex = builder.pathSegmentIndex;
        this.form = builder.form;
        if (location == ParameterLocation.PATH && pathSegmentIndex < 0) {
            throw new IllegalArgumentException("PATH injection point requires a segment index");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return URL the request is sent to, for FORM points the form action
     */
    public String getUrl() {
        return url;
    }

    /**
     * @return URL without query and fragment, used as the finding endpoint
     */
    public String getEndpoint() {
        String base = stripQuery(url);
        return base.isEmpty() ? url : base;
    }

    public String getMethod() {
        return method;
    }

    public String getName() {
        return name;
    }

    public ParameterLocation getLocation() {
        return location;
    }

    public String getOriginalValue() {
        return originalValue;
    }

    /**
     * @return every parameter sent along with the injected one, including its original value
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    public Optional<DiscoveredForm> getForm() {
        return Optional.ofNullable(form);
    }

    public String key() {
        return method + " " + getEndpoint() + " " + location + ":" + name;
    }

    /**
     * The request with the original value, used as baseline.
     */
    public HttpRequest baselineRequest() {
        return request(originalValue);
    }

    /**
     * Builds a request carrying {@code value}, URL-encoded as needed.
     */
    public HttpRequest request(String value) {
        return build(value, false);
    }

    /**
     * Builds a request carrying {@code value} exactly as given, without further encoding.
     * Used for pre-encoded filter-evasion variants.
     */
    public HttpRequest rawRequest(String value) {
        return build(value, true);
    }

    private HttpRequest build(String value, boolean raw) {
        TargetParameter target = new TargetParameter(name, location);
        return switch (location) {
            case QUERY -> HttpRequest.builder()
                .method(method)
                .url(stripQuery(url) + "?" + encodeWith(parameters, name, value, raw))
                .targetParameter(target)
                .build();
            case FORM -> formRequest(value, raw, target);
            case PATH -> HttpRequest.builder()
                .method(method)
                .url(replacePathSegment(value, raw))
                .targetParameter(target)
                .build();
            case FRAGMENT -> HttpRequest.builder()
                .method("GET")
                .url(stripFragment(url) + "#" + value)
                .targetParameter(target)
                .build();
        };
    }

    private HttpRequest formRequest(String value, boolean raw, TargetParameter target) {
        String encoded = encodeWith(parameters, name, value, raw);
        if ("GET".equals(method)) {
            return HttpRequest.builder()
                .url(stripQuery(url) + "?" + encoded)
                .targetParameter(target)
                .build();
        }
        return HttpRequest.builder()
            .method(method)
            .url(url)
            .body(encoded)
            .contentType(HttpRequest.FORM_CONTENT_TYPE)
            .targetParameter(target)
            .build();
    }

    private String replacePathSegment(String value, boolean raw) {
        URI uri = URI.create(url);
        String[] segments = uri.getRawPath().split("/", -1);
        segments[pathSegmentIndex] = raw ? value : encodePathSegment(value);
        StringBuilder sb = new StringBuilder();
        sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority()).append(String.join("/", segments));
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        return sb.toString();
    }

    static String encodeWith(Map<String, String> parameters, String name, String value, boolean raw) {
        String injected = encode(name) + "=" + (raw ? value : encode(value));
        if (parameters.containsKey(name)) {
            // keep the injected parameter at its original position
            StringBuilder sb = new StringBuilder();
            for (Map.Entry<String, String> entry : parameters.entrySet()) {
                if (sb.length() > 0) {
                    sb.append('&');
                }
                if (entry.getKey().equals(name)) {
                    sb.append(injected);
                } else {
                    sb.append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
                }
            }
            return sb.toString();
        }
        String encodedOthers = HttpRequest.encodeForm(parameters);
        return encodedOthers.isEmpty() ? injected : encodedOthers + "&" + injected;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8);
    }

    private static String encodePathSegment(String value) {
        return encode(value).replace("+", "%20");
    }

    /**
     * Decodes a raw query string into an ordered map. Repeated names keep the last value.
     */
    public static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] parts = pair.split("=", 2);
            String key = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
            String value = parts.length > 1 ? URLDecoder.decode(parts[1], StandardCharsets.UTF_8) : "";
            params.put(key, value);
        }
        return params;
    }

    private static String stripQuery(String url) {
        String withoutFragment = stripFragment(url);
        int q = withoutFragment.indexOf('?');
        return q >= 0 ? withoutFragment.substring(0, q) : withoutFragment;
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    @Override
    public String toString() {
        return "InjectionPoint{" + key() + "}";
    }

    public static class Builder {
        private String url;
        private String method;
        private String name;
        private ParameterLocation location;
        private String originalValue;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private int pathSegmentIndex = -1;
        private DiscoveredForm form;

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder location(ParameterLocation location) {
            this.location = location;
            return this;
        }

        public Builder originalValue(String originalValue) {
            this.originalValue = originalValue;
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters.putAll(parameters);
            return this;
        }

        public Builder pathSegmentIndex(int pathSegmentIndex) {
            this.pathSegmentIndex = pathSegmentIndex;
            return this;
        }

        public Builder form(DiscoveredForm form) {
            this.form = form;
            return this;
        }

        public InjectionPoint build() {
            return new InjectionPoint(this);
        }
    }
}
