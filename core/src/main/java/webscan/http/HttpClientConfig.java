package webscan.http;

import java.time.Duration;
import java.util.*;

/**
 * Configuration for {@link StandardHttpClient}.
 */
public final class HttpClientConfig {
    public static final String DEFAULT_USER_AGENT = "WebScan/1.0 (Security Testing)";
    public static final int DEFAULT_MAX_RESPONSE_BYTES = 5 * 1024 * 1024;

    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final boolean verifySsl;
    private final String userAgent;
    private final Map<String, String> defaultHeaders;
    private final int maxResponseBytes;

    private HttpClientConfig(Builder builder) {
        this.connectTimeout = builder.connectTimeout != null
            ? builder.connectTimeout
            : Duration.ofSeconds(30);
        this.readTimeout = builder.readTimeout != null
            ? builder.readTimeout
            : Duration.ofSeconds(30);
        this.verifySsl = builder.verifySsl;
        this.userAgent = builder.userAgent != null ? builder.userAgent : DEFAULT_USER_AGENT;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
        if (builder.maxResponseBytes <= 0) {
            throw new IllegalArgumentException("maxResponseBytes must be positive");
        }
        this.maxResponseBytes = builder.maxResponseBytes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HttpClientConfig defaultConfig() {
        return builder().build();
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public boolean isVerifySsl() {
        return verifySsl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    /**
     * Response bodies are truncated to this many bytes.
     */
    public int getMaxResponseBytes() {
        return maxResponseBytes;
    }

    public static class Builder {
        private Duration connectTimeout;
        private Duration readTimeout;
        private boolean verifySsl = true;
        private String userAgent;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private int maxResponseBytes = DEFAULT_MAX_RESPONSE_BYTES;

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder verifySsl(boolean verifySsl) {
            this.verifySsl = verifySsl;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder defaultHeaders(Map<String, String> headers) {
            if (headers != null) {
                this.defaultHeaders.putAll(headers);
            }
            return this;
        }

        public Builder addDefaultHeader(String name, String value) {
            this.defaultHeaders.put(name, value);
            return this;
        }

        public Builder maxResponseBytes(int maxResponseBytes) {
            this.maxResponseBytes = maxResponseBytes;
            return this;
        }

        public HttpClientConfig build() {
            return new HttpClientConfig(this);
        }
    }
}
