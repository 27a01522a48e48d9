package webscan.model;

import webscan.ScanConfigurationException;
import webscan.auth.LoginCredentials;
import webscan.crawler.CrawlOptions;
import webscan.crawler.ScopePolicy;
import webscan.http.HttpClientConfig;
import webscan.http.RateLimiterConfig;
import webscan.http.RetryPolicy;

import java.time.Duration;
import java.util.*;

/**
 * Параметры одного сканирования. Передаются при старте и не меняются
 * во время работы.
 *
 * <p>Значения по умолчанию:
 * <ul>
 *   <li>crawl: включен, глубина 3, не более 100 URL, robots.txt соблюдается</li>
 *   <li>запросы: без лимита, задержка 1 с, до 5 одновременно, таймаут 30 с</li>
 *   <li>сканирование целиком: таймаут 30 минут</li>
 *   <li>порог уверенности 0.5; union и reflected/DOM XSS 0.7; stored XSS 0.8</li>
 * </ul>
 *
 * <p>Недопустимые значения отклоняются при сборке через {@link ScanConfigurationException}.
 */
public final class ScanOptions {
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;
    public static final double DEFAULT_UNION_THRESHOLD = 0.7;
    public static final double DEFAULT_REFLECTED_XSS_THRESHOLD = 0.7;
    public static final double DEFAULT_DOM_XSS_THRESHOLD = 0.7;
    public static final double DEFAULT_STORED_XSS_THRESHOLD = 0.8;

    private final boolean crawlEnabled;
    private final int maxDepth;
    private final int maxUrls;
    private final boolean followRobots;
    private final ScopePolicy scopePolicy;
    private final long maxRequests;
    private final Duration requestDelay;
    private final int concurrency;
    private final int cooldownThreshold;
    private final Duration cooldownTime;
    private final Duration requestTimeout;
    private final Duration scanTimeout;
    private final RetryPolicy retryPolicy;
    private final boolean followRedirects;
    private final boolean verifyTls;
    private final String userAgent;
    private final Map<String, String> cookies;
    private final Map<String, String> headers;
    private final LoginCredentials credentials;
    private final double confidenceThreshold;
    private final double unionThreshold;
    private final double reflectedXssThreshold;
    private final double domXssThreshold;
    private final double storedXssThreshold;
    private final Duration timeBaseDelay;
    private final int maxUnionColumns;
    private final boolean wafBypass;
    private final boolean aggressiveTimePayloads;
    private final boolean allowPrivateTargets;
    private final Set<String> allowedHosts;
    private final Set<String> deniedHosts;

    private ScanOptions(Builder builder) {
        this.crawlEnabled = builder.crawlEnabled;
        this.maxDepth = requireAtLeast(builder.maxDepth, 0, "maxDepth");
        this.maxUrls = requireAtLeast(builder.maxUrls, 1, "maxUrls");
        this.followRobots = builder.followRobots;
        this.scopePolicy = builder.scopePolicy != null ? builder.scopePolicy : ScopePolicy.REGISTRABLE_DOMAIN;
        this.maxRequests = builder.maxRequests;
        this.requestDelay = requireNonNegative(builder.requestDelay, "requestDelay");
        this.concurrency = requireAtLeast(builder.concurrency, 1, "concurrency");
        this.cooldownThreshold = requireAtLeast(builder.cooldownThreshold, 1, "cooldownThreshold");
        this.cooldownTime = requireNonNegative(builder.cooldownTime, "cooldownTime");
        this.requestTimeout = requirePositive(builder.requestTimeout, "requestTimeout");
        this.scanTimeout = requirePositive(builder.scanTimeout, "scanTimeout");
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaultPolicy();
        this.followRedirects = builder.followRedirects;
        this.verifyTls = builder.verifyTls;
        this.userAgent = builder.userAgent != null ? builder.userAgent : HttpClientConfig.DEFAULT_USER_AGENT;
        this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cookies));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.credentials = builder.credentials;
        this.confidenceThreshold = requireThreshold(builder.confidenceThreshold, "confidenceThreshold");
        this.unionThreshold = requireThreshold(builder.unionThreshold, "unionThreshold");
        this.reflectedXssThreshold = requireThreshold(builder.reflectedXssThreshold, "reflectedXssThreshold");
        this.domXssThreshold = requireThreshold(builder.domXssThreshold, "domXssThreshold");
        this.storedXssThreshold = requireThreshold(builder.storedXssThreshold, "storedXssThreshold");
        this.timeBaseDelay = requireWholeSeconds(builder.timeBaseDelay, "timeBaseDelay");
        this.maxUnionColumns = requireAtLeast(builder.maxUnionColumns, 1, "maxUnionColumns");
        this.wafBypass = builder.wafBypass;
        this.aggressiveTimePayloads = builder.aggressiveTimePayloads;
        this.allowPrivateTargets = builder.allowPrivateTargets;
        this.allowedHosts = Collections.unmodifiableSet(new LinkedHashSet<>(builder.allowedHosts));
        this.deniedHosts = Collections.unmodifiableSet(new LinkedHashSet<>(builder.deniedHosts));
    }

    private static int requireAtLeast(int value, int min, String name) {
        if (value < min) {
            throw new ScanConfigurationException(name + " must be at least " + min + ", got " + value);
        }
        return value;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isNegative()) {
            throw new ScanConfigurationException(name + " cannot be negative");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isNegative() || value.isZero()) {
            throw new ScanConfigurationException(name + " must be positive");
        }
        return value;
    }

    /**
     * SQL sleep payloads take whole seconds, so the delay the detector expects must be one too.
     */
    private static Duration requireWholeSeconds(Duration value, String name) {
        requirePositive(value, name);
        if (value.toSeconds() < 1 || value.toNanosPart() != 0) {
            throw new ScanConfigurationException(name + " must be a whole number of seconds, got " + value);
        }
        return value;
    }

    private static double requireThreshold(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ScanConfigurationException(name + " must be within [0, 1], got " + value);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ScanOptions defaultOptions() {
        return builder().build();
    }

    public CrawlOptions toCrawlOptions() {
        return CrawlOptions.builder()
            .maxDepth(maxDepth)
            .maxUrls(maxUrls)
            .followRobots(followRobots)
            .parallelism(concurrency)
            .scopePolicy(scopePolicy)
            .build();
    }

    public RateLimiterConfig toRateLimiterConfig() {
        return RateLimiterConfig.builder()
            .minDelay(requestDelay)
            .maxConcurrent(concurrency)
            .cooldownThreshold(cooldownThreshold)
            .cooldownTime(cooldownTime)
            .build();
    }

    public HttpClientConfig toHttpClientConfig() {
        return HttpClientConfig.builder()
            .connectTimeout(requestTimeout)
            .readTimeout(requestTimeout)
            .verifySsl(verifyTls)
            .userAgent(userAgent)
            .build();
    }

    public boolean isCrawlEnabled() {
        return crawlEnabled;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxUrls() {
        return maxUrls;
    }

    public boolean isFollowRobots() {
        return followRobots;
    }

    public ScopePolicy getScopePolicy() {
        return scopePolicy;
    }

    /**
     * @return total request budget of the scan, zero or less for unlimited
     */
    public long getMaxRequests() {
        return maxRequests;
    }

    public Duration getRequestDelay() {
        return requestDelay;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getCooldownThreshold() {
        return cooldownThreshold;
    }

    public Duration getCooldownTime() {
        return cooldownTime;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getScanTimeout() {
        return scanTimeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public boolean isFollowRedirects() {
        return followRedirects;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Map<String, String> getCookies() {
        return cookies;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Optional<LoginCredentials> getCredentials() {
        return Optional.ofNullable(credentials);
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public double getUnionThreshold() {
        return unionThreshold;
    }

    public double getReflectedXssThreshold() {
        return reflectedXssThreshold;
    }

    public double getDomXssThreshold() {
        return domXssThreshold;
    }

    public double getStoredXssThreshold() {
        return storedXssThreshold;
    }

    /**
     * Threshold a result of the given strategy has to reach. Strategy-specific thresholds
     * never fall below the global one.
     */
    public double thresholdFor(DetectionStrategy strategy) {
        double specific = switch (strategy) {
            case UNION -> unionThreshold;
            case REFLECTED -> reflectedXssThreshold;
            case DOM -> domXssThreshold;
            case STORED -> storedXssThreshold;
            case ERROR, BOOLEAN, TIME, FILE_DISCLOSURE -> confidenceThreshold;
        };
        return Math.max(specific, confidenceThreshold);
    }

    public Duration getTimeBaseDelay() {
        return timeBaseDelay;
    }

    public int getMaxUnionColumns() {
        return maxUnionColumns;
    }

    public boolean isWafBypass() {
        return wafBypass;
    }

    public boolean isAggressiveTimePayloads() {
        return aggressiveTimePayloads;
    }

    public boolean isAllowPrivateTargets() {
        return allowPrivateTargets;
    }

    public Set<String> getAllowedHosts() {
        return allowedHosts;
    }

    public Set<String> getDeniedHosts() {
        return deniedHosts;
    }

    @Override
    public String toString() {
        return "ScanOptions{crawl=" + crawlEnabled + ", maxDepth=" + maxDepth + ", maxUrls=" + maxUrls +
               ", maxRequests=" + maxRequests + ", concurrency=" + concurrency +
               ", threshold=" + confidenceThreshold + ", authenticated=" + (credentials != null) + "}";
    }

    public static class Builder {
        private boolean crawlEnabled = true;
        private int maxDepth = 3;
        private int maxUrls = 100;
        private boolean followRobots = true;
        private ScopePolicy scopePolicy;
        private long maxRequests = 0;
        private Duration requestDelay = Duration.ofSeconds(1);
        private int concurrency = 5;
        private int cooldownThreshold = 50;
        private Duration cooldownTime = Duration.ofSeconds(2);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration scanTimeout = Duration.ofMinutes(30);
        private RetryPolicy retryPolicy;
        private boolean followRedirects = false;
        private boolean verifyTls = true;
        private String userAgent;
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private LoginCredentials credentials;
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private double unionThreshold = DEFAULT_UNION_THRESHOLD;
        private double reflectedXssThreshold = DEFAULT_REFLECTED_XSS_THRESHOLD;
        private double domXssThreshold = DEFAULT_DOM_XSS_THRESHOLD;
        private double storedXssThreshold = DEFAULT_STORED_XSS_THRESHOLD;
        private Duration timeBaseDelay = Duration.ofSeconds(2);
        private int maxUnionColumns = 5;
        private boolean wafBypass = true;
        private boolean aggressiveTimePayloads = true;
        private boolean allowPrivateTargets = false;
        private final Set<String> allowedHosts = new LinkedHashSet<>();
        private final Set<String> deniedHosts = new LinkedHashSet<>();

        public Builder crawlEnabled(boolean crawlEnabled) {
            this.crawlEnabled = crawlEnabled;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
            return this;
        }

        public Builder followRobots(boolean followRobots) {
            this.followRobots = followRobots;
            return this;
        }

        public Builder scopePolicy(ScopePolicy scopePolicy) {
            this.scopePolicy = scopePolicy;
            return this;
        }

        public Builder maxRequests(long maxRequests) {
            this.maxRequests = maxRequests;
            return this;
        }

        public Builder requestDelay(Duration requestDelay) {
            this.requestDelay = requestDelay;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder cooldown(int everyRequests, Duration cooldownTime) {
            this.cooldownThreshold = everyRequests;
            this.cooldownTime = cooldownTime;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder scanTimeout(Duration scanTimeout) {
            this.scanTimeout = scanTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder cookie(String name, String value) {
            this.cookies.put(name, value);
            return this;
        }

        public Builder cookies(Map<String, String> cookies) {
            this.cookies.putAll(cookies);
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder credentials(LoginCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder unionThreshold(double unionThreshold) {
            this.unionThreshold = unionThreshold;
            return this;
        }

        public Builder reflectedXssThreshold(double reflectedXssThreshold) {
            this.reflectedXssThreshold = reflectedXssThreshold;
            return this;
        }

        public Builder domXssThreshold(double domXssThreshold) {
            this.domXssThreshold = domXssThreshold;
            return this;
        }

        public Builder storedXssThreshold(double storedXssThreshold) {
            this.storedXssThreshold = storedXssThreshold;
            return this;
        }

        public Builder timeBaseDelay(Duration timeBaseDelay) {
            this.timeBaseDelay = timeBaseDelay;
            return this;
        }

        public Builder maxUnionColumns(int maxUnionColumns) {
            this.maxUnionColumns = maxUnionColumns;
            return this;
        }

        public Builder wafBypass(boolean wafBypass) {
            this.wafBypass = wafBypass;
            return this;
        }

        public Builder aggressiveTimePayloads(boolean aggressiveTimePayloads) {
            this.aggressiveTimePayloads = aggressiveTimePayloads;
            return this;
        }

        public Builder allowPrivateTargets(boolean allowPrivateTargets) {
            this.allowPrivateTargets = allowPrivateTargets;
            return this;
        }

        public Builder allowedHost(String host) {
            this.allowedHosts.add(host);
            return this;
        }

        public Builder deniedHost(String host) {
            this.deniedHosts.add(host);
            return this;
        }

        public ScanOptions build() {
            return new ScanOptions(this);
        }
    }
}
