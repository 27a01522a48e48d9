package webscan.scanner;

import webscan.auth.FormLoginAuthenticator;
import webscan.crawler.DiscoveredForm;
import webscan.crawler.UrlNormalizer;
import webscan.http.*;
import webscan.model.ScanOptions;
import webscan.model.ScanStatisticsTracker;
import webscan.security.TargetGuard;

import java.util.*;
import java.util.logging.Logger;

/**
 * Контекст одного сканирования, передаваемый плагинам явно.
 *
 * <p>Общие для всего сканирования объекты: параметры, HTTP клиент, контроль
 * отмены и бюджета запросов, статистика и формы, найденные краулером.
 * Состояние лимитера и сессии у каждого плагина свое: его создает
 * {@link #newRequestExecutor()}.
 *
 * <p>Защита от SSRF, если она задана, применяется к каждому запросу исполнителей
 * этого контекста, а не только к исходному URL.
 */
public final class ScanContext {
    private static final Logger logger = Logger.getLogger(ScanContext.class.getName());

    private final String scanId;
    private final String targetUrl;
    private final ScanOptions options;
    private final HttpClient httpClient;
    private final ExecutionControl control;
    private final ScanStatisticsTracker statistics;
    private final Map<String, List<DiscoveredForm>> formsByPage;
    private final Sleeper sleeper;
    private final TargetGuard targetGuard;

    private ScanContext(Builder builder) {
        this.scanId = Objects.requireNonNull(builder.scanId, "scanId cannot be null");
        this.targetUrl = Objects.requireNonNull(builder.targetUrl, "targetUrl cannot be null");
        this.options = builder.options != null ? builder.options : ScanOptions.defaultOptions();
        this.httpClient = Objects.requireNonNull(builder.httpClient, "httpClient cannot be null");
        this.control = builder.control != null ? builder.control : new ExecutionControl(options.getMaxRequests());
        this.statistics = builder.statistics != null ? builder.statistics : new ScanStatisticsTracker(scanId);
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.system();
        this.targetGuard = builder.targetGuard;

        Map<String, List<DiscoveredForm>> byPage = new LinkedHashMap<>();
        for (DiscoveredForm form : builder.forms) {
            byPage.computeIfAbsent(pageKey(form.getPageUrl()), k -> new ArrayList<>()).add(form);
        }
        byPage.replaceAll((page, forms) -> List.copyOf(forms));
        this.formsByPage = Collections.unmodifiableMap(byPage);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Создает исполнитель запросов с собственными лимитером и сессией.
     * Если заданы учетные данные, сессия сразу проходит вход через форму.
     */
    public RequestExecutor newRequestExecutor() {
        SessionState session = new SessionState(options.getCookies());
        RequestExecutor.Builder builder = RequestExecutor.builder(httpClient)
            .rateLimiter(new RateLimiter(options.toRateLimiterConfig(), sleeper, System::nanoTime))
            .retryPolicy(options.getRetryPolicy())
            .session(session)
            .control(control)
            .sleeper(sleeper)
            .defaultTimeout(options.getRequestTimeout())
            .followRedirects(options.isFollowRedirects())
            .defaultHeaders(options.getHeaders())
            .targetFilter(this::permits);

        options.getCredentials().ifPresent(credentials -> {
            FormLoginAuthenticator authenticator = new FormLoginAuthenticator(credentials);
            builder.reauthHandler(authenticator);
            if (!authenticator.reauthenticate(httpClient, session)) {
                logger.warning("Initial login failed for " + credentials.getLoginUrl() +
                               ", continuing unauthenticated");
            }
        });
        return builder.build();
    }

    /**
     * @return false if the scan's target guard refuses the URL's host
     */
    public boolean permits(String url) {
        return targetGuard == null || targetGuard.permits(url);
    }

    public List<DiscoveredForm> getFormsOnPage(String pageUrl) {
        return formsByPage.getOrDefault(pageKey(pageUrl), List.of());
    }

    public List<DiscoveredForm> getAllForms() {
        List<DiscoveredForm> all = new ArrayList<>();
        formsByPage.values().forEach(all::addAll);
        return all;
    }

    private static String pageKey(String url) {
        try {
            return UrlNormalizer.normalize(url);
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    public boolean isCancelled() {
        return control.isCancelled();
    }

    public String getScanId() {
        return scanId;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public ScanOptions getOptions() {
        return options;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public ExecutionControl getControl() {
        return control;
    }

    public ScanStatisticsTracker getStatistics() {
        return statistics;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public static class Builder {
        private String scanId;
        private String targetUrl;
        private ScanOptions options;
        private HttpClient httpClient;
        private ExecutionControl control;
        private ScanStatisticsTracker statistics;
        private final List<DiscoveredForm> forms = new ArrayList<>();
        private Sleeper sleeper;
        private TargetGuard targetGuard;

        public Builder scanId(String scanId) {
            this.scanId = scanId;
            return this;
        }

        public Builder targetUrl(String targetUrl) {
            this.targetUrl = targetUrl;
            return this;
        }

        public Builder options(ScanOptions options) {
            this.options = options;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder control(ExecutionControl control) {
            this.control = control;
            return this;
        }

        public Builder statistics(ScanStatisticsTracker statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder forms(Collection<DiscoveredForm> forms) {
            this.forms.addAll(forms);
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder targetGuard(TargetGuard targetGuard) {
            this.targetGuard = targetGuard;
            return this;
        }

        public ScanContext build() {
            return new ScanContext(this);
        }
    }
}
