package webscan.http;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.*;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Единая точка отправки HTTP запросов сканера.
 *
 * <p>Все компоненты (краулер, стратегии обнаружения) отправляют запросы только через
 * этот класс. Он отвечает за:
 * <ul>
 *   <li>ограничение частоты и параллелизма ({@link RateLimiter})</li>
 *   <li>повторы транзиентных ошибок с экспоненциальной задержкой ({@link RetryPolicy})</li>
 *   <li>ручную обработку редиректов и повторную аутентификацию ({@link ReauthHandler})</li>
 *   <li>слияние cookies сессии ({@link SessionState})</li>
 *   <li>бюджет запросов и отмену сканирования ({@link ExecutionControl})</li>
 *   <li>фильтр целевых хостов: запрос к запрещенному хосту, в том числе по
 *       редиректу, не отправляется и возвращается как {@link RequestOutcome.Kind#REJECTED}</li>
 * </ul>
 *
 * <p>Ответы 4xx/5xx возвращаются как {@link RequestOutcome.Kind#OK} и не повторяются.
 */
public final class RequestExecutor {
    private static final Logger logger = Logger.getLogger(RequestExecutor.class.getName());
    private static final int MAX_REDIRECTS = 5;

    private final HttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final SessionState session;
    private final ExecutionControl control;
    private final ReauthHandler reauthHandler;
    private final Sleeper sleeper;
    private final Duration defaultTimeout;
    private final boolean followRedirects;
    private final Map<String, String> defaultHeaders;
    private final Predicate<String> targetFilter;

    private RequestExecutor(Builder builder) {
        this.httpClient = Objects.requireNonNull(builder.httpClient, "httpClient cannot be null");
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.system();
        this.rateLimiter = builder.rateLimiter != null
            ? builder.rateLimiter
            : new RateLimiter(RateLimiterConfig.defaultConfig(), sleeper, System::nanoTime);
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaultPolicy();
        this.session = builder.session != null ? builder.session : new SessionState();
        this.control = builder.control != null ? builder.control : ExecutionControl.unlimited();
        this.reauthHandler = builder.reauthHandler;
        this.defaultTimeout = builder.defaultTimeout != null ? builder.defaultTimeout : Duration.ofSeconds(30);
        this.followRedirects = builder.followRedirects;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
        this.targetFilter = builder.targetFilter != null ? builder.targetFilter : url -> true;
    }

    public static Builder builder(HttpClient httpClient) {
        return new Builder(httpClient);
    }

    public RequestOutcome send(HttpRequest request) {
        return send(request, null);
    }

    /**
     * Отправляет запрос с учетом лимитов, повторов и сессии.
     *
     * @param request запрос
     * @param timeoutOverride таймаут для этого запроса или null для таймаута по умолчанию
     * @return результат: ответ либо причина, по которой его нет
     */
    public RequestOutcome send(HttpRequest request, Duration timeoutOverride) {
        Objects.requireNonNull(request, "request cannot be null");
        Duration timeout = timeoutOverride != null ? timeoutOverride : defaultTimeout;

        RequestOutcome outcome = sendWithRetry(request, timeout);

        if (outcome.isOk() && reauthHandler != null
                && reauthHandler.isLoginRedirect(request, outcome.getResponse().get())) {
            logger.info("Session expired for " + request.getHost() + ", re-authenticating");
            if (reauthHandler.reauthenticate(httpClient, session)) {
                outcome = sendWithRetry(request, timeout);
            } else {
                logger.warning("Re-authentication failed for " + request.getHost());
            }
        }

        if (followRedirects) {
            outcome = followRedirectChain(request, outcome, timeout);
        }
        return outcome;
    }

    public SessionState getSession() {
        return session;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public ExecutionControl getControl() {
        return control;
    }

    private RequestOutcome sendWithRetry(HttpRequest request, Duration timeout) {
        if (!targetFilter.test(request.getUrl())) {
            logger.fine("Refusing request to filtered host: " + request);
            return RequestOutcome.rejected();
        }
        if (!control.tryAcquire()) {
            return RequestOutcome.cancelled();
        }

        RequestOutcome lastFailure = RequestOutcome.cancelled();
        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            if (control.isCancelled()) {
                return RequestOutcome.cancelled();
            }

            HttpRequest prepared = withSession(request);
            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RequestOutcome.cancelled();
            }

            Duration latency = null;
            try {
                HttpResponse response = httpClient.execute(prepared, timeout);
                latency = response.getElapsed();
                session.mergeSetCookieHeaders(response.getHeaderValues("Set-Cookie"));
                return RequestOutcome.ok(response, attempt);
            } catch (SocketTimeoutException e) {
                lastFailure = RequestOutcome.timeout(e, attempt);
                logger.fine("Timeout on attempt " + attempt + " for " + request);
            } catch (InterruptedIOException e) {
                Thread.currentThread().interrupt();
                return RequestOutcome.cancelled();
            } catch (IOException e) {
                lastFailure = RequestOutcome.networkError(e, attempt);
                logger.fine("Network error on attempt " + attempt + " for " + request + ": " + e.getMessage());
            } finally {
                rateLimiter.release(latency);
            }

            if (retryPolicy.shouldRetry(attempt)) {
                try {
                    sleeper.sleep(retryPolicy.backoffAfter(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return RequestOutcome.cancelled();
                }
            }
        }

        Exception error = lastFailure.getError().orElse(null);
        logger.log(Level.WARNING, "Request failed after " + retryPolicy.getMaxAttempts() +
            " attempt(s): " + request + " (" + lastFailure.getKind() + ")", error);
        return lastFailure;
    }

    private RequestOutcome followRedirectChain(HttpRequest original, RequestOutcome outcome, Duration timeout) {
        HttpRequest current = original;
        RequestOutcome result = outcome;
        for (int hop = 0; hop < MAX_REDIRECTS && result.isOk(); hop++) {
            HttpResponse response = result.getResponse().get();
            Optional<String> location = response.getLocation();
            if (location.isEmpty()) {
                return result;
            }

            String target;
            try {
                target = URI.create(current.getUrl()).resolve(location.get().trim()).toString();
            } catch (IllegalArgumentException e) {
                logger.fine("Ignoring malformed redirect location: " + location.get());
                return result;
            }

            int status = response.getStatusCode();
            boolean keepMethod = status == 307 || status == 308;
            HttpRequest.Builder next = HttpRequest.builder()
                .url(target)
                .headers(current.getHeaders())
                .method(keepMethod ? current.getMethod() : "GET");
            if (keepMethod) {
                next.body(current.getBody()).contentType(current.getContentType());
            }
            current = next.build();
            result = sendWithRetry(current, timeout);
        }
        return result;
    }

    private HttpRequest withSession(HttpRequest request) {
        Map<String, String> cookies = new LinkedHashMap<>(session.getCookies());
        cookies.putAll(request.getCookies());

        HttpRequest.Builder builder = HttpRequest.builder()
            .method(request.getMethod())
            .url(request.getUrl())
            .headers(defaultHeaders)
            .headers(request.getHeaders())
            .cookies(cookies)
            .body(request.getBody())
            .contentType(request.getContentType());
        request.getTargetParameter().ifPresent(builder::targetParameter);
        return builder.build();
    }

    public static class Builder {
        private final HttpClient httpClient;
        private RateLimiter rateLimiter;
        private RetryPolicy retryPolicy;
        private SessionState session;
        private ExecutionControl control;
        private ReauthHandler reauthHandler;
        private Sleeper sleeper;
        private Duration defaultTimeout;
        private boolean followRedirects;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private Predicate<String> targetFilter;

        private Builder(HttpClient httpClient) {
            this.httpClient = httpClient;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder session(SessionState session) {
            this.session = session;
            return this;
        }

        public Builder control(ExecutionControl control) {
            this.control = control;
            return this;
        }

        public Builder reauthHandler(ReauthHandler reauthHandler) {
            this.reauthHandler = reauthHandler;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder defaultHeaders(Map<String, String> headers) {
            if (headers != null) {
                this.defaultHeaders.putAll(headers);
            }
            return this;
        }

        /**
         * @param targetFilter returns false for URLs whose host must never be contacted
         */
        public Builder targetFilter(Predicate<String> targetFilter) {
            this.targetFilter = targetFilter;
            return this;
        }

        public RequestExecutor build() {
            return new RequestExecutor(this);
        }
    }
}
