package webscan.scanner;

import webscan.detection.DetectionResult;
import webscan.http.HttpRequest;
import webscan.http.HttpResponse;
import webscan.http.RequestExecutor;
import webscan.http.RequestOutcome;
import webscan.model.DetectionStrategy;
import webscan.model.ExchangeSnapshot;
import webscan.model.Finding;
import webscan.model.Severity;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Общая часть плагинов между setup и cleanup: исполнитель запросов плагина,
 * учет первого совпадения по (точка внедрения, стратегия) и сборка {@link Finding}.
 *
 * <p>Неудачный запрос (таймаут, сетевая ошибка, отмена) означает «нет данных»,
 * а не «не уязвимо»: такой probe просто пропускается.
 */
public final class ProbeSession {
    private static final Logger logger = Logger.getLogger(ProbeSession.class.getName());

    private final String pluginName;
    private final RequestExecutor executor;
    private final ScanContext context;
    private final Set<String> resolved = ConcurrentHashMap.newKeySet();

    public ProbeSession(String pluginName, RequestExecutor executor, ScanContext context) {
        this.pluginName = pluginName;
        this.executor = executor;
        this.context = context;
    }

    public Optional<HttpResponse> fetch(HttpRequest request) {
        return fetch(request, null);
    }

    /**
     * @return the response, or empty if the request was inconclusive
     */
    public Optional<HttpResponse> fetch(HttpRequest request, Duration timeoutOverride) {
        RequestOutcome outcome = executor.send(request, timeoutOverride);
        if (outcome.isInconclusive()) {
            logger.fine(pluginName + ": inconclusive probe " + request + " (" + outcome + ")");
        }
        return outcome.getResponse();
    }

    /**
     * Whether a finding was already emitted for this point and strategy; remaining
     * payloads of the strategy are then skipped.
     */
    public boolean isResolved(InjectionPoint point, DetectionStrategy strategy) {
        return resolved.contains(resolutionKey(point, strategy));
    }

    /**
     * Claims the (point, strategy) pair. Only the first claim succeeds.
     */
    public boolean resolve(InjectionPoint point, DetectionStrategy strategy) {
        return resolved.add(resolutionKey(point, strategy));
    }

    private static String resolutionKey(InjectionPoint point, DetectionStrategy strategy) {
        return point.key() + " " + strategy.getTag();
    }

    public boolean isCancelled() {
        return context.isCancelled();
    }

    public Finding toFinding(InjectionPoint point, String payload, DetectionResult result,
                             HttpRequest request, HttpResponse response, Severity risk) {
        DetectionStrategy strategy = result.getStrategy();
        Finding.Builder builder = Finding.builder()
            .title(titleFor(strategy))
            .description(titleFor(strategy) + " detected in " + point.getLocation().name().toLowerCase(Locale.ROOT)
                + " parameter '" + point.getName() + "' of " + point.getEndpoint())
            .strategy(strategy)
            .risk(risk)
            .confidence(result.getConfidence())
            .endpoint(point.getEndpoint())
            .parameter(point.getName())
            .parameterLocation(point.getLocation())
            .method(request.getMethod())
            .payload(payload)
            .evidence(result.getEvidence())
            .remediation(Remediation.forStrategy(strategy));
        if (response != null) {
            builder.exchange(new ExchangeSnapshot(
                request.getMethod(),
                request.getUrl(),
                request.getBody(),
                response.getStatusCode(),
                response.getContentLength(),
                response.getElapsed().toMillis(),
                ExchangeSnapshot.excerpt(response.getBody())));
        }
        Finding finding = builder.build();
        logger.info(pluginName + ": " + finding.getTitle() + " in '" + point.getName() + "' at "
                    + point.getEndpoint() + " (confidence " + String.format("%.2f", finding.getConfidence()) + ")");
        return finding;
    }

    static String titleFor(DetectionStrategy strategy) {
        return switch (strategy) {
            case ERROR -> "Error-based SQL Injection";
            case BOOLEAN -> "Boolean-based Blind SQL Injection";
            case UNION -> "Union-based SQL Injection";
            case TIME -> "Time-based Blind SQL Injection";
            case REFLECTED -> "Reflected Cross-Site Scripting";
            case DOM -> "DOM-based Cross-Site Scripting";
            case STORED -> "Stored Cross-Site Scripting";
            case FILE_DISCLOSURE -> "Path Traversal";
        };
    }

    public RequestExecutor getExecutor() {
        return executor;
    }

    public ScanContext getContext() {
        return context;
    }

    public String getPluginName() {
        return pluginName;
    }
}
