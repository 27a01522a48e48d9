package webscan.scanner.sqlinjection;

import webscan.detection.*;
import webscan.http.HttpRequest;
import webscan.http.HttpResponse;
import webscan.model.*;
import webscan.payload.Payload;
import webscan.payload.PayloadCatalog;
import webscan.payload.PayloadEncoder;
import webscan.payload.SqlInjectionPayloads;
import webscan.scanner.*;

import java.time.Duration;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Сканер SQL инъекций.
 *
 * <p>Для каждой точки внедрения сначала снимается baseline, затем по очереди
 * проверяются стратегии:
 * <ul>
 *   <li>error-based, с вариантом двойного URL-кодирования для обхода фильтров</li>
 *   <li>boolean-based blind по отношению длин ответов</li>
 *   <li>union-based по метаданным СУБД</li>
 *   <li>time-based blind с тремя замерами baseline и повторной проверкой;
 *       выполняется, только если остальные стратегии ничего не нашли</li>
 * </ul>
 *
 * <p>Первая нагрузка, давшая результат выше порога, закрывает стратегию для точки.
 */
public final class SqlInjectionPlugin implements ScannerPlugin {
    private static final Logger logger = Logger.getLogger(SqlInjectionPlugin.class.getName());

    public static final String NAME = "sql_injection";

    private final InjectionPointExtractor extractor = new InjectionPointExtractor();
    private final ErrorBasedDetector errorDetector;
    private final BooleanBasedDetector booleanDetector = new BooleanBasedDetector();
    private final UnionBasedDetector unionDetector = new UnionBasedDetector();

    private volatile ProbeSession session;
    private volatile ScanOptions options;
    private volatile PayloadCatalog catalog;
    private volatile TimeBasedDetector timeDetector;

    public SqlInjectionPlugin() {
        this(new ErrorBasedDetector());
    }

    SqlInjectionPlugin(ErrorBasedDetector errorDetector) {
        this.errorDetector = errorDetector;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Detects error-based, boolean-based, union-based and time-based blind SQL injection";
    }

    @Override
    public VulnerabilityClass getVulnerabilityClass() {
        return VulnerabilityClass.SQL_INJECTION;
    }

    @Override
    public synchronized void setup(ScanContext context) {
        if (session != null) {
            return;
        }
        this.options = context.getOptions();
        // payloads and threshold must agree on the injected delay
        int delaySeconds = (int) Math.max(1, options.getTimeBaseDelay().toSeconds());
        this.catalog = SqlInjectionPayloads.catalog(options.getMaxUnionColumns(), delaySeconds);
        this.timeDetector = new TimeBasedDetector(Duration.ofSeconds(delaySeconds));
        this.session = new ProbeSession(NAME, context.newRequestExecutor(), context);
        logger.fine(NAME + " ready with " + catalog.size() + " payloads");
    }

    @Override
    public List<Finding> scan(String url) {
        ProbeSession current = session;
        if (current == null) {
            throw new IllegalStateException("setup() must be called before scan()");
        }

        List<InjectionPoint> points = extractor.extract(url, current.getContext().getFormsOnPage(url));
        List<Finding> findings = new ArrayList<>();
        for (InjectionPoint point : points) {
            if (current.isCancelled()) {
                break;
            }
            point.getForm().ifPresent(form -> current.getContext().getStatistics().formTested(form.signature()));
            try {
                findings.addAll(scanPoint(current, point));
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": testing " + point + " failed", e);
            }
        }
        return findings;
    }

    private List<Finding> scanPoint(ProbeSession current, InjectionPoint point) {
        HttpRequest baselineRequest = point.baselineRequest();
        Optional<HttpResponse> baseline = current.fetch(baselineRequest);
        if (baseline.isEmpty()) {
            logger.fine(NAME + ": no baseline for " + point + ", skipping");
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        testErrorBased(current, point, baseline.get()).ifPresent(findings::add);
        testBooleanBased(current, point, baseline.get()).ifPresent(findings::add);
        testWithDetector(current, point, baseline.get(), DetectionStrategy.UNION, unionDetector)
            .ifPresent(findings::add);
        if (findings.isEmpty()) {
            testTimeBased(current, point).ifPresent(findings::add);
        }
        return findings;
    }

    private Optional<Finding> testErrorBased(ProbeSession current, InjectionPoint point, HttpResponse baseline) {
        double threshold = options.thresholdFor(DetectionStrategy.ERROR);
        for (Payload payload : catalog.standard(DetectionStrategy.ERROR)) {
            if (current.isCancelled() || current.isResolved(point, DetectionStrategy.ERROR)) {
                break;
            }
            try {
                Optional<Finding> finding = probe(current, point, baseline, payload.getValue(),
                    point.request(payload.getValue()), errorDetector, threshold, payload.getRisk());
                if (finding.isEmpty() && options.isWafBypass()) {
                    String encoded = PayloadEncoder.doubleUrlEncode(payload.getValue());
                    if (!encoded.equals(payload.getValue())) {
                        finding = probe(current, point, baseline, encoded,
                            point.rawRequest(encoded), errorDetector, threshold, payload.getRisk());
                    }
                }
                if (finding.isPresent()) {
                    return finding;
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": payload '" + payload.getName() + "' failed on " + point, e);
            }
        }
        return Optional.empty();
    }

    private Optional<Finding> testWithDetector(ProbeSession current, InjectionPoint point, HttpResponse baseline,
                                               DetectionStrategy strategy, ResponseComparisonDetector detector) {
        double threshold = options.thresholdFor(strategy);
        for (Payload payload : catalog.standard(strategy)) {
            if (current.isCancelled() || current.isResolved(point, strategy)) {
                break;
            }
            try {
                Optional<Finding> finding = probe(current, point, baseline, payload.getValue(),
                    point.request(payload.getValue()), detector, threshold, payload.getRisk());
                if (finding.isPresent()) {
                    return finding;
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": payload '" + payload.getName() + "' failed on " + point, e);
            }
        }
        return Optional.empty();
    }

    private Optional<Finding> testBooleanBased(ProbeSession current, InjectionPoint point, HttpResponse baseline) {
        double threshold = options.thresholdFor(DetectionStrategy.BOOLEAN);
        for (Payload payload : catalog.standard(DetectionStrategy.BOOLEAN)) {
            if (current.isCancelled() || current.isResolved(point, DetectionStrategy.BOOLEAN)) {
                break;
            }
            try {
                HttpRequest request = point.request(payload.getValue());
                Optional<HttpResponse> response = current.fetch(request);
                if (response.isEmpty()) {
                    continue;
                }
                DetectionResult result = booleanDetector.analyze(baseline, response.get(), payload.getValue());
                if (!result.meets(threshold)) {
                    continue;
                }
                if (BooleanCondition.classify(payload.getValue()) == BooleanCondition.AND_TRUE) {
                    Optional<DetectionResult> confirmed = confirmAndTrue(current, point, baseline, payload, result);
                    if (confirmed.isEmpty()) {
                        continue;
                    }
                    result = confirmed.get();
                }
                if (current.resolve(point, DetectionStrategy.BOOLEAN)) {
                    return Optional.of(current.toFinding(
                        point, payload.getValue(), result, request, response.get(), payload.getRisk()));
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": payload '" + payload.getName() + "' failed on " + point, e);
            }
        }
        return Optional.empty();
    }

    /**
     * A page that ignores the parameter also looks unchanged under an AND-true payload,
     * so the false counterpart has to change the page before the result counts.
     */
    private Optional<DetectionResult> confirmAndTrue(ProbeSession current, InjectionPoint point, HttpResponse baseline,
                                                     Payload payload, DetectionResult result) {
        Optional<String> falseVariant = BooleanCondition.falseCounterpart(payload.getValue());
        if (falseVariant.isEmpty()) {
            return Optional.empty();
        }
        Optional<HttpResponse> falseResponse = current.fetch(point.request(falseVariant.get()));
        if (falseResponse.isEmpty()) {
            return Optional.empty();
        }
        double falseRatio = BooleanBasedDetector.lengthRatio(
            baseline.getContentLength(), falseResponse.get().getContentLength());
        boolean differs = falseRatio < BooleanBasedDetector.AND_TRUE_LOWER
            || falseResponse.get().getStatusCode() != baseline.getStatusCode();
        if (!differs) {
            return Optional.empty();
        }
        Map<String, Object> evidence = new LinkedHashMap<>(result.getEvidence());
        evidence.put("false_payload", falseVariant.get());
        evidence.put("false_length", falseResponse.get().getContentLength());
        evidence.put("false_length_ratio", falseRatio);
        return Optional.of(DetectionResult.vulnerable(DetectionStrategy.BOOLEAN, result.getConfidence(), evidence));
    }

    private Optional<Finding> probe(ProbeSession current, InjectionPoint point, HttpResponse baseline,
                                    String sentValue, HttpRequest request, ResponseComparisonDetector detector,
                                    double threshold, Severity risk) {
        Optional<HttpResponse> response = current.fetch(request);
        if (response.isEmpty()) {
            return Optional.empty();
        }
        DetectionResult result = detector.analyze(baseline, response.get(), sentValue);
        logger.fine(NAME + ": " + point + " " + result);
        if (!result.meets(threshold) || !current.resolve(point, result.getStrategy())) {
            return Optional.empty();
        }
        return Optional.of(current.toFinding(point, sentValue, result, request, response.get(), risk));
    }

    private Optional<Finding> testTimeBased(ProbeSession current, InjectionPoint point) {
        if (current.isResolved(point, DetectionStrategy.TIME)) {
            return Optional.empty();
        }
        Optional<TimingBaseline> baseline = measureBaseline(current, point);
        if (baseline.isEmpty()) {
            return Optional.empty();
        }
        logger.fine(NAME + ": timing baseline for " + point + ": " + baseline.get());

        Optional<Finding> finding = testTimePayloads(current, point, baseline.get(),
            catalog.standard(DetectionStrategy.TIME));
        if (finding.isEmpty() && options.isAggressiveTimePayloads() && !current.isCancelled()) {
            logger.fine(NAME + ": trying CPU-heavy time payloads on " + point);
            finding = testTimePayloads(current, point, baseline.get(), catalog.aggressive(DetectionStrategy.TIME));
        }
        return finding;
    }

    private Optional<TimingBaseline> measureBaseline(ProbeSession current, InjectionPoint point) {
        List<Duration> samples = new ArrayList<>();
        for (int i = 0; i < TimingBaseline.DEFAULT_SAMPLES; i++) {
            Optional<HttpResponse> response = current.fetch(point.baselineRequest());
            if (response.isEmpty()) {
                return Optional.empty();
            }
            samples.add(response.get().getElapsed());
        }
        return Optional.of(TimingBaseline.of(samples));
    }

    private Optional<Finding> testTimePayloads(ProbeSession current, InjectionPoint point,
                                               TimingBaseline baseline, List<Payload> payloads) {
        double threshold = options.thresholdFor(DetectionStrategy.TIME);
        // leave room for the injected delay on top of the normal request timeout
        Duration timeout = options.getRequestTimeout().plus(timeDetector.getBaseDelay().multipliedBy(3));

        for (Payload payload : payloads) {
            if (current.isCancelled() || current.isResolved(point, DetectionStrategy.TIME)) {
                break;
            }
            try {
                HttpRequest request = point.request(payload.getValue());
                Optional<HttpResponse> probe = current.fetch(request, timeout);
                if (probe.isEmpty() || !timeDetector.exceedsThreshold(baseline, probe.get().getElapsed())) {
                    continue;
                }
                // the repeat must run after the probe completes, never alongside it
                Optional<HttpResponse> verification = current.fetch(request, timeout);
                if (verification.isEmpty()) {
                    continue;
                }
                DetectionResult result = timeDetector.evaluate(
                    baseline, probe.get().getElapsed(), verification.get().getElapsed());
                if (result.meets(threshold) && current.resolve(point, DetectionStrategy.TIME)) {
                    Map<String, Object> evidence = new LinkedHashMap<>(result.getEvidence());
                    payload.getDialect().ifPresent(d -> evidence.put("database", d.getDisplayName()));
                    DetectionResult enriched = DetectionResult.vulnerable(
                        DetectionStrategy.TIME, result.getConfidence(), evidence);
                    return Optional.of(current.toFinding(
                        point, payload.getValue(), enriched, request, probe.get(), payload.getRisk()));
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": payload '" + payload.getName() + "' failed on " + point, e);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized void cleanup() {
        ProbeSession current = session;
        if (current != null) {
            current.getExecutor().getSession().clear();
            session = null;
        }
    }
}
