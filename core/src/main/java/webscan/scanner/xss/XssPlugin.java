package webscan.scanner.xss;

import webscan.crawler.DiscoveredForm;
import webscan.crawler.FormField;
import webscan.detection.DetectionResult;
import webscan.detection.DomXssDetector;
import webscan.detection.ReflectedXssDetector;
import webscan.detection.StoredXssDetector;
import webscan.http.HttpRequest;
import webscan.http.HttpResponse;
import webscan.model.*;
import webscan.payload.MarkerGenerator;
import webscan.payload.Payload;
import webscan.payload.PayloadCatalog;
import webscan.payload.XssPayloads;
import webscan.scanner.*;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Сканер межсайтового скриптинга.
 *
 * <ul>
 *   <li>reflected: нагрузка с уникальным маркером в каждом параметре, поиск
 *       неэкранированного маркера в исполняемом контексте</li>
 *   <li>DOM: DOM-синки в ответе вместе с нагрузкой в теле, в query или во фрагменте URL</li>
 *   <li>stored: отправка POST формы с нагрузкой и повторная загрузка страницы;
 *       найденная уязвимость всегда критическая</li>
 * </ul>
 */
public final class XssPlugin implements ScannerPlugin {
    private static final Logger logger = Logger.getLogger(XssPlugin.class.getName());

    public static final String NAME = "xss";
    static final String FRAGMENT_PARAMETER = "#fragment";

    private static final List<String> STORED_FIELD_HINTS = List.of(
        "message", "comment", "text", "content", "body", "description");

    private final InjectionPointExtractor extractor = new InjectionPointExtractor();
    private final ReflectedXssDetector reflectedDetector = new ReflectedXssDetector();
    private final DomXssDetector domDetector = new DomXssDetector();
    private final StoredXssDetector storedDetector = new StoredXssDetector();
    private final MarkerGenerator markers;
    private final PayloadCatalog catalog;

    private volatile ProbeSession session;
    private volatile ScanOptions options;

    public XssPlugin() {
        this(new MarkerGenerator(), XssPayloads.defaultCatalog());
    }

    XssPlugin(MarkerGenerator markers, PayloadCatalog catalog) {
        this.markers = markers;
        this.catalog = catalog;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Detects reflected, DOM-based and stored cross-site scripting";
    }

    @Override
    public VulnerabilityClass getVulnerabilityClass() {
        return VulnerabilityClass.XSS;
    }

    @Override
    public synchronized void setup(ScanContext context) {
        if (session != null) {
            return;
        }
        this.options = context.getOptions();
        this.session = new ProbeSession(NAME, context.newRequestExecutor(), context);
    }

    @Override
    public List<Finding> scan(String url) {
        ProbeSession current = session;
        if (current == null) {
            throw new IllegalStateException("setup() must be called before scan()");
        }
        List<DiscoveredForm> forms = current.getContext().getFormsOnPage(url);
        List<Finding> findings = new ArrayList<>();

        for (InjectionPoint point : extractor.extract(url, forms)) {
            if (current.isCancelled()) {
                return findings;
            }
            point.getForm().ifPresent(form -> current.getContext().getStatistics().formTested(form.signature()));
            try {
                findings.addAll(scanPoint(current, point));
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": testing " + point + " failed", e);
            }
        }

        try {
            testDomViaFragment(current, url).ifPresent(findings::add);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, NAME + ": fragment test failed on " + url, e);
        }

        for (DiscoveredForm form : forms) {
            if (current.isCancelled()) {
                break;
            }
            if (form.isPost()) {
                findings.addAll(testStored(current, form));
            }
        }
        return findings;
    }

    private List<Finding> scanPoint(ProbeSession current, InjectionPoint point) {
        Optional<HttpResponse> baseline = current.fetch(point.baselineRequest());
        if (baseline.isEmpty()) {
            logger.fine(NAME + ": no baseline for " + point + ", skipping");
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        testReflected(current, point, baseline.get()).ifPresent(findings::add);
        testDomViaQuery(current, point).ifPresent(findings::add);
        return findings;
    }

    private Optional<Finding> testReflected(ProbeSession current, InjectionPoint point, HttpResponse baseline) {
        double threshold = options.thresholdFor(DetectionStrategy.REFLECTED);
        for (Payload payload : catalog.forStrategy(DetectionStrategy.REFLECTED)) {
            if (current.isCancelled() || current.isResolved(point, DetectionStrategy.REFLECTED)) {
                break;
            }
            try {
                String value = payload.render(markers.next());
                HttpRequest request = point.request(value);
                Optional<HttpResponse> probe = current.fetch(request);
                if (probe.isEmpty()) {
                    continue;
                }
                DetectionResult result = reflectedDetector.analyze(baseline, probe.get(), value);
                if (result.meets(threshold) && current.resolve(point, DetectionStrategy.REFLECTED)) {
                    return Optional.of(current.toFinding(point, value, withContext(result, payload),
                        request, probe.get(), payload.getRisk()));
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": payload '" + payload.getName() + "' failed on " + point, e);
            }
        }
        return Optional.empty();
    }

    private Optional<Finding> testDomViaQuery(ProbeSession current, InjectionPoint point) {
        if (point.getLocation() != ParameterLocation.QUERY) {
            return Optional.empty();
        }
        return testDom(current, point, false);
    }

    private Optional<Finding> testDomViaFragment(ProbeSession current, String url) {
        InjectionPoint point = InjectionPoint.builder()
            .url(url)
            .name(FRAGMENT_PARAMETER)
            .location(ParameterLocation.FRAGMENT)
            .build();
        return testDom(current, point, true);
    }

    private Optional<Finding> testDom(ProbeSession current, InjectionPoint point, boolean viaFragment) {
        double threshold = options.thresholdFor(DetectionStrategy.DOM);
        for (Payload payload : catalog.forStrategy(DetectionStrategy.DOM)) {
            if (current.isCancelled() || current.isResolved(point, DetectionStrategy.DOM)) {
                break;
            }
            try {
                String value = payload.render(markers.next());
                HttpRequest request = point.request(value);
                Optional<HttpResponse> probe = current.fetch(request);
                if (probe.isEmpty()) {
                    continue;
                }
                DetectionResult result = domDetector.analyze(probe.get(), value, viaFragment);
                if (result.meets(threshold) && current.resolve(point, DetectionStrategy.DOM)) {
                    return Optional.of(current.toFinding(point, value, withContext(result, payload),
                        request, probe.get(), payload.getRisk()));
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": payload '" + payload.getName() + "' failed on " + point, e);
            }
        }
        return Optional.empty();
    }

    private List<Finding> testStored(ProbeSession current, DiscoveredForm form) {
        List<Finding> findings = new ArrayList<>();
        for (FormField target : storedTargets(form)) {
            try {
                testStoredField(current, form, target).ifPresent(findings::add);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": stored test of '" + target.name() + "' failed on " + form, e);
            }
        }
        return findings;
    }

    private Optional<Finding> testStoredField(ProbeSession current, DiscoveredForm form, FormField target) {
        double threshold = options.thresholdFor(DetectionStrategy.STORED);
        for (Payload payload : catalog.forStrategy(DetectionStrategy.STORED)) {
            if (current.isCancelled()) {
                break;
            }
            String value = payload.render(markers.next());
            Map<String, String> values = new LinkedHashMap<>(form.defaultValues(markers.nextTag()));
            List<String> otherValues = new ArrayList<>();
            for (FormField field : form.getFields()) {
                if (field.isTextLike() && !field.name().equals(target.name())) {
                    String tag = markers.nextTag();
                    values.put(field.name(), tag);
                    otherValues.add(tag);
                }
            }
            values.put(target.name(), value);

            InjectionPoint point = InjectionPoint.builder()
                .url(form.getAction())
                .method(form.getMethod())
                .name(target.name())
                .location(ParameterLocation.FORM)
                .originalValue(value)
                .parameters(values)
                .form(form)
                .build();
            if (current.isResolved(point, DetectionStrategy.STORED)) {
                break;
            }

            HttpRequest submission = point.request(value);
            if (current.fetch(submission).isEmpty()) {
                continue;
            }
            Optional<HttpResponse> refetch = current.fetch(HttpRequest.get(form.getPageUrl()));
            if (refetch.isEmpty()) {
                continue;
            }

            DetectionResult result = storedDetector.analyze(refetch.get(), value, otherValues);
            if (result.meets(threshold) && current.resolve(point, DetectionStrategy.STORED)) {
                Map<String, Object> evidence = new LinkedHashMap<>(result.getEvidence());
                evidence.put("rendered_on", form.getPageUrl());
                DetectionResult enriched = DetectionResult.vulnerable(
                    DetectionStrategy.STORED, result.getConfidence(), evidence);
                return Optional.of(current.toFinding(point, value, enriched, submission, refetch.get(),
                    Severity.CRITICAL));
            }
        }
        return Optional.empty();
    }

    /**
     * Fields named like free-form content; all text-like fields when none is.
     */
    static List<FormField> storedTargets(DiscoveredForm form) {
        List<FormField> textLike = new ArrayList<>();
        List<FormField> hinted = new ArrayList<>();
        for (FormField field : form.getFields()) {
            if (!field.isTextLike() || "password".equals(field.type()) || "hidden".equals(field.type())) {
                continue;
            }
            textLike.add(field);
            String lower = field.name().toLowerCase(Locale.ROOT);
            if (field.type().equals("textarea") || STORED_FIELD_HINTS.stream().anyMatch(lower::contains)) {
                hinted.add(field);
            }
        }
        return hinted.isEmpty() ? textLike : hinted;
    }

    private static DetectionResult withContext(DetectionResult result, Payload payload) {
        if (payload.getContext().isEmpty()) {
            return result;
        }
        Map<String, Object> evidence = new LinkedHashMap<>(result.getEvidence());
        evidence.put("context", payload.getContext().get().name().toLowerCase(Locale.ROOT));
        return DetectionResult.vulnerable(result.getStrategy(), result.getConfidence(), evidence);
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
