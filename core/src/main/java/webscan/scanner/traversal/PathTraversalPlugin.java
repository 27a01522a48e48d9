package webscan.scanner.traversal;

import webscan.detection.DetectionResult;
import webscan.detection.FileDisclosureDetector;
import webscan.http.HttpRequest;
import webscan.http.HttpResponse;
import webscan.model.*;
import webscan.payload.PathTraversalPayloads;
import webscan.payload.Payload;
import webscan.payload.PayloadCatalog;
import webscan.scanner.*;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Сканер обхода каталогов (path traversal) и локального включения файлов.
 *
 * <p>Каждая точка внедрения (параметр query, поле формы, последний сегмент пути)
 * получает обычные нагрузки каталога. Параметры, имя которых похоже на имя файла
 * или пути, после них проверяются еще и закодированными вариантами. Первое
 * раскрытие файла закрывает точку.
 */
public final class PathTraversalPlugin implements ScannerPlugin {
    private static final Logger logger = Logger.getLogger(PathTraversalPlugin.class.getName());

    public static final String NAME = "path_traversal";

    private static final List<String> FILE_PARAMETER_HINTS = List.of(
        "file", "path", "dir", "folder", "include", "require", "read", "load", "doc", "download",
        "image", "resource", "attachment", "template", "page", "location");
    private static final List<String> INCLUSION_HINTS = List.of("include", "require", "template");

    private final InjectionPointExtractor extractor = new InjectionPointExtractor();
    private final FileDisclosureDetector detector = new FileDisclosureDetector();
    private final PayloadCatalog catalog;

    private volatile ProbeSession session;
    private volatile ScanOptions options;

    public PathTraversalPlugin() {
        this(PathTraversalPayloads.defaultCatalog());
    }

    PathTraversalPlugin(PayloadCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Detects directory traversal and local file inclusion through file disclosure";
    }

    @Override
    public VulnerabilityClass getVulnerabilityClass() {
        return VulnerabilityClass.PATH_TRAVERSAL;
    }

    @Override
    public synchronized void setup(ScanContext context) {
        if (session != null) {
            return;
        }
        this.options = context.getOptions();
        this.session = new ProbeSession(NAME, context.newRequestExecutor(), context);
        logger.fine(NAME + " ready with " + catalog.size() + " payloads");
    }

    @Override
    public List<Finding> scan(String url) {
        ProbeSession current = session;
        if (current == null) {
            throw new IllegalStateException("setup() must be called before scan()");
        }

        List<Finding> findings = new ArrayList<>();
        for (InjectionPoint point : extractor.extract(url, current.getContext().getFormsOnPage(url))) {
            if (current.isCancelled()) {
                break;
            }
            point.getForm().ifPresent(form -> current.getContext().getStatistics().formTested(form.signature()));
            try {
                scanPoint(current, point).ifPresent(findings::add);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": testing " + point + " failed", e);
            }
        }
        return findings;
    }

    private Optional<Finding> scanPoint(ProbeSession current, InjectionPoint point) {
        Optional<HttpResponse> baseline = current.fetch(point.baselineRequest());
        if (baseline.isEmpty()) {
            logger.fine(NAME + ": no baseline for " + point + ", skipping");
            return Optional.empty();
        }

        Optional<Finding> finding = testPayloads(current, point, baseline.get(),
            catalog.standard(DetectionStrategy.FILE_DISCLOSURE));
        if (finding.isEmpty() && point.getLocation() != ParameterLocation.PATH
            && isFileParameter(point.getName()) && !current.isCancelled()) {
            logger.fine(NAME + ": trying encoded payloads on " + point);
            finding = testPayloads(current, point, baseline.get(), catalog.aggressive(DetectionStrategy.FILE_DISCLOSURE));
        }
        return finding;
    }

    private Optional<Finding> testPayloads(ProbeSession current, InjectionPoint point, HttpResponse baseline,
                                           List<Payload> payloads) {
        double threshold = options.thresholdFor(DetectionStrategy.FILE_DISCLOSURE);
        for (Payload payload : payloads) {
            if (current.isCancelled() || current.isResolved(point, DetectionStrategy.FILE_DISCLOSURE)) {
                break;
            }
            try {
                HttpRequest request = requestFor(point, payload.getValue());
                Optional<HttpResponse> response = current.fetch(request);
                if (response.isEmpty()) {
                    continue;
                }
                DetectionResult result = detector.analyze(baseline, response.get(), payload.getValue());
                if (result.meets(threshold) && current.resolve(point, DetectionStrategy.FILE_DISCLOSURE)) {
                    Map<String, Object> evidence = new LinkedHashMap<>(result.getEvidence());
                    evidence.put("variant", isInclusionParameter(point.getName())
                        ? "local_file_inclusion" : "directory_traversal");
                    DetectionResult enriched = DetectionResult.vulnerable(
                        DetectionStrategy.FILE_DISCLOSURE, result.getConfidence(), evidence);
                    return Optional.of(current.toFinding(
                        point, payload.getValue(), enriched, request, response.get(), payload.getRisk()));
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, NAME + ": payload '" + payload.getName() + "' failed on " + point, e);
            }
        }
        return Optional.empty();
    }

    /**
     * Pre-encoded values go out untouched. Path segments keep their slashes so the
     * server sees real directory steps; backslashes there still need escaping.
     */
    static HttpRequest requestFor(InjectionPoint point, String value) {
        if (PathTraversalPayloads.isPreEncoded(value)) {
            return point.rawRequest(value);
        }
        if (point.getLocation() == ParameterLocation.PATH && value.indexOf('\\') < 0 && value.indexOf(':') < 0) {
            return point.rawRequest(value);
        }
        return point.request(value);
    }

    static boolean isFileParameter(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return FILE_PARAMETER_HINTS.stream().anyMatch(lower::contains);
    }

    static boolean isInclusionParameter(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return INCLUSION_HINTS.stream().anyMatch(lower::contains);
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
