package webscan.scanner.traversal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import webscan.crawler.DiscoveredForm;
import webscan.crawler.FormField;
import webscan.http.HttpClient;
import webscan.http.HttpRequest;
import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;
import webscan.model.Finding;
import webscan.model.ParameterLocation;
import webscan.model.ScanOptions;
import webscan.model.Severity;
import webscan.model.VulnerabilityClass;
import webscan.scanner.InjectionPoint;
import webscan.scanner.ScanContext;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PathTraversalPluginTest {

    private static final String PASSWD = "root:x:0:0:root:/root:/bin/bash\n"
        + "daemon:x:1:1:daemon:/usr/sbin:/usr/sbin/nologin\n";
    private static final String WIN_INI = "; for 16-bit app support\n[fonts]\n[extensions]\n";
    private static final String DOCUMENT = "<html><body><pre>Quarterly report</pre></body></html>";
    private static final Pattern UNIX_TRAVERSAL = Pattern.compile("(\\.\\./){3,}etc/passwd");
    private static final Pattern WINDOWS_TRAVERSAL = Pattern.compile("(\\.\\.\\\\){3,}windows\\\\win\\.ini");

    @Mock
    private HttpClient httpClient;

    private PathTraversalPlugin plugin;
    private final List<String> seenUrls = new CopyOnWriteArrayList<>();
    private final List<String> seenFiles = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        plugin = new PathTraversalPlugin();
        when(httpClient.execute(any(), any())).thenAnswer(invocation -> route(invocation.getArgument(0)));
    }

    private HttpResponse route(HttpRequest request) {
        String url = request.getUrl();
        seenUrls.add(url);
        int q = url.indexOf('?');
        String path = q >= 0 ? url.substring(0, q) : url;
        Map<String, String> query = InjectionPoint.parseQuery(q >= 0 ? url.substring(q + 1) : null);

        if (path.startsWith("http://example.com/files/")) {
            String file = path.substring("http://example.com/files/".length());
            return UNIX_TRAVERSAL.matcher(file).matches() ? page(PASSWD) : page(DOCUMENT);
        }
        switch (path) {
            case "http://example.com/download": {
                String file = query.getOrDefault("file", "");
                seenFiles.add(file);
                return UNIX_TRAVERSAL.matcher(file).matches() ? page(PASSWD) : page(DOCUMENT);
            }
            case "http://example.com/secure-download": {
                // rejects traversal after the container decoded the query, then decodes once more
                String file = query.getOrDefault("file", "");
                if (file.contains("../") || file.contains("..\\") || file.startsWith("/") || file.contains(":")) {
                    return HttpResponse.builder().statusCode(400).body("Invalid file name").build();
                }
                try {
                    String decoded = URLDecoder.decode(file, StandardCharsets.UTF_8);
                    return UNIX_TRAVERSAL.matcher(decoded).matches() ? page(PASSWD) : page(DOCUMENT);
                } catch (IllegalArgumentException e) {
                    return HttpResponse.builder().statusCode(400).body("Invalid file name").build();
                }
            }
            case "http://example.com/item":
                return page("<html><body><h1>Item " + query.getOrDefault("id", "") + "</h1></body></html>");
            case "http://example.com/viewer/open": {
                Map<String, String> form = InjectionPoint.parseQuery(request.getBody());
                String template = form.getOrDefault("template", "");
                return WINDOWS_TRAVERSAL.matcher(template).matches() ? page(WIN_INI) : page("<p>Template not found</p>");
            }
            default:
                return HttpResponse.builder().statusCode(404).body("Not Found").build();
        }
    }

    private static HttpResponse page(String body) {
        return HttpResponse.builder()
            .statusCode(200)
            .addHeader("Content-Type", "text/html")
            .body(body)
            .elapsed(Duration.ofMillis(20))
            .build();
    }

    private ScanContext context(List<DiscoveredForm> forms) {
        return ScanContext.builder()
            .scanId("scan-traversal")
            .targetUrl("http://example.com/")
            .options(ScanOptions.builder().crawlEnabled(false).requestDelay(Duration.ZERO).build())
            .httpClient(httpClient)
            .forms(forms)
            .sleeper(duration -> { })
            .build();
    }

    @Test
    void testMetadata() {
        assertEquals("path_traversal", plugin.getName());
        assertEquals(VulnerabilityClass.PATH_TRAVERSAL, plugin.getVulnerabilityClass());
        assertFalse(plugin.getDescription().isEmpty());
    }

    @Test
    void testScanBeforeSetupFails() {
        assertThrows(IllegalStateException.class, () -> plugin.scan("http://example.com/download?file=a.txt"));
    }

    @Test
    void testQueryParameterTraversalStopsAtFirstMatch() {
        plugin.setup(context(List.of()));

        List<Finding> findings = plugin.scan("http://example.com/download?file=report.txt");

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(DetectionStrategy.FILE_DISCLOSURE, finding.getStrategy());
        assertEquals(VulnerabilityClass.PATH_TRAVERSAL, finding.getVulnerabilityClass());
        assertEquals("file", finding.getParameter());
        assertEquals(ParameterLocation.QUERY, finding.getParameterLocation());
        assertEquals("../../../etc/passwd", finding.getPayload());
        assertEquals(Severity.HIGH, finding.getRisk());
        assertEquals("/etc/passwd", finding.getEvidence().get("disclosed_file"));
        assertEquals("directory_traversal", finding.getEvidence().get("variant"));
        assertEquals("http://example.com/download", finding.getEndpoint());
        assertEquals("Path Traversal", finding.getTitle());
        assertEquals("CWE-22", finding.getCweId());
        assertTrue(finding.getRemediation().stream().anyMatch(step -> step.contains("allow-list")));
        assertFalse(seenFiles.contains("../../../../etc/passwd"));
    }

    @Test
    void testDoubleEncodedPayloadPassesDecodingFilter() {
        plugin.setup(context(List.of()));

        List<Finding> findings = plugin.scan("http://example.com/secure-download?file=report.txt");

        assertEquals(1, findings.size());
        assertEquals("%252e%252e%252f%252e%252e%252f%252e%252e%252fetc%252fpasswd", findings.get(0).getPayload());
        assertTrue(seenUrls.stream().anyMatch(u -> u.contains("file=%252e%252e%252f")));
    }

    @Test
    void testEncodedPayloadsOnlyForFileLikeParameters() {
        plugin.setup(context(List.of()));

        List<Finding> findings = plugin.scan("http://example.com/item?id=7");

        assertTrue(findings.isEmpty());
        assertTrue(seenUrls.stream().anyMatch(u -> u.contains("id=..%2F..%2F..%2Fetc%2Fpasswd")));
        assertTrue(seenUrls.stream().noneMatch(u -> u.contains("%252e")));
    }

    @Test
    void testPathSegmentTraversal() {
        plugin.setup(context(List.of()));

        List<Finding> findings = plugin.scan("http://example.com/files/report.txt");

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(ParameterLocation.PATH, finding.getParameterLocation());
        assertEquals("path[2]", finding.getParameter());
        assertEquals("../../../etc/passwd", finding.getPayload());
        assertTrue(seenUrls.contains("http://example.com/files/../../../etc/passwd"));
    }

    @Test
    void testFormFieldFileInclusion() {
        DiscoveredForm form = new DiscoveredForm("http://example.com/viewer", "http://example.com/viewer/open", "POST",
            List.of(new FormField("template", "text", "default.tpl")), Map.of());
        plugin.setup(context(List.of(form)));

        List<Finding> findings = plugin.scan("http://example.com/viewer");

        Finding finding = findings.stream()
            .filter(f -> f.getParameterLocation() == ParameterLocation.FORM)
            .findFirst()
            .orElseThrow();
        assertEquals("template", finding.getParameter());
        assertEquals("..\\..\\..\\windows\\win.ini", finding.getPayload());
        assertEquals("win.ini", finding.getEvidence().get("disclosed_file"));
        assertEquals("local_file_inclusion", finding.getEvidence().get("variant"));
        assertEquals("POST", finding.getMethod());
    }

    @Test
    void testFileParameterNames() {
        assertTrue(PathTraversalPlugin.isFileParameter("filename"));
        assertTrue(PathTraversalPlugin.isFileParameter("DocPath"));
        assertFalse(PathTraversalPlugin.isFileParameter("id"));
        assertTrue(PathTraversalPlugin.isInclusionParameter("include_page"));
        assertFalse(PathTraversalPlugin.isInclusionParameter("file"));
    }

    @Test
    void testCleanupAllowsNewSetup() {
        plugin.setup(context(List.of()));
        plugin.cleanup();
        plugin.cleanup();

        assertThrows(IllegalStateException.class, () -> plugin.scan("http://example.com/download?file=a.txt"));
        plugin.setup(context(List.of()));
        assertEquals(1, plugin.scan("http://example.com/download?file=report.txt").size());
    }
}
