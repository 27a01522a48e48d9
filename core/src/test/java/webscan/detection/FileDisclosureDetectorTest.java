package webscan.detection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;

import static org.junit.jupiter.api.Assertions.*;

class FileDisclosureDetectorTest {

    private static final String PASSWD = "root:x:0:0:root:/root:/bin/bash\n"
        + "daemon:x:1:1:daemon:/usr/sbin:/usr/sbin/nologin\n";
    private static final String WIN_INI = "; for 16-bit app support\n[fonts]\n[extensions]\n[mci extensions]\n";

    private FileDisclosureDetector detector;
    private HttpResponse baseline;

    @BeforeEach
    void setUp() {
        detector = new FileDisclosureDetector();
        baseline = response(200, "<html><body><pre>report.txt</pre></body></html>");
    }

    private static HttpResponse response(int status, String body) {
        return HttpResponse.builder().statusCode(status).body(body).build();
    }

    @Test
    void testPasswdDisclosureIsHighConfidence() {
        DetectionResult result = detector.analyze(baseline,
            response(200, "<html><body><pre>" + PASSWD + "</pre></body></html>"), "../../../etc/passwd");

        assertTrue(result.isVulnerable());
        assertEquals(DetectionStrategy.FILE_DISCLOSURE, result.getStrategy());
        assertEquals(0.9, result.getConfidence(), 1e-9);
        assertEquals("/etc/passwd", result.getEvidence().get("disclosed_file"));
        assertEquals("root:x:0:0:", result.getEvidence().get("matched_content"));
        assertTrue(((String) result.getEvidence().get("content_excerpt")).contains("/bin/bash"));
    }

    @Test
    void testWinIniDisclosure() {
        DetectionResult result = detector.analyze(baseline, response(200, WIN_INI), "..\\..\\..\\windows\\win.ini");

        assertTrue(result.isVulnerable());
        assertEquals("win.ini", result.getEvidence().get("disclosed_file"));
    }

    @Test
    void testWeakSignatureHasLowerConfidence() {
        DetectionResult result = detector.analyze(baseline,
            response(200, "127.0.0.1   localhost\n::1 localhost ip6-localhost\n"), "../../../../etc/hosts");

        assertTrue(result.isVulnerable());
        assertEquals(0.7, result.getConfidence(), 1e-9);
        assertEquals("hosts", result.getEvidence().get("disclosed_file"));
    }

    @Test
    void testStrongSignaturePreferredOverWeak() {
        DetectionResult result = detector.analyze(baseline,
            response(200, "127.0.0.1 localhost\n" + PASSWD), "/etc/passwd");

        assertEquals(0.9, result.getConfidence(), 1e-9);
        assertEquals("/etc/passwd", result.getEvidence().get("disclosed_file"));
    }

    @Test
    void testContentAlreadyInBaselineIsIgnored() {
        HttpResponse docs = response(200, "<p>Example:</p><pre>" + PASSWD + "</pre>");

        assertFalse(detector.analyze(docs, docs, "../../../etc/passwd").isVulnerable());
    }

    @Test
    void testErrorStatusIsIgnored() {
        assertFalse(detector.analyze(baseline, response(404, PASSWD), "/etc/passwd").isVulnerable());
    }

    @Test
    void testEchoedPayloadDoesNotCount() {
        String payload = "root:x:0:0:";
        HttpResponse echo = response(200, "<p>File '" + payload + "' not found</p>");

        assertFalse(detector.analyze(baseline, echo, payload).isVulnerable());
    }

    @Test
    void testPlainPageIsNotVulnerable() {
        DetectionResult result = detector.analyze(baseline,
            response(200, "<html><body><p>No such file</p></body></html>"), "../../../etc/passwd");

        assertFalse(result.isVulnerable());
        assertEquals(0.0, result.getConfidence());
    }

    @Test
    void testExcerptMarksTruncation() {
        String body = "x".repeat(100) + "MATCH" + "y".repeat(100);

        String excerpt = FileDisclosureDetector.excerpt(body, 100, 105);

        assertTrue(excerpt.startsWith("..."));
        assertTrue(excerpt.endsWith("..."));
        assertTrue(excerpt.contains("MATCH"));
    }
}
