package webscan.detection;

import org.junit.jupiter.api.Test;
import webscan.http.HttpResponse;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XssDetectorsTest {

    private static final String MARKER = "XSSMARKab12CD34XSSMARK";

    private static HttpResponse body(String body) {
        return HttpResponse.builder().statusCode(200).body(body).build();
    }

    @Test
    void testReflectedScriptPayload() {
        String payload = "<script>alert('" + MARKER + "')</script>";
        HttpResponse baseline = body("<p>Results for: test</p>");
        HttpResponse probe = body("<p>Results for: " + payload + "</p>");

        DetectionResult result = new ReflectedXssDetector().analyze(baseline, probe, payload);

        assertTrue(result.isVulnerable());
        assertEquals(0.9, result.getConfidence(), 0.001);
        assertEquals(MARKER, result.getEvidence().get("marker"));
        assertEquals(true, result.getEvidence().get("script_context"));
    }

    @Test
    void testReflectedEventHandlerPayload() {
        String payload = "\" onmouseover=\"alert('" + MARKER + "')";
        HttpResponse probe = body("<input value=\"" + payload + "\">");

        DetectionResult result = new ReflectedXssDetector().analyze(body("<input value=\"test\">"), probe, payload);

        assertTrue(result.isVulnerable());
        assertEquals(true, result.getEvidence().get("event_handler_context"));
    }

    @Test
    void testEscapedReflectionIsNotVulnerable() {
        String payload = "<script>alert('" + MARKER + "')</script>";
        HttpResponse probe = body("<p>Results for: &lt;script&gt;alert(&#x27;" + MARKER + "&#x27;)&lt;/script&gt;</p>");

        DetectionResult result = new ReflectedXssDetector().analyze(body("<p>Results for: test</p>"), probe, payload);

        assertFalse(result.isVulnerable());
        assertEquals(true, result.getEvidence().get("reflected"));
        assertEquals(false, result.getEvidence().get("payload_unescaped"));
    }

    @Test
    void testJavascriptStringBreakout() {
        String payload = "\";alert('" + MARKER + "');//";
        HttpResponse probe = body("<script>var q = \"" + payload + "\";</script>");

        DetectionResult result = new ReflectedXssDetector().analyze(body("<script>var q = \"test\";</script>"), probe, payload);

        assertTrue(result.isVulnerable());
        assertEquals(true, result.getEvidence().get("script_context"));
    }

    @Test
    void testBackslashEscapedQuoteKeepsPayloadInString() {
        String payload = "\";alert('" + MARKER + "');//";
        HttpResponse probe = body("<script>var q = \"\\" + payload + "\";</script>");

        DetectionResult result = new ReflectedXssDetector().analyze(body("<script>var q = \"test\";</script>"), probe, payload);

        assertFalse(result.isVulnerable());
        assertEquals(true, result.getEvidence().get("payload_unescaped"));
        assertEquals(false, result.getEvidence().get("script_context"));
    }

    @Test
    void testDoubleEscapedBackslashStillBreaksOut() {
        String payload = "';alert('" + MARKER + "');//";
        HttpResponse probe = body("<script>var q = 'C:\\\\" + payload + "';</script>");

        DetectionResult result = new ReflectedXssDetector().analyze(body("<script>var q = 'x';</script>"), probe, payload);

        assertTrue(result.isVulnerable());
    }

    @Test
    void testHandlerTextInsideQuotedAttributeIsNotVulnerable() {
        String payload = "' onmouseover=alert('" + MARKER + "') '";
        HttpResponse probe = body("<input value=\"" + payload + "\">");

        DetectionResult result = new ReflectedXssDetector().analyze(body("<input value=\"test\">"), probe, payload);

        assertFalse(result.isVulnerable());
        assertEquals(false, result.getEvidence().get("event_handler_context"));
    }

    @Test
    void testSingleQuotedAttributeBreakout() {
        String payload = "' onmouseover=alert('" + MARKER + "') '";
        HttpResponse probe = body("<input value='" + payload + "'>");

        DetectionResult result = new ReflectedXssDetector().analyze(body("<input value='test'>"), probe, payload);

        assertTrue(result.isVulnerable());
        assertEquals(true, result.getEvidence().get("event_handler_context"));
    }

    @Test
    void testJavascriptUrlReflection() {
        String payload = "javascript:alert('" + MARKER + "')";
        HttpResponse probe = body("<a href=\"" + payload + "\">back</a>");

        DetectionResult result = new ReflectedXssDetector().analyze(body("<a href=\"/home\">back</a>"), probe, payload);

        assertTrue(result.isVulnerable());
        assertEquals(true, result.getEvidence().get("javascript_url_context"));
    }

    @Test
    void testEnclosingLiteralStart() {
        assertEquals(-1, XssMarkers.enclosingLiteralStart("var a = 'x'; b", 13));
        assertEquals(8, XssMarkers.enclosingLiteralStart("var a = \"x\\\" y", 13));
        assertEquals(6, XssMarkers.enclosingLiteralStart("a = 1 // 'note", 13));
    }

    @Test
    void testMissingReflection() {
        DetectionResult result = new ReflectedXssDetector().analyze(body("a"), body("b"), "<b>" + MARKER + "</b>");

        assertFalse(result.isVulnerable());
        assertEquals(false, result.getEvidence().get("reflected"));
    }

    @Test
    void testDomSinkWithFragmentSource() {
        HttpResponse page = body("<div id=\"out\"></div><script>"
            + "document.getElementById('out').innerHTML = decodeURIComponent(location.hash.slice(1));</script>");

        DetectionResult viaFragment = new DomXssDetector().analyze(page, "<img src=x onerror=alert('" + MARKER + "')>", true);
        DetectionResult viaQuery = new DomXssDetector().analyze(page, "<img src=x onerror=alert('" + MARKER + "')>", false);

        assertTrue(viaFragment.isVulnerable());
        assertEquals(1.0, viaFragment.getConfidence(), 0.001);
        assertEquals(List.of("innerHTML", "location.hash"), viaFragment.getEvidence().get("sinks"));
        assertFalse(viaQuery.isVulnerable());
    }

    @Test
    void testDomPayloadReachesScriptSink() {
        String payload = "'-alert('" + MARKER + "')-'";
        HttpResponse page = body("<script>var q = '" + payload + "'; document.write(q);</script>");

        DetectionResult result = new DomXssDetector().analyze(page, payload, false);

        assertTrue(result.isVulnerable());
        assertEquals(true, result.getEvidence().get("script_context"));
    }

    @Test
    void testNoSinksMeansNoDomXss() {
        DetectionResult result = new DomXssDetector().analyze(body("<p>" + MARKER + "</p>"), MARKER, false);

        assertFalse(result.isVulnerable());
    }

    @Test
    void testStoredPayloadRenderedUnescaped() {
        String payload = "<script>alert('" + MARKER + "')</script>";
        HttpResponse refetch = body("<div class=\"entry\">Name: wstq1w2e3r4<br>Message: " + payload + "</div>");

        DetectionResult result = new StoredXssDetector().analyze(refetch, payload, List.of("wstq1w2e3r4"));

        assertTrue(result.isVulnerable());
        assertEquals(1.0, result.getConfidence(), 0.001);
        assertEquals(List.of("wstq1w2e3r4"), result.getEvidence().get("persisted_values"));
    }

    @Test
    void testStoredPayloadEscapedIsNotVulnerable() {
        String payload = "<script>alert('" + MARKER + "')</script>";
        HttpResponse refetch = body("<div>Message: " + StoredXssDetector.htmlEscape(payload) + "</div>");

        DetectionResult result = new StoredXssDetector().analyze(refetch, payload, List.of());

        assertFalse(result.isVulnerable());
        assertEquals(true, result.getEvidence().get("payload_escaped"));
    }
}
