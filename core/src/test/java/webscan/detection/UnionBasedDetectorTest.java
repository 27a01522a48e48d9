package webscan.detection;

import org.junit.jupiter.api.Test;
import webscan.http.HttpResponse;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnionBasedDetectorTest {

    private final UnionBasedDetector detector = new UnionBasedDetector();
    private final HttpResponse baseline = body("<h2>Product: Widget</h2><p>Price: 10</p>");

    private static HttpResponse body(String body) {
        return HttpResponse.builder().statusCode(200).body(body).build();
    }

    @Test
    void testDatabaseMarkersInResponse() {
        HttpResponse probe = body("<h2>Product: 5.7.33-log</h2><p>Price: root@localhost</p>");

        DetectionResult result = detector.analyze(baseline, probe, "' UNION SELECT @@version,user()-- ");

        assertTrue(result.isVulnerable());
        assertEquals(0.9, result.getConfidence(), 0.001);
        @SuppressWarnings("unchecked")
        List<String> markers = (List<String>) result.getEvidence().get("markers");
        assertTrue(markers.contains("version_number"));
        assertTrue(markers.contains("root@host"));
    }

    @Test
    void testEchoedPayloadIsNotAMarker() {
        String payload = "' UNION SELECT table_name FROM information_schema.tables-- ";
        HttpResponse probe = body(baseline.getBody() + "<!-- " + payload + " -->");

        DetectionResult result = detector.analyze(baseline, probe, payload);

        assertFalse(result.isVulnerable());
        assertFalse(result.getEvidence().containsKey("markers"));
    }

    @Test
    void testLengthChangeIsWeakSignal() {
        HttpResponse probe = body(baseline.getBody() + "<p>extra row extra row extra row</p>");

        DetectionResult result = detector.analyze(baseline, probe, "' UNION SELECT NULL,NULL-- ");

        assertTrue(result.isVulnerable());
        assertEquals(0.6, result.getConfidence(), 0.001);
    }

    @Test
    void testIdenticalResponseIsNotVulnerable() {
        assertFalse(detector.analyze(baseline, body(baseline.getBody()), "' UNION SELECT NULL-- ").isVulnerable());
    }
}
