package webscan.detection;

import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * DOM XSS: признаки DOM-синков в ответе в сочетании с присутствием нагрузки
 * в теле или в переданном фрагменте/query URL.
 */
public final class DomXssDetector {
    static final double SINK_WEIGHT = 0.3;
    static final double PAYLOAD_PRESENT_WEIGHT = 0.4;
    static final double SCRIPT_CONTEXT_WEIGHT = 0.5;
    static final double FRAGMENT_SOURCE_WEIGHT = 0.4;

    private static final Map<String, Pattern> SINKS = new LinkedHashMap<>();

    static {
        SINKS.put("document.write", Pattern.compile("document\\.write(ln)?\\s*\\("));
        SINKS.put("innerHTML", Pattern.compile("\\.innerHTML\\s*[+]?="));
        SINKS.put("outerHTML", Pattern.compile("\\.outerHTML\\s*[+]?="));
        SINKS.put("document.location", Pattern.compile("document\\.location"));
        SINKS.put("window.location", Pattern.compile("window\\.location"));
        SINKS.put("location.hash", Pattern.compile("location\\.hash"));
        SINKS.put("location.search", Pattern.compile("location\\.search"));
        SINKS.put("eval", Pattern.compile("\\beval\\s*\\("));
    }

    /**
     * @param probe response to the page carrying the payload
     * @param payload payload as delivered
     * @param viaFragment true if the payload travelled in the URL fragment, which the server never sees
     */
    public DetectionResult analyze(HttpResponse probe, String payload, boolean viaFragment) {
        String body = probe.getBody();
        List<String> sinks = sinksIn(body);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("sinks", sinks);
        evidence.put("delivery", viaFragment ? "fragment" : "query");
        if (sinks.isEmpty()) {
            return DetectionResult.notVulnerable(DetectionStrategy.DOM, evidence);
        }

        double confidence = Math.min(SINK_WEIGHT * sinks.size(), 2 * SINK_WEIGHT);
        Optional<String> marker = XssMarkers.markerIn(payload);
        String needle = marker.orElse(payload);

        boolean present = body.contains(needle);
        boolean fragmentSource = viaFragment && sinks.contains("location.hash");
        evidence.put("payload_in_body", present);
        evidence.put("fragment_source", fragmentSource);
        if (!present && !fragmentSource) {
            return DetectionResult.notVulnerable(DetectionStrategy.DOM, evidence);
        }

        if (present) {
            confidence += PAYLOAD_PRESENT_WEIGHT;
            if (XssMarkers.inScriptBlock(XssMarkers.parse(body), needle, payload)) {
                evidence.put("script_context", true);
                confidence += SCRIPT_CONTEXT_WEIGHT;
            }
        }
        if (fragmentSource) {
            confidence += FRAGMENT_SOURCE_WEIGHT;
        }
        return DetectionResult.vulnerable(DetectionStrategy.DOM, confidence, evidence);
    }

    static List<String> sinksIn(String body) {
        List<String> found = new ArrayList<>();
        for (Map.Entry<String, Pattern> sink : SINKS.entrySet()) {
            if (sink.getValue().matcher(body).find()) {
                found.add(sink.getKey());
            }
        }
        return found;
    }
}
