package webscan.detection;

import org.jsoup.nodes.Document;
import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reflected XSS: нагрузка с уникальным маркером должна вернуться неэкранированной
 * внутри исполняемого контекста (блок script, обработчик события, javascript: URL).
 *
 * <p>Само по себе появление маркера в тексте страницы уязвимостью не считается,
 * как и маркер внутри значения другого атрибута или внутри строки, из которой
 * нагрузка не смогла выйти из-за экранирования кавычки.
 */
public final class ReflectedXssDetector implements ResponseComparisonDetector {
    static final double VERBATIM_WEIGHT = 0.4;
    static final double SCRIPT_BLOCK_WEIGHT = 0.4;
    static final double EVENT_HANDLER_WEIGHT = 0.4;
    static final double JAVASCRIPT_URL_WEIGHT = 0.3;
    static final double RESPONSE_CHANGE_WEIGHT = 0.1;

    @Override
    public DetectionResult analyze(HttpResponse baseline, HttpResponse probe, String payload) {
        String body = probe.getBody();
        Optional<String> marker = XssMarkers.markerIn(payload);
        String needle = marker.orElse(payload);

        Map<String, Object> evidence = new LinkedHashMap<>();
        marker.ifPresent(m -> evidence.put("marker", m));
        if (!body.contains(needle)) {
            evidence.put("reflected", false);
            return DetectionResult.notVulnerable(DetectionStrategy.REFLECTED, evidence);
        }
        evidence.put("reflected", true);

        double confidence = 0.0;
        boolean verbatim = body.contains(payload);
        evidence.put("payload_unescaped", verbatim);
        if (verbatim) {
            confidence += VERBATIM_WEIGHT;
        }

        Document document = XssMarkers.parse(body);
        boolean inScript = XssMarkers.inScriptBlock(document, needle, payload);
        boolean inHandler = XssMarkers.inEventHandler(document, needle, payload);
        boolean inJavascriptUrl = XssMarkers.inJavascriptUrl(document, needle);
        evidence.put("script_context", inScript);
        evidence.put("event_handler_context", inHandler);
        evidence.put("javascript_url_context", inJavascriptUrl);
        if (inScript) {
            confidence += SCRIPT_BLOCK_WEIGHT;
        }
        if (inHandler) {
            confidence += EVENT_HANDLER_WEIGHT;
        }
        if (inJavascriptUrl) {
            confidence += JAVASCRIPT_URL_WEIGHT;
        }
        if (probe.getContentLength() != baseline.getContentLength()) {
            confidence += RESPONSE_CHANGE_WEIGHT;
        }

        if (!(inScript || inHandler || inJavascriptUrl)) {
            return DetectionResult.notVulnerable(DetectionStrategy.REFLECTED, evidence);
        }
        return DetectionResult.vulnerable(DetectionStrategy.REFLECTED, confidence, evidence);
    }
}
