package webscan.detection;

import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Union-based обнаружение: поиск метаданных СУБД в ответе на {@code UNION SELECT}.
 *
 * <p>Маркер, которого нет ни в baseline, ни в отраженной нагрузке, дает 0.9.
 * Без маркеров заметная смена статуса или длины дает слабый сигнал 0.5-0.6,
 * который сам по себе не проходит порог union-стратегии.
 */
public final class UnionBasedDetector implements ResponseComparisonDetector {
    static final double MARKER_CONFIDENCE = 0.9;
    static final double DELTA_CONFIDENCE = 0.6;
    static final double NULL_CONFIDENCE = 0.5;
    static final int LENGTH_DELTA_BYTES = 20;

    private static final Map<String, Pattern> MARKERS = new LinkedHashMap<>();

    static {
        MARKERS.put("mysql", Pattern.compile("\\bmysql\\b", Pattern.CASE_INSENSITIVE));
        MARKERS.put("mariadb", Pattern.compile("\\bmariadb\\b", Pattern.CASE_INSENSITIVE));
        MARKERS.put("version()", Pattern.compile("version\\(\\)", Pattern.CASE_INSENSITIVE));
        MARKERS.put("database()", Pattern.compile("database\\(\\)", Pattern.CASE_INSENSITIVE));
        MARKERS.put("user()", Pattern.compile("user\\(\\)", Pattern.CASE_INSENSITIVE));
        MARKERS.put("information_schema", Pattern.compile("information_schema", Pattern.CASE_INSENSITIVE));
        MARKERS.put("table_name", Pattern.compile("\\btable_name\\b", Pattern.CASE_INSENSITIVE));
        MARKERS.put("column_name", Pattern.compile("\\bcolumn_name\\b", Pattern.CASE_INSENSITIVE));
        MARKERS.put("version_number", Pattern.compile("\\b\\d+\\.\\d+\\.\\d+(-[\\w.]+)?\\b"));
        MARKERS.put("root@host", Pattern.compile("\\b\\w+@(localhost|%|[\\d.]+)\\b", Pattern.CASE_INSENSITIVE));
    }

    @Override
    public DetectionResult analyze(HttpResponse baseline, HttpResponse probe, String payload) {
        String probeBody = stripEcho(probe.getBody(), payload);
        String baselineBody = baseline.getBody();

        List<String> markers = new ArrayList<>();
        for (Map.Entry<String, Pattern> marker : MARKERS.entrySet()) {
            Pattern pattern = marker.getValue();
            if (pattern.matcher(probeBody).find() && !pattern.matcher(baselineBody).find()) {
                markers.add(marker.getKey());
            }
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("baseline_length", baseline.getContentLength());
        evidence.put("malicious_length", probe.getContentLength());

        if (!markers.isEmpty()) {
            evidence.put("markers", markers);
            return DetectionResult.vulnerable(DetectionStrategy.UNION, MARKER_CONFIDENCE, evidence);
        }

        int lengthDelta = Math.abs(probe.getContentLength() - baseline.getContentLength());
        boolean statusChanged = probe.getStatusCode() != baseline.getStatusCode();
        if (statusChanged || lengthDelta > LENGTH_DELTA_BYTES) {
            evidence.put("length_difference", lengthDelta);
            evidence.put("status_changed", statusChanged);
            return DetectionResult.vulnerable(DetectionStrategy.UNION, DELTA_CONFIDENCE, evidence);
        }

        String probeLower = probeBody.toLowerCase(Locale.ROOT);
        if (probeLower.contains("null") && !baselineBody.toLowerCase(Locale.ROOT).contains("null")) {
            evidence.put("null_padding", true);
            return DetectionResult.vulnerable(DetectionStrategy.UNION, NULL_CONFIDENCE, evidence);
        }
        return DetectionResult.notVulnerable(DetectionStrategy.UNION, evidence);
    }

    private static String stripEcho(String body, String payload) {
        if (payload == null || payload.isEmpty()) {
            return body;
        }
        return body.replace(payload, "");
    }
}
