package webscan.detection;

import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Stored XSS: анализ повторной загрузки страницы после отправки формы.
 *
 * <p>Обязательное условие: нагрузка присутствует в неэкранированном виде (0.6).
 * Дополнительно: сохранились и другие отправленные значения (0.2), нагрузка несет
 * признак исполнения (0.3), рядом видна структура записи гостевой книги или
 * комментариев (0.4). Экранированное появление нагрузки уязвимостью не считается.
 */
public final class StoredXssDetector {
    static final double UNESCAPED_WEIGHT = 0.6;
    static final double PERSISTED_VALUES_WEIGHT = 0.2;
    static final double EXECUTION_WEIGHT = 0.3;
    static final double STRUCTURE_WEIGHT = 0.4;

    private static final Pattern ENTRY_STRUCTURE = Pattern.compile(
        "(name|message|comment|author|posted)\\s*:", Pattern.CASE_INSENSITIVE);

    /**
     * @param refetch the page fetched again after the submission
     * @param payload payload submitted in the target field
     * @param otherSubmittedValues values submitted in the other fields of the same form
     */
    public DetectionResult analyze(HttpResponse refetch, String payload, Collection<String> otherSubmittedValues) {
        String body = refetch.getBody();
        Map<String, Object> evidence = new LinkedHashMap<>();

        if (!body.contains(payload)) {
            evidence.put("payload_unescaped", false);
            evidence.put("payload_escaped", body.contains(htmlEscape(payload)));
            return DetectionResult.notVulnerable(DetectionStrategy.STORED, evidence);
        }
        evidence.put("payload_unescaped", true);
        double confidence = UNESCAPED_WEIGHT;

        List<String> persisted = new ArrayList<>();
        for (String value : otherSubmittedValues) {
            if (value != null && !value.isEmpty() && body.contains(value)) {
                persisted.add(value);
            }
        }
        if (!persisted.isEmpty()) {
            evidence.put("persisted_values", persisted);
            confidence += PERSISTED_VALUES_WEIGHT;
        }

        if (XssMarkers.hasExecutionIndicator(payload)) {
            evidence.put("execution_indicator", true);
            confidence += EXECUTION_WEIGHT;
        }

        if (ENTRY_STRUCTURE.matcher(body).find()) {
            evidence.put("entry_structure", true);
            confidence += STRUCTURE_WEIGHT;
        }

        return DetectionResult.vulnerable(DetectionStrategy.STORED, confidence, evidence);
    }

    static String htmlEscape(String value) {
        return value.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#x27;");
    }
}
