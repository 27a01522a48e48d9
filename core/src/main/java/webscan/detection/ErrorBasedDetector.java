package webscan.detection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Error-based обнаружение SQL инъекций.
 *
 * <p>Основной сигнал: сообщение об ошибке СУБД в теле ответа (уверенность 0.9).
 * Если тело является JSON, дополнительно проверяются строковые значения полей
 * {@code error}, {@code message}, {@code errorMessage}, {@code sqlMessage},
 * {@code sqlError} и {@code exception}, в том числе вложенные.
 *
 * <p>Резервные сигналы при отсутствии сообщения об ошибке:
 * <ul>
 *   <li>смена статуса на 5xx: 0.7</li>
 *   <li>SQL ключевые слова, отсутствующие в baseline: 0.6</li>
 *   <li>разница длины тела больше 50 байт: 0.5</li>
 * </ul>
 */
public final class ErrorBasedDetector implements ResponseComparisonDetector {
    private static final Logger logger = Logger.getLogger(ErrorBasedDetector.class.getName());

    static final double ERROR_MESSAGE_CONFIDENCE = 0.9;
    static final double SERVER_ERROR_CONFIDENCE = 0.7;
    static final double NEW_KEYWORD_CONFIDENCE = 0.6;
    static final double LENGTH_DELTA_CONFIDENCE = 0.5;
    static final int LENGTH_DELTA_BYTES = 50;

    private static final Set<String> JSON_ERROR_KEYS = Set.of(
        "error", "message", "errormessage", "sqlmessage", "sqlerror", "exception");

    private static final List<String> SQL_KEYWORDS = List.of(
        "sql", "syntax", "query", "database", "mysql", "postgresql", "oracle", "sqlite",
        "odbc", "jdbc", "driver", "statement");

    private final ObjectMapper objectMapper;

    public ErrorBasedDetector() {
        this(new ObjectMapper());
    }

    public ErrorBasedDetector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DetectionResult analyze(HttpResponse baseline, HttpResponse probe, String payload) {
        String body = probe.getBody();

        Optional<ErrorMatch> match = SqlErrorPatterns.find(body);
        String source = "body";
        if (match.isEmpty()) {
            for (String message : extractJsonErrorMessages(body)) {
                match = SqlErrorPatterns.find(message);
                if (match.isPresent()) {
                    source = "json";
                    break;
                }
            }
        }

        if (match.isPresent()) {
            ErrorMatch error = match.get();
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("database", error.dialect().getDisplayName());
            evidence.put("error_pattern", error.pattern());
            evidence.put("matched_error", error.matchedText());
            evidence.put("error_excerpt", error.excerpt());
            evidence.put("error_source", source);
            evidence.put("status_code", probe.getStatusCode());
            return DetectionResult.vulnerable(DetectionStrategy.ERROR, ERROR_MESSAGE_CONFIDENCE, evidence);
        }

        return analyzeSecondarySignals(baseline, probe, payload);
    }

    private DetectionResult analyzeSecondarySignals(HttpResponse baseline, HttpResponse probe, String payload) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        double confidence = 0.0;

        if (probe.isServerError() && !baseline.isServerError()) {
            evidence.put("status_change", baseline.getStatusCode() + " -> " + probe.getStatusCode());
            confidence = Math.max(confidence, SERVER_ERROR_CONFIDENCE);
        }

        List<String> newKeywords = newSqlKeywords(baseline.getBody(), probe.getBody(), payload);
        if (!newKeywords.isEmpty()) {
            evidence.put("new_sql_keywords", newKeywords);
            confidence = Math.max(confidence, NEW_KEYWORD_CONFIDENCE);
        }

        int lengthDelta = Math.abs(probe.getContentLength() - baseline.getContentLength());
        if (lengthDelta > LENGTH_DELTA_BYTES) {
            evidence.put("length_difference", lengthDelta);
            confidence = Math.max(confidence, LENGTH_DELTA_CONFIDENCE);
        }

        if (confidence == 0.0) {
            return DetectionResult.notVulnerable(DetectionStrategy.ERROR);
        }
        return DetectionResult.vulnerable(DetectionStrategy.ERROR, confidence, evidence);
    }

    /**
     * Keywords present in the probe but not in the baseline. Keywords that only come
     * from the echoed payload do not count.
     */
    static List<String> newSqlKeywords(String baselineBody, String probeBody, String payload) {
        String baselineLower = baselineBody.toLowerCase(Locale.ROOT);
        String probeLower = probeBody.toLowerCase(Locale.ROOT);
        String payloadLower = payload == null ? "" : payload.toLowerCase(Locale.ROOT);
        if (!payloadLower.isEmpty()) {
            probeLower = probeLower.replace(payloadLower, "");
        }

        List<String> found = new ArrayList<>();
        for (String keyword : SQL_KEYWORDS) {
            if (probeLower.contains(keyword) && !baselineLower.contains(keyword)) {
                found.add(keyword);
            }
        }
        return found;
    }

    /**
     * Collects string values of error-like keys from a JSON body, at any depth.
     * Returns an empty list when the body is not JSON.
     */
    List<String> extractJsonErrorMessages(String body) {
        String trimmed = body.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return List.of();
        }
        try {
            JsonNode root = objectMapper.readTree(trimmed);
            List<String> messages = new ArrayList<>();
            collectErrorMessages(root, messages);
            return messages;
        } catch (JsonProcessingException e) {
            logger.fine("Response body is not valid JSON: " + e.getOriginalMessage());
            return List.of();
        }
    }

    private void collectErrorMessages(JsonNode node, List<String> messages) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                collectErrorMessages(element, messages);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (JSON_ERROR_KEYS.contains(field.getKey().toLowerCase(Locale.ROOT)) && value.isTextual()) {
                messages.add(value.asText());
            } else if (value.isContainerNode()) {
                collectErrorMessages(value, messages);
            }
        }
    }
}
