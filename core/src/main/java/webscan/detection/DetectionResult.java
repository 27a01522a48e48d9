package webscan.detection;

import webscan.model.DetectionStrategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Результат анализа одной пары baseline/probe одной стратегией обнаружения.
 *
 * <p>Уверенность всегда приводится к диапазону [0, 1]. Evidence содержит
 * структурированные сигналы (длины, совпадения, тайминги), а не только текст.
 */
public final class DetectionResult {
    private final DetectionStrategy strategy;
    private final boolean vulnerable;
    private final double confidence;
    private final Map<String, Object> evidence;

    private DetectionResult(DetectionStrategy strategy, boolean vulnerable, double confidence,
                            Map<String, Object> evidence) {
        this.strategy = Objects.requireNonNull(strategy, "strategy cannot be null");
        this.vulnerable = vulnerable;
        this.confidence = clamp(confidence);
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    public static DetectionResult vulnerable(DetectionStrategy strategy, double confidence,
                                             Map<String, Object> evidence) {
        return new DetectionResult(strategy, true, confidence, evidence);
    }

    public static DetectionResult notVulnerable(DetectionStrategy strategy) {
        return new DetectionResult(strategy, false, 0.0, Map.of());
    }

    public static DetectionResult notVulnerable(DetectionStrategy strategy, Map<String, Object> evidence) {
        return new DetectionResult(strategy, false, 0.0, evidence);
    }

    static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    public DetectionStrategy getStrategy() {
        return strategy;
    }

    public boolean isVulnerable() {
        return vulnerable;
    }

    public double getConfidence() {
        return confidence;
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    /**
     * @return true if the result is vulnerable and its confidence clears the given threshold
     */
    public boolean meets(double threshold) {
        return vulnerable && confidence >= threshold;
    }

    @Override
    public String toString() {
        return String.format("DetectionResult{%s, vulnerable=%s, confidence=%.2f}",
            strategy.getTag(), vulnerable, confidence);
    }
}
