package webscan.detection;

import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Boolean-based blind обнаружение по отношению длин probe/baseline.
 *
 * <ul>
 *   <li>{@link BooleanCondition#OR_TRUE}: отношение больше 1.5 дает 0.8, прирост больше 10 байт дает 0.7</li>
 *   <li>{@link BooleanCondition#AND_TRUE}: отношение в [0.8, 1.2] дает 0.7</li>
 *   <li>{@link BooleanCondition#AND_FALSE}: отношение меньше 0.5 дает 0.7</li>
 * </ul>
 */
public final class BooleanBasedDetector implements ResponseComparisonDetector {
    static final double OR_TRUE_RATIO = 1.5;
    static final int OR_TRUE_MIN_GROWTH = 10;
    public static final double AND_TRUE_LOWER = 0.8;
    static final double AND_TRUE_UPPER = 1.2;
    static final double AND_FALSE_RATIO = 0.5;

    @Override
    public DetectionResult analyze(HttpResponse baseline, HttpResponse probe, String payload) {
        BooleanCondition condition = BooleanCondition.classify(payload);
        int baselineLength = baseline.getContentLength();
        int probeLength = probe.getContentLength();
        int difference = probeLength - baselineLength;
        double ratio = lengthRatio(baselineLength, probeLength);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("condition", condition.name());
        evidence.put("baseline_length", baselineLength);
        evidence.put("malicious_length", probeLength);
        evidence.put("length_difference", difference);
        evidence.put("length_ratio", ratio);

        double confidence = switch (condition) {
            case OR_TRUE -> {
                if (ratio > OR_TRUE_RATIO) {
                    yield 0.8;
                }
                yield difference > OR_TRUE_MIN_GROWTH ? 0.7 : 0.0;
            }
            case AND_TRUE -> ratio >= AND_TRUE_LOWER && ratio <= AND_TRUE_UPPER
                && probe.getStatusCode() == baseline.getStatusCode() ? 0.7 : 0.0;
            case AND_FALSE -> ratio < AND_FALSE_RATIO ? 0.7 : 0.0;
            case UNKNOWN -> 0.0;
        };

        if (confidence == 0.0) {
            return DetectionResult.notVulnerable(DetectionStrategy.BOOLEAN, evidence);
        }
        return DetectionResult.vulnerable(DetectionStrategy.BOOLEAN, confidence, evidence);
    }

    public static double lengthRatio(int baselineLength, int probeLength) {
        if (baselineLength == 0) {
            return probeLength == 0 ? 1.0 : probeLength;
        }
        return (double) probeLength / baselineLength;
    }
}
