package webscan.detection;

import webscan.model.DetectionStrategy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Time-based blind обнаружение с двухфазной проверкой.
 *
 * <p>Probe помечается, только если и он, и последовательный повторный запрос
 * не короче порога {@link TimingBaseline#thresholdSeconds(Duration)}. Уверенность
 * зависит от задержки меньшего из двух замеров относительно среднего baseline:
 * от 4 секунд 0.9, от 2 секунд 0.7, иначе 0.5.
 */
public final class TimeBasedDetector {
    private final Duration baseDelay;

    public TimeBasedDetector(Duration baseDelay) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay cannot be null");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    /**
     * First phase: whether a probe is slow enough to justify a verification request.
     */
    public boolean exceedsThreshold(TimingBaseline baseline, Duration elapsed) {
        return TimingBaseline.seconds(elapsed) >= baseline.thresholdSeconds(baseDelay);
    }

    /**
     * Second phase: evaluates the probe together with its sequential repeat.
     */
    public DetectionResult evaluate(TimingBaseline baseline, Duration probe, Duration verification) {
        double threshold = baseline.thresholdSeconds(baseDelay);
        double probeSeconds = TimingBaseline.seconds(probe);
        double verificationSeconds = TimingBaseline.seconds(verification);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("baseline_mean_seconds", round(baseline.getMeanSeconds()));
        evidence.put("baseline_stddev_seconds", round(baseline.getStdDevSeconds()));
        evidence.put("threshold_seconds", round(threshold));
        evidence.put("probe_seconds", round(probeSeconds));
        evidence.put("verification_seconds", round(verificationSeconds));

        if (probeSeconds < threshold || verificationSeconds < threshold) {
            return DetectionResult.notVulnerable(DetectionStrategy.TIME, evidence);
        }

        double delay = Math.min(probeSeconds, verificationSeconds) - baseline.getMeanSeconds();
        evidence.put("observed_delay_seconds", round(delay));
        return DetectionResult.vulnerable(DetectionStrategy.TIME, confidenceFor(delay), evidence);
    }

    static double confidenceFor(double delaySeconds) {
        if (delaySeconds >= 4.0) {
            return 0.9;
        }
        if (delaySeconds >= 2.0) {
            return 0.7;
        }
        return 0.5;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
