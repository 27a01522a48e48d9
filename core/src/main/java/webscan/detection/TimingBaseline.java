package webscan.detection;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Распределение времени ответа эндпоинта без нагрузки.
 *
 * <p>Порог обнаружения: {@code mean + 3 * stddev + baseDelay}, где stddev
 * считается по генеральной совокупности сэмплов.
 */
public final class TimingBaseline {
    public static final int DEFAULT_SAMPLES = 3;

    private final List<Duration> samples;
    private final double meanSeconds;
    private final double stdDevSeconds;

    private TimingBaseline(List<Duration> samples) {
        this.samples = List.copyOf(samples);
        this.meanSeconds = this.samples.stream()
            .mapToDouble(TimingBaseline::seconds)
            .average()
            .orElse(0.0);
        double variance = this.samples.stream()
            .mapToDouble(sample -> Math.pow(seconds(sample) - meanSeconds, 2))
            .average()
            .orElse(0.0);
        this.stdDevSeconds = Math.sqrt(variance);
    }

    public static TimingBaseline of(List<Duration> samples) {
        Objects.requireNonNull(samples, "samples cannot be null");
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("At least one timing sample is required");
        }
        return new TimingBaseline(samples);
    }

    static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    public List<Duration> getSamples() {
        return samples;
    }

    public double getMeanSeconds() {
        return meanSeconds;
    }

    public double getStdDevSeconds() {
        return stdDevSeconds;
    }

    public double thresholdSeconds(Duration baseDelay) {
        return meanSeconds + 3 * stdDevSeconds + seconds(baseDelay);
    }

    @Override
    public String toString() {
        return String.format("TimingBaseline{mean=%.3fs, stddev=%.3fs, samples=%d}",
            meanSeconds, stdDevSeconds, samples.size());
    }
}
