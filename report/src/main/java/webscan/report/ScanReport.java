package webscan.report;

import webscan.model.Finding;
import webscan.model.ScanOptions;
import webscan.model.ScanStatistics;
import webscan.model.Severity;
import webscan.model.VulnerabilityClass;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Отчет о завершенном (или прерванном) сканировании.
 *
 * <p>Объединяет исходные параметры, итоговую статистику и список уязвимостей.
 * Уязвимости хранятся отсортированными по убыванию риска, затем по уверенности.
 * Объект неизменяемый и создается через {@link Builder}.
 */
public final class ScanReport {
    private static final Comparator<Finding> BY_RISK = Comparator
        .comparingInt((Finding f) -> f.getRisk().getPriority()).reversed()
        .thenComparing(Comparator.comparingDouble(Finding::getConfidence).reversed());

    private final String targetUrl;
    private final List<String> scanTypes;
    private final ScanOptions options;
    private final ScanStatistics statistics;
    private final List<Finding> findings;
    private final Instant generatedAt;

    private ScanReport(Builder builder) {
        this.targetUrl = Objects.requireNonNull(builder.targetUrl, "targetUrl cannot be null");
        this.scanTypes = List.copyOf(builder.scanTypes);
        this.options = builder.options;
        this.statistics = Objects.requireNonNull(builder.statistics, "statistics cannot be null");
        List<Finding> sorted = new ArrayList<>(builder.findings);
        sorted.sort(BY_RISK);
        this.findings = Collections.unmodifiableList(sorted);
        this.generatedAt = builder.generatedAt != null ? builder.generatedAt : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public List<String> getScanTypes() {
        return scanTypes;
    }

    public Optional<ScanOptions> getOptions() {
        return Optional.ofNullable(options);
    }

    public ScanStatistics getStatistics() {
        return statistics;
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    /**
     * Количество уязвимостей по уровню риска; все уровни присутствуют, от CRITICAL к INFO.
     */
    public Map<Severity, Long> countByRisk() {
        Map<Severity, Long> counts = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        findings.forEach(f -> counts.merge(f.getRisk(), 1L, Long::sum));
        return counts;
    }

    public Map<VulnerabilityClass, List<Finding>> groupByClass() {
        return findings.stream().collect(Collectors.groupingBy(
            Finding::getVulnerabilityClass,
            () -> new EnumMap<>(VulnerabilityClass.class),
            Collectors.toList()));
    }

    public boolean hasCriticalOrHigh() {
        return findings.stream().anyMatch(f -> f.getRisk().isCriticalOrHigh());
    }

    public static class Builder {
        private String targetUrl;
        private final List<String> scanTypes = new ArrayList<>();
        private ScanOptions options;
        private ScanStatistics statistics;
        private final List<Finding> findings = new ArrayList<>();
        private Instant generatedAt;

        public Builder targetUrl(String targetUrl) {
            this.targetUrl = targetUrl;
            return this;
        }

        public Builder scanTypes(Collection<String> scanTypes) {
            this.scanTypes.addAll(scanTypes);
            return this;
        }

        public Builder options(ScanOptions options) {
            this.options = options;
            return this;
        }

        public Builder statistics(ScanStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder findings(Collection<Finding> findings) {
            this.findings.addAll(findings);
            return this;
        }

        public Builder generatedAt(Instant generatedAt) {
            this.generatedAt = generatedAt;
            return this;
        }

        public ScanReport build() {
            return new ScanReport(this);
        }
    }
}
