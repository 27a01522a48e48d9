package webscan.model;

import java.util.Locale;

/**
 * Стратегия обнаружения, которой помечаются полезные нагрузки и найденные уязвимости.
 * Каждая стратегия относится ровно к одному классу уязвимостей.
 */
public enum DetectionStrategy {
    ERROR("error", VulnerabilityClass.SQL_INJECTION),
    BOOLEAN("boolean", VulnerabilityClass.SQL_INJECTION),
    UNION("union", VulnerabilityClass.SQL_INJECTION),
    TIME("time", VulnerabilityClass.SQL_INJECTION),
    REFLECTED("reflected", VulnerabilityClass.XSS),
    STORED("stored", VulnerabilityClass.XSS),
    DOM("dom", VulnerabilityClass.XSS),
    FILE_DISCLOSURE("file_disclosure", VulnerabilityClass.PATH_TRAVERSAL);

    private final String tag;
    private final VulnerabilityClass vulnerabilityClass;

    DetectionStrategy(String tag, VulnerabilityClass vulnerabilityClass) {
        this.tag = tag;
        this.vulnerabilityClass = vulnerabilityClass;
    }

    public String getTag() {
        return tag;
    }

    public VulnerabilityClass getVulnerabilityClass() {
        return vulnerabilityClass;
    }

    public static DetectionStrategy fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Strategy tag cannot be null");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (DetectionStrategy strategy : values()) {
            if (strategy.tag.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown detection strategy: " + tag);
    }
}
