package webscan.model;

import java.util.Locale;

/**
 * Уровни риска для найденных уязвимостей и полезных нагрузок.
 * Определяет приоритет каждого уровня для сортировки и группировки в отчетах.
 */
public enum Severity {
    CRITICAL("critical", 4),
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1),
    INFO("info", 0);

    private final String tag;
    private final int priority;

    Severity(String tag, int priority) {
        this.tag = tag;
        this.priority = priority;
    }

    public String getTag() {
        return tag;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isCriticalOrHigh() {
        return this == CRITICAL || this == HIGH;
    }

    public static Severity fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Severity tag cannot be null");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.tag.equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + tag);
    }
}
