package webscan.report;

import java.util.Locale;

/**
 * Поддерживаемые форматы отчета.
 */
public enum ReportFormat {
    /** Текстовая сводка для терминала, с ANSI цветами по желанию. */
    CONSOLE("Console summary"),

    /** JSON для CI/CD и программной обработки. */
    JSON("JSON document");

    private final String description;

    ReportFormat(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @throws IllegalArgumentException for an unknown format name
     */
    public static ReportFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Report format cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + value, e);
        }
    }
}
