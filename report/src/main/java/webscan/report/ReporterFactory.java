package webscan.report;

import java.util.Objects;

/**
 * Фабрика генераторов отчетов.
 */
public final class ReporterFactory {

    private ReporterFactory() {
    }

    /**
     * @param useColors ANSI colors, only meaningful for {@link ReportFormat#CONSOLE}
     */
    public static Reporter create(ReportFormat format, boolean useColors) {
        Objects.requireNonNull(format, "format cannot be null");
        return switch (format) {
            case CONSOLE -> new ConsoleReporter(useColors);
            case JSON -> new JsonReporter();
        };
    }

    public static Reporter create(ReportFormat format) {
        return create(format, false);
    }
}
