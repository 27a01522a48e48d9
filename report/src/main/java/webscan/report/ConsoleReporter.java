package webscan.report;

import webscan.model.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Console-based reporter with optional colored output.
 */
public final class ConsoleReporter implements Reporter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_GRAY = "\u001B[90m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private final boolean useColors;

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    public ConsoleReporter() {
        this(true);
    }

    @Override
    public void generate(ScanReport report, Writer out) throws IOException {
        PrintWriter writer = new PrintWriter(out);
        ScanStatistics stats = report.getStatistics();

        printHeader(writer, "Web Injection Scanner");
        writer.println("Target: " + report.getTargetUrl());
        writer.println("Scan types: " + colorize(String.join(", ", report.getScanTypes()), ANSI_CYAN));
        writer.println("Status: " + colorize(stats.getStatus().name(), statusColor(stats.getStatus()))
            + (stats.isTimedOut() ? colorize(" (timed out, partial results)", ANSI_YELLOW) : ""));
        writer.println("Duration: " + formatDuration(stats.getElapsed()));
        stats.getErrorMessage().ifPresent(error -> writer.println(colorize("ERROR: ", ANSI_RED) + error));

        printSection(writer, "Statistics");
        writer.println("  URLs crawled:     " + stats.getUrlsCrawled());
        writer.println("  Forms discovered: " + stats.getFormsDiscovered());
        writer.println("  Forms tested:     " + stats.getFormsTested());
        writer.println("  Requests sent:    " + stats.getRequestsSent());
        writer.println("  Plugins executed: " + stats.getPluginsExecuted());

        printSection(writer, "Findings");
        if (report.getFindings().isEmpty()) {
            writer.println(colorize("✓ ", ANSI_GREEN) + "No vulnerabilities found");
        } else {
            for (Map.Entry<Severity, Long> entry : report.countByRisk().entrySet()) {
                if (entry.getValue() > 0) {
                    writer.println("  " + colorize(entry.getKey().name(), severityColor(entry.getKey()))
                        + ": " + entry.getValue());
                }
            }
            for (Map.Entry<VulnerabilityClass, List<Finding>> group : report.groupByClass().entrySet()) {
                printSection(writer, group.getKey().getDisplayName() + " (" + group.getValue().size() + ")");
                group.getValue().forEach(finding -> printFinding(writer, finding));
            }
        }

        writer.println();
        writer.flush();
    }

    private void printFinding(PrintWriter writer, Finding finding) {
        writer.println();
        writer.println(colorize("[" + finding.getRisk().name() + "] ", severityColor(finding.getRisk()))
            + colorize(finding.getTitle(), ANSI_BOLD));
        writer.println("  " + finding.getMethod() + " " + finding.getEndpoint());
        writer.println("  Parameter: " + finding.getParameter()
            + " (" + finding.getParameterLocation().name().toLowerCase(Locale.ROOT) + ")");
        writer.println("  Strategy: " + finding.getStrategy().getTag()
            + String.format(" | Confidence: %.0f%%", finding.getConfidence() * 100));
        writer.println("  Payload: " + colorize(finding.getPayload(), ANSI_GRAY));
        if (!finding.getEvidence().isEmpty()) {
            writer.println("  Evidence:");
            finding.getEvidence().forEach((key, value) -> writer.println("    " + key + ": " + value));
        }
        if (!finding.getRemediation().isEmpty()) {
            writer.println("  Remediation:");
            finding.getRemediation().forEach(step -> writer.println("    - " + step));
        }
    }

    private void printHeader(PrintWriter writer, String title) {
        writer.println(colorize("=".repeat(60), ANSI_BOLD + ANSI_BLUE));
        writer.println(colorize(title, ANSI_BOLD + ANSI_BLUE));
        writer.println(colorize("=".repeat(60), ANSI_BOLD + ANSI_BLUE));
        writer.println();
    }

    private void printSection(PrintWriter writer, String title) {
        writer.println();
        writer.println(colorize(title, ANSI_BOLD + ANSI_BLUE));
        writer.println(colorize("-".repeat(60), ANSI_BLUE));
    }

    private String statusColor(ScanStatus status) {
        return switch (status) {
            case COMPLETED -> ANSI_GREEN;
            case FAILED -> ANSI_RED;
            case CANCELLED -> ANSI_YELLOW;
            default -> ANSI_CYAN;
        };
    }

    private String severityColor(Severity severity) {
        return switch (severity) {
            case CRITICAL, HIGH -> ANSI_RED;
            case MEDIUM -> ANSI_YELLOW;
            case LOW -> ANSI_BLUE;
            case INFO -> ANSI_GRAY;
        };
    }

    private String colorize(String text, String colorCode) {
        if (!useColors) {
            return text;
        }
        return colorCode + text + ANSI_RESET;
    }

    private String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        long minutes = seconds / 60;
        long remainingSeconds = seconds % 60;
        return minutes + "m " + remainingSeconds + "s";
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CONSOLE;
    }
}
