package webscan.report;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    private static String render(ConsoleReporter reporter, ScanReport report) throws IOException {
        StringWriter out = new StringWriter();
        reporter.generate(report, out);
        return out.toString();
    }

    @Test
    void testSummaryAndFindings() throws IOException {
        String output = render(new ConsoleReporter(false),
            ReportFixtures.report(List.of(ReportFixtures.sqlError(), ReportFixtures.storedXss())));

        assertTrue(output.contains("Target: http://example.com/"));
        assertTrue(output.contains("Status: COMPLETED"));
        assertTrue(output.contains("Duration: 1m 35s"));
        assertTrue(output.contains("Requests sent:    431"));
        assertTrue(output.contains("SQL Injection (1)"));
        assertTrue(output.contains("[CRITICAL] Stored Cross-Site Scripting"));
        assertTrue(output.contains("Parameter: id (query)"));
        assertTrue(output.contains("Confidence: 80%"));
        assertTrue(output.contains("database: MySQL"));
        assertTrue(output.contains("- Use prepared statements"));
        assertFalse(output.contains("\u001B["));
    }

    @Test
    void testNoFindings() throws IOException {
        String output = render(new ConsoleReporter(false), ReportFixtures.report(List.of()));

        assertTrue(output.contains("No vulnerabilities found"));
    }

    @Test
    void testColorsEnabled() throws IOException {
        String output = render(new ConsoleReporter(true), ReportFixtures.report(List.of(ReportFixtures.sqlError())));

        assertTrue(output.contains("\u001B["));
    }
}
