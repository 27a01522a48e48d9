package webscan.report;

import org.junit.jupiter.api.Test;
import webscan.model.Finding;
import webscan.model.Severity;
import webscan.model.VulnerabilityClass;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScanReportTest {

    @Test
    void testFindingsSortedByRisk() {
        ScanReport report = ReportFixtures.report(List.of(ReportFixtures.sqlError(), ReportFixtures.storedXss()));

        List<Finding> findings = report.getFindings();
        assertEquals("f-2", findings.get(0).getId());
        assertEquals("f-1", findings.get(1).getId());
        assertTrue(report.hasCriticalOrHigh());
    }

    @Test
    void testCountByRiskListsEverySeverity() {
        ScanReport report = ReportFixtures.report(List.of(ReportFixtures.sqlError()));

        Map<Severity, Long> counts = report.countByRisk();
        assertEquals(Severity.values().length, counts.size());
        assertEquals(1L, counts.get(Severity.HIGH));
        assertEquals(0L, counts.get(Severity.CRITICAL));
    }

    @Test
    void testGroupByClass() {
        ScanReport report = ReportFixtures.report(List.of(ReportFixtures.sqlError(), ReportFixtures.storedXss()));

        Map<VulnerabilityClass, List<Finding>> groups = report.groupByClass();
        assertEquals(1, groups.get(VulnerabilityClass.SQL_INJECTION).size());
        assertEquals(1, groups.get(VulnerabilityClass.XSS).size());
    }

    @Test
    void testStatisticsRequired() {
        ScanReport.Builder builder = ScanReport.builder().targetUrl("http://example.com/");

        assertThrows(NullPointerException.class, builder::build);
    }

    @Test
    void testEmptyReport() {
        ScanReport report = ReportFixtures.report(List.of());

        assertTrue(report.getFindings().isEmpty());
        assertFalse(report.hasCriticalOrHigh());
        assertTrue(report.groupByClass().isEmpty());
    }
}
