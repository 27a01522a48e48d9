package webscan.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ScanStatisticsTrackerTest {

    private ScanStatisticsTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ScanStatisticsTracker("scan-1",
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testLifecycle() {
        assertEquals(ScanStatus.PENDING, tracker.getStatus());
        tracker.start();
        assertEquals(ScanStatus.RUNNING, tracker.getStatus());

        assertTrue(tracker.finish(ScanStatus.COMPLETED));
        assertFalse(tracker.finish(ScanStatus.FAILED));
        assertEquals(ScanStatus.COMPLETED, tracker.getStatus());
        assertEquals(ScanPhase.FINISHED, tracker.getPhase());
    }

    @Test
    void testFinishRequiresTerminalStatus() {
        assertThrows(IllegalArgumentException.class, () -> tracker.finish(ScanStatus.RUNNING));
    }

    @Test
    void testCountersInSnapshot() {
        AtomicLong requests = new AtomicLong(42);
        tracker.bindRequestCounter(requests::get);
        tracker.start();
        tracker.urlCrawled("http://example.com/");
        tracker.urlCrawled("http://example.com/a");
        tracker.formsDiscovered(3);
        tracker.formTested("POST http://example.com/sign name,");
        tracker.formTested("POST http://example.com/sign name,");
        tracker.pluginExecuted();
        tracker.findingRecorded("sql_injection");
        tracker.findingRecorded("sql_injection");
        tracker.findingRecorded("xss");
        tracker.recordError("first");
        tracker.recordError("second");

        ScanStatistics stats = tracker.snapshot();

        assertEquals("scan-1", stats.getScanId());
        assertEquals(2, stats.getUrlsCrawled());
        assertEquals(3, stats.getFormsDiscovered());
        assertEquals(1, stats.getFormsTested());
        assertEquals(42, stats.getRequestsSent());
        assertEquals(3, stats.getVulnerabilitiesFound());
        assertEquals(1, stats.getPluginsExecuted());
        assertEquals(Map.of("sql_injection", 2, "xss", 1), stats.getFindingsByPlugin());
        assertEquals("http://example.com/a", stats.getCurrentUrl().orElseThrow());
        assertEquals("first", stats.getErrorMessage().orElseThrow());
        assertEquals(Duration.ZERO, stats.getElapsed());
        assertFalse(stats.isTimedOut());
    }

    @Test
    void testTimeoutFlag() {
        tracker.markTimedOut();

        assertTrue(tracker.snapshot().isTimedOut());
    }
}
