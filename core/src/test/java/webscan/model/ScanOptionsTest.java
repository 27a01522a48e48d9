package webscan.model;

import org.junit.jupiter.api.Test;
import webscan.ScanConfigurationException;
import webscan.crawler.CrawlOptions;
import webscan.http.RateLimiterConfig;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ScanOptionsTest {

    @Test
    void testDefaults() {
        ScanOptions options = ScanOptions.builder().build();

        assertTrue(options.isCrawlEnabled());
        assertEquals(3, options.getMaxDepth());
        assertEquals(100, options.getMaxUrls());
        assertTrue(options.isFollowRobots());
        assertEquals(0, options.getMaxRequests());
        assertEquals(Duration.ofSeconds(1), options.getRequestDelay());
        assertEquals(5, options.getConcurrency());
        assertEquals(Duration.ofSeconds(30), options.getRequestTimeout());
        assertEquals(Duration.ofMinutes(30), options.getScanTimeout());
        assertEquals(0.5, options.getConfidenceThreshold());
        assertEquals(Duration.ofSeconds(2), options.getTimeBaseDelay());
        assertFalse(options.isAllowPrivateTargets());
        assertTrue(options.getCredentials().isEmpty());
    }

    @Test
    void testStrategyThresholds() {
        ScanOptions options = ScanOptions.builder().build();

        assertEquals(0.5, options.thresholdFor(DetectionStrategy.ERROR));
        assertEquals(0.5, options.thresholdFor(DetectionStrategy.TIME));
        assertEquals(0.7, options.thresholdFor(DetectionStrategy.UNION));
        assertEquals(0.7, options.thresholdFor(DetectionStrategy.REFLECTED));
        assertEquals(0.7, options.thresholdFor(DetectionStrategy.DOM));
        assertEquals(0.8, options.thresholdFor(DetectionStrategy.STORED));
    }

    @Test
    void testSpecificThresholdNeverBelowGlobal() {
        ScanOptions options = ScanOptions.builder().confidenceThreshold(0.85).build();

        assertEquals(0.85, options.thresholdFor(DetectionStrategy.UNION));
        assertEquals(0.85, options.thresholdFor(DetectionStrategy.STORED));
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(ScanConfigurationException.class, () -> ScanOptions.builder().concurrency(0).build());
        assertThrows(ScanConfigurationException.class, () -> ScanOptions.builder().maxDepth(-1).build());
        assertThrows(ScanConfigurationException.class, () -> ScanOptions.builder().confidenceThreshold(1.5).build());
        assertThrows(ScanConfigurationException.class, () -> ScanOptions.builder().scanTimeout(Duration.ZERO).build());
        assertThrows(ScanConfigurationException.class,
            () -> ScanOptions.builder().requestDelay(Duration.ofMillis(-1)).build());
    }

    @Test
    void testTimeBaseDelayMustBeWholeSeconds() {
        assertThrows(ScanConfigurationException.class,
            () -> ScanOptions.builder().timeBaseDelay(Duration.ofMillis(1500)).build());
        assertThrows(ScanConfigurationException.class,
            () -> ScanOptions.builder().timeBaseDelay(Duration.ofMillis(500)).build());
        assertEquals(Duration.ofSeconds(3), ScanOptions.builder().timeBaseDelay(Duration.ofSeconds(3)).build().getTimeBaseDelay());
    }

    @Test
    void testDerivedComponentConfigs() {
        ScanOptions options = ScanOptions.builder()
            .maxDepth(1)
            .maxUrls(10)
            .concurrency(2)
            .requestDelay(Duration.ofMillis(250))
            .cooldown(20, Duration.ofSeconds(5))
            .build();

        CrawlOptions crawl = options.toCrawlOptions();
        assertEquals(1, crawl.getMaxDepth());
        assertEquals(10, crawl.getMaxUrls());

        RateLimiterConfig limiter = options.toRateLimiterConfig();
        assertEquals(Duration.ofMillis(250), limiter.getMinDelay());
        assertEquals(2, limiter.getMaxConcurrent());
        assertEquals(20, limiter.getCooldownThreshold());
        assertEquals(Duration.ofSeconds(5), limiter.getCooldownTime());
    }
}
