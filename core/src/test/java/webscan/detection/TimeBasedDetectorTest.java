package webscan.detection;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeBasedDetectorTest {

    private final TimeBasedDetector detector = new TimeBasedDetector(Duration.ofSeconds(2));

    private static TimingBaseline baseline(long... millis) {
        return TimingBaseline.of(Arrays.stream(millis).mapToObj(Duration::ofMillis).toList());
    }

    @Test
    void testThresholdIsMeanPlusThreeSigmaPlusDelay() {
        TimingBaseline timing = baseline(100, 200, 300);

        assertEquals(0.2, timing.getMeanSeconds(), 1e-9);
        assertEquals(Math.sqrt(2.0 / 300), timing.getStdDevSeconds(), 1e-9);
        assertEquals(0.2 + 3 * Math.sqrt(2.0 / 300) + 2.0, timing.thresholdSeconds(Duration.ofSeconds(2)), 1e-9);
    }

    @Test
    void testSlowProbeAndVerificationAreHighConfidence() {
        TimingBaseline timing = baseline(100, 100, 100);

        assertTrue(detector.exceedsThreshold(timing, Duration.ofMillis(5200)));
        DetectionResult result = detector.evaluate(timing, Duration.ofMillis(5200), Duration.ofMillis(5300));

        assertTrue(result.isVulnerable());
        assertEquals(0.9, result.getConfidence(), 0.001);
        assertEquals(5.1, (double) result.getEvidence().get("observed_delay_seconds"), 0.001);
    }

    @Test
    void testModerateDelayIsMediumConfidence() {
        TimingBaseline timing = baseline(100, 100, 100);

        DetectionResult result = detector.evaluate(timing, Duration.ofMillis(2500), Duration.ofMillis(2400));

        assertTrue(result.isVulnerable());
        assertEquals(0.7, result.getConfidence(), 0.001);
    }

    @Test
    void testFastVerificationRejectsFinding() {
        TimingBaseline timing = baseline(100, 100, 100);

        DetectionResult result = detector.evaluate(timing, Duration.ofMillis(5000), Duration.ofMillis(200));

        assertFalse(result.isVulnerable());
    }

    @Test
    void testNoisyBaselineRaisesThreshold() {
        TimingBaseline noisy = baseline(100, 1500, 2900);

        assertFalse(detector.exceedsThreshold(noisy, Duration.ofMillis(5000)));
    }

    @Test
    void testConfidenceBands() {
        assertEquals(0.9, TimeBasedDetector.confidenceFor(4.0));
        assertEquals(0.7, TimeBasedDetector.confidenceFor(2.0));
        assertEquals(0.5, TimeBasedDetector.confidenceFor(1.2));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TimeBasedDetector(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> TimingBaseline.of(List.of()));
    }
}
