package webscan.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FindingTest {

    private static Finding.Builder validFinding() {
        return Finding.builder()
            .title("SQL Injection (error-based)")
            .strategy(DetectionStrategy.ERROR)
            .risk(Severity.HIGH)
            .confidence(0.9)
            .endpoint("http://example.com/item")
            .parameter("id")
            .parameterLocation(ParameterLocation.QUERY)
            .payload("'");
    }

    @Test
    void testDefaultsAreDerivedFromStrategy() {
        Finding finding = validFinding().method("get").addEvidence("database", "MySQL").build();

        assertEquals(VulnerabilityClass.SQL_INJECTION, finding.getVulnerabilityClass());
        assertEquals("CWE-89", finding.getCweId());
        assertEquals("GET", finding.getMethod());
        assertNotNull(finding.getId());
        assertNotNull(finding.getDiscoveredAt());
        assertEquals(Map.of("database", "MySQL"), finding.getEvidence());
        assertTrue(finding.getExchange().isEmpty());
    }

    @Test
    void testConfidenceMustBeWithinUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> validFinding().confidence(1.01).build());
        assertThrows(IllegalArgumentException.class, () -> validFinding().confidence(-0.1).build());
        assertThrows(IllegalArgumentException.class, () -> validFinding().confidence(Double.NaN).build());
        assertDoesNotThrow(() -> validFinding().confidence(1.0).build());
        assertDoesNotThrow(() -> validFinding().confidence(0.0).build());
    }

    @Test
    void testRequiredTextFields() {
        assertThrows(IllegalArgumentException.class, () -> validFinding().endpoint("").build());
        assertThrows(IllegalArgumentException.class, () -> validFinding().parameter(null).build());
        assertThrows(IllegalArgumentException.class, () -> validFinding().payload("").build());
        assertThrows(NullPointerException.class, () -> validFinding().strategy(null).build());
    }

    @Test
    void testEvidenceIsImmutable() {
        Finding finding = validFinding().addEvidence("k", "v").build();

        assertThrows(UnsupportedOperationException.class, () -> finding.getEvidence().put("x", "y"));
        assertThrows(UnsupportedOperationException.class, () -> finding.getRemediation().add("step"));
    }

    @Test
    void testXssStrategyMapsToXssClass() {
        Finding finding = validFinding().strategy(DetectionStrategy.STORED).risk(Severity.CRITICAL).build();

        assertEquals(VulnerabilityClass.XSS, finding.getVulnerabilityClass());
        assertEquals("CWE-79", finding.getCweId());
    }
}
