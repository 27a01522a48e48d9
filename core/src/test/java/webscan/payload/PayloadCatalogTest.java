package webscan.payload;

import org.junit.jupiter.api.Test;
import webscan.model.DetectionStrategy;
import webscan.model.Severity;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PayloadCatalogTest {

    @Test
    void testSqlCatalogCoversEveryStrategy() {
        PayloadCatalog catalog = SqlInjectionPayloads.defaultCatalog();

        assertFalse(catalog.forStrategy(DetectionStrategy.ERROR).isEmpty());
        assertEquals(8, catalog.forStrategy(DetectionStrategy.BOOLEAN).size());
        assertFalse(catalog.forStrategy(DetectionStrategy.UNION).isEmpty());
        assertFalse(catalog.standard(DetectionStrategy.TIME).isEmpty());
        assertEquals(4, catalog.aggressive(DetectionStrategy.TIME).size());
        assertTrue(catalog.forStrategy(DetectionStrategy.REFLECTED).isEmpty());
        assertTrue(catalog.all().stream().allMatch(p -> p.getCweId().orElse("").equals("CWE-89")));
    }

    @Test
    void testTraversalCatalogKeepsEncodedVariantsAggressive() {
        PayloadCatalog catalog = PathTraversalPayloads.defaultCatalog();
        List<Payload> standard = catalog.standard(DetectionStrategy.FILE_DISCLOSURE);
        List<Payload> encoded = catalog.aggressive(DetectionStrategy.FILE_DISCLOSURE);

        assertEquals("../../../etc/passwd", standard.get(0).getValue());
        assertTrue(standard.stream().noneMatch(p -> PathTraversalPayloads.isPreEncoded(p.getValue())));
        assertTrue(encoded.stream().allMatch(p -> PathTraversalPayloads.isPreEncoded(p.getValue())));
        assertTrue(encoded.stream().anyMatch(p -> p.getValue().startsWith("%252e%252e%252f")));
        assertTrue(catalog.all().stream().allMatch(p -> p.getCweId().orElse("").equals("CWE-22")));
    }

    @Test
    void testUnionColumnProbesFollowConfiguredMaximum() {
        PayloadCatalog catalog = SqlInjectionPayloads.catalog(3, 2);

        List<String> values = catalog.forStrategy(DetectionStrategy.UNION).stream().map(Payload::getValue).toList();

        assertTrue(values.contains("' UNION SELECT NULL--"));
        assertTrue(values.contains("' UNION SELECT NULL,NULL,NULL--"));
        assertFalse(values.contains("' UNION SELECT NULL,NULL,NULL,NULL--"));
    }

    @Test
    void testTimePayloadsCarryDelayAndDialect() {
        PayloadCatalog catalog = SqlInjectionPayloads.catalog(5, 4);

        for (Payload payload : catalog.forStrategy(DetectionStrategy.TIME)) {
            assertFalse(payload.getValue().contains("{delay}"), payload.getName());
            assertTrue(payload.getDialect().isPresent(), payload.getName());
        }
        assertTrue(catalog.standard(DetectionStrategy.TIME).stream()
            .anyMatch(p -> p.getValue().equals("1' AND SLEEP(4)-- ")));
    }

    @Test
    void testInvalidCatalogArguments() {
        assertThrows(IllegalArgumentException.class, () -> SqlInjectionPayloads.catalog(0, 2));
        assertThrows(IllegalArgumentException.class, () -> SqlInjectionPayloads.catalog(5, 0));
    }

    @Test
    void testXssPayloadsCarryMarker() {
        PayloadCatalog catalog = XssPayloads.defaultCatalog();

        assertFalse(catalog.forStrategy(DetectionStrategy.REFLECTED).isEmpty());
        assertEquals(2, catalog.forStrategy(DetectionStrategy.DOM).size());
        assertEquals(2, catalog.forStrategy(DetectionStrategy.STORED).size());
        assertTrue(catalog.forStrategy(DetectionStrategy.STORED).stream()
            .allMatch(p -> p.getRisk() == Severity.CRITICAL));
        for (Payload payload : catalog.all()) {
            assertTrue(payload.hasMarker(), payload.getName());
            assertTrue(payload.render("XSSMARKzzzzzzzzXSSMARK").contains("XSSMARKzzzzzzzzXSSMARK"));
        }
    }

    @Test
    void testMarkerGeneratorFormat() {
        MarkerGenerator generator = new MarkerGenerator(new Random(42));

        String marker = generator.next();
        String tag = generator.nextTag();

        assertTrue(marker.matches("XSSMARK[A-Za-z0-9]{8}XSSMARK"), marker);
        assertTrue(tag.matches("wst[A-Za-z0-9]{8}"), tag);
        assertNotEquals(marker, generator.next());
    }

    @Test
    void testEncoderEscapesFilterSensitiveCharacters() {
        assertEquals("%3Cscript%3E", PayloadEncoder.urlEncode("<script>"));
        assertEquals("%253Cscript%253E", PayloadEncoder.doubleUrlEncode("<script>"));
        assertEquals("'%20OR%20'1'='1", PayloadEncoder.urlEncode("' OR '1'='1"));
        assertEquals("plain", PayloadEncoder.doubleUrlEncode("plain"));
    }
}
