package webscan.scanner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import webscan.model.VulnerabilityClass;
import webscan.scanner.sqlinjection.SqlInjectionPlugin;
import webscan.scanner.traversal.PathTraversalPlugin;
import webscan.scanner.xss.XssPlugin;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    private PluginRegistry registry;

    @BeforeEach
    void setUp() {
        registry = PluginRegistry.withDefaults();
    }

    @Test
    void testDefaultPlugins() {
        assertEquals(List.of("sql_injection", "xss", "path_traversal"), registry.availablePluginNames());
        assertTrue(registry.contains("xss"));
        assertFalse(registry.contains("csrf"));
    }

    @Test
    void testCreateReturnsFreshInstances() {
        ScannerPlugin first = registry.create(SqlInjectionPlugin.NAME).orElseThrow();
        ScannerPlugin second = registry.create(SqlInjectionPlugin.NAME).orElseThrow();

        assertNotSame(first, second);
        assertEquals(VulnerabilityClass.SQL_INJECTION, first.getVulnerabilityClass());
        assertInstanceOf(XssPlugin.class, registry.create(XssPlugin.NAME).orElseThrow());
        assertEquals(VulnerabilityClass.PATH_TRAVERSAL,
            registry.create(PathTraversalPlugin.NAME).orElseThrow().getVulnerabilityClass());
    }

    @Test
    void testUnknownPluginIsEmpty() {
        assertEquals(Optional.empty(), registry.create("ldap_injection"));
    }

    @Test
    void testDuplicateRegistrationFails() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("xss", XssPlugin::new));
    }

    @Test
    void testFailingFactoryYieldsEmpty() {
        registry.register("broken", () -> {
            throw new IllegalStateException("cannot build");
        });

        assertTrue(registry.contains("broken"));
        assertTrue(registry.create("broken").isEmpty());
    }
}
