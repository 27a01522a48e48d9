package webscan.security;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TargetGuardTest {

    private static HostResolver resolvingTo(String address) {
        return host -> new InetAddress[]{InetAddress.getByName(address)};
    }

    @Test
    void testPublicTargetAccepted() {
        TargetGuard guard = TargetGuard.builder().resolver(resolvingTo("93.184.216.34")).build();

        assertDoesNotThrow(() -> guard.check("https://example.com/index.php?id=1"));
    }

    @Test
    void testLoopbackRejectedByDefault() {
        TargetGuard guard = TargetGuard.builder().resolver(resolvingTo("127.0.0.1")).build();

        TargetRejectedException e = assertThrows(TargetRejectedException.class,
            () -> guard.check("http://localhost:8080/"));
        assertEquals("localhost", e.getHost());
        assertTrue(e.getMessage().contains("restricted address"));
    }

    @Test
    void testPrivateAndMetadataRangesRejected() {
        for (String address : List.of("10.1.2.3", "192.168.0.10", "172.16.5.5", "169.254.169.254", "100.64.0.1", "0.0.0.0")) {
            TargetGuard guard = TargetGuard.builder().resolver(resolvingTo(address)).build();
            assertThrows(TargetRejectedException.class, () -> guard.check("http://internal.example/"),
                "expected rejection for " + address);
        }
    }

    @Test
    void testIpv6UniqueLocalRejected() throws UnknownHostException {
        assertTrue(TargetGuard.isRestricted(InetAddress.getByName("fd00::1")));
        assertTrue(TargetGuard.isRestricted(InetAddress.getByName("::1")));
        assertFalse(TargetGuard.isRestricted(InetAddress.getByName("2606:2800:220:1::1")));
    }

    @Test
    void testPrivateTargetsAllowedWhenEnabled() {
        TargetGuard guard = TargetGuard.builder()
            .allowPrivateTargets(true)
            .resolver(host -> {
                throw new AssertionError("resolver must not be consulted");
            })
            .build();

        assertDoesNotThrow(() -> guard.check("http://127.0.0.1:8080/"));
    }

    @Test
    void testNonHttpSchemeRejected() {
        TargetGuard guard = TargetGuard.builder().allowPrivateTargets(true).build();

        assertThrows(TargetRejectedException.class, () -> guard.check("file:///etc/passwd"));
        assertThrows(TargetRejectedException.class, () -> guard.check("gopher://example.com/"));
    }

    @Test
    void testDenyListCoversSubdomains() {
        TargetGuard guard = TargetGuard.builder()
            .deniedHosts(List.of("corp.example"))
            .resolver(resolvingTo("93.184.216.34"))
            .build();

        assertThrows(TargetRejectedException.class, () -> guard.check("https://admin.corp.example/"));
        assertDoesNotThrow(() -> guard.check("https://example.org/"));
    }

    @Test
    void testAllowListRestrictsTargets() {
        TargetGuard guard = TargetGuard.builder()
            .allowedHosts(List.of("testphp.vulnweb.com"))
            .resolver(resolvingTo("44.228.249.3"))
            .build();

        assertDoesNotThrow(() -> guard.check("http://testphp.vulnweb.com/artists.php?artist=1"));
        assertThrows(TargetRejectedException.class, () -> guard.check("http://other.example/"));
    }

    @Test
    void testUnresolvableHostRejected() {
        TargetGuard guard = TargetGuard.builder()
            .resolver(host -> {
                throw new UnknownHostException(host);
            })
            .build();

        assertThrows(TargetRejectedException.class, () -> guard.check("http://no-such-host.invalid/"));
    }

    @Test
    void testPermitsChecksEachHostOnce() {
        AtomicInteger lookups = new AtomicInteger();
        TargetGuard guard = TargetGuard.builder()
            .resolver(host -> {
                lookups.incrementAndGet();
                String address = host.startsWith("admin.") ? "10.0.0.5" : "93.184.216.34";
                return new InetAddress[]{InetAddress.getByName(address)};
            })
            .build();

        assertTrue(guard.permits("http://www.example.com/"));
        assertTrue(guard.permits("http://www.example.com/search?q=1"));
        assertFalse(guard.permits("http://admin.example.com/"));
        assertFalse(guard.permits("http://admin.example.com/users"));
        assertFalse(guard.permits("http://exa mple.com/"));
        assertEquals(2, lookups.get());
    }
}
