package webscan.crawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrlNormalizerTest {

    @Test
    void testLowercasesSchemeAndHostAndDropsDefaultPort() {
        assertEquals("http://example.com/Path", UrlNormalizer.normalize("HTTP://Example.COM:80/Path"));
        assertEquals("https://example.com/", UrlNormalizer.normalize("https://example.com:443"));
        assertEquals("http://example.com:8080/", UrlNormalizer.normalize("http://example.com:8080/"));
    }

    @Test
    void testStripsFragmentAndTrailingSlash() {
        assertEquals("http://example.com/docs", UrlNormalizer.normalize("http://example.com/docs/#intro"));
    }

    @Test
    void testResolvesDotSegmentsAndSortsQuery() {
        assertEquals("http://example.com/b/c?a=1&b=2",
            UrlNormalizer.normalize("http://example.com/a/../b/./c?b=2&a=1"));
    }

    @Test
    void testIsIdempotent() {
        List<String> urls = List.of(
            "HTTP://Example.com:80/a/../b/?z=1&y=2#frag",
            "https://shop.example.co.uk/cart?item=3",
            "http://example.com",
            "http://10.0.0.1:8080/x/y/"
        );
        for (String url : urls) {
            String once = UrlNormalizer.normalize(url);
            assertEquals(once, UrlNormalizer.normalize(once), "not idempotent for " + url);
        }
    }

    @Test
    void testRejectsNonHttpUrls() {
        assertThrows(IllegalArgumentException.class, () -> UrlNormalizer.normalize("ftp://example.com/"));
        assertThrows(IllegalArgumentException.class, () -> UrlNormalizer.normalize("/relative/path"));
        assertThrows(IllegalArgumentException.class, () -> UrlNormalizer.normalize("http://exa mple.com/"));
        assertThrows(IllegalArgumentException.class, () -> UrlNormalizer.normalize(null));
    }

    @Test
    void testResolveRelativeReference() {
        assertEquals("http://example.com/a/page2",
            UrlNormalizer.resolve("http://example.com/a/page1", "page2").orElseThrow());
        assertEquals("http://example.com/search?q=x&sort=asc",
            UrlNormalizer.resolve("http://example.com/a/", "/search?sort=asc&amp;q=x").orElseThrow());
        assertTrue(UrlNormalizer.resolve("http://example.com/", "mailto:admin@example.com").isEmpty());
    }

    @Test
    void testWithoutQuery() {
        assertEquals("http://example.com/item", UrlNormalizer.withoutQuery("http://example.com/item?id=1#x"));
    }
}
