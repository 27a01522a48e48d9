package webscan.crawler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import webscan.http.*;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WebCrawlerTest {

    @Mock
    private HttpClient httpClient;

    private final Map<String, HttpResponse> site = new HashMap<>();
    private ExecutionControl control;

    @BeforeEach
    void setUp() throws IOException {
        control = ExecutionControl.unlimited();
        when(httpClient.execute(any(), any())).thenAnswer(invocation -> {
            HttpRequest request = invocation.getArgument(0);
            HttpResponse response = site.get(request.getUrl());
            return response != null ? response : HttpResponse.builder().statusCode(404).build();
        });
    }

    private void page(String url, String html) {
        site.put(url, HttpResponse.builder()
            .statusCode(200)
            .addHeader("Content-Type", "text/html; charset=utf-8")
            .body(html)
            .url(url)
            .build());
    }

    private WebCrawler crawler(CrawlOptions options, CrawlListener listener) {
        return new WebCrawler(executor(), options, listener);
    }

    private RequestExecutor executor() {
        return RequestExecutor.builder(httpClient)
            .rateLimiter(new RateLimiter(RateLimiterConfig.builder()
                .minDelay(Duration.ZERO)
                .initialRequestsPerSecond(1000)
                .requestsPerSecondBounds(1, 1000)
                .build(), duration -> { }, System::nanoTime))
            .retryPolicy(RetryPolicy.noRetry())
            .control(control)
            .sleeper(duration -> { })
            .build();
    }

    @Test
    void testDiscoversInScopeLinksAndForms() {
        page("http://example.com/", """
            <a href="/a">A</a>
            <a href="http://other.com/x">external</a>
            <link href="/style.css">
            <form action="/search"><input name="q"></form>
            """);
        page("http://example.com/a", "<a href='/a?id=7'>item</a>");

        CrawlResult result = crawler(CrawlOptions.builder().maxDepth(2).followRobots(false).build(),
            CrawlListener.noOp()).crawl("http://example.com");

        assertTrue(result.getUrls().contains("http://example.com/"));
        assertTrue(result.getUrls().contains("http://example.com/a"));
        assertTrue(result.getUrls().contains("http://example.com/a?id=7"));
        assertTrue(result.getUrls().contains("http://example.com/search"));
        assertFalse(result.getUrls().contains("http://other.com/x"));
        assertFalse(result.getUrls().contains("http://example.com/style.css"));
        assertEquals(1, result.getForms().size());
        assertEquals("http://example.com/search", result.getForms().get(0).getAction());
    }

    @Test
    void testRespectsRobotsDisallow() throws IOException {
        site.put("http://example.com/robots.txt", HttpResponse.builder()
            .statusCode(200)
            .body("User-agent: *\nDisallow: /admin\n")
            .build());
        page("http://example.com/", "<a href=\"/admin/panel\">admin</a><a href=\"/public\">public</a>");

        CrawlResult result = crawler(CrawlOptions.builder().maxDepth(2).build(), CrawlListener.noOp())
            .crawl("http://example.com/");

        assertFalse(result.getUrls().contains("http://example.com/admin/panel"));
        assertTrue(result.getUrls().contains("http://example.com/public"));
        verify(httpClient, never()).execute(argThat(r -> r != null && r.getUrl().contains("/admin")), any());
    }

    @Test
    void testStopsAtMaxDepth() throws IOException {
        page("http://example.com/", "<a href=\"/level1\">1</a>");
        page("http://example.com/level1", "<a href=\"/level2\">2</a>");
        page("http://example.com/level2", "<a href=\"/level3\">3</a>");

        List<String> crawled = new ArrayList<>();
        crawler(CrawlOptions.builder().maxDepth(1).followRobots(false).build(),
            (url, depth) -> crawled.add(depth + ":" + url)).crawl("http://example.com/");

        assertEquals(List.of("0:http://example.com/", "1:http://example.com/level1"), crawled);
        verify(httpClient, never()).execute(argThat(r -> r != null && r.getUrl().endsWith("/level2")), any());
    }

    @Test
    void testRespectsMaxUrls() {
        StringBuilder links = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            links.append("<a href=\"/p").append(i).append("\">p</a>");
        }
        page("http://example.com/", links.toString());

        CrawlResult result = crawler(CrawlOptions.builder().maxUrls(5).followRobots(false).build(),
            CrawlListener.noOp()).crawl("http://example.com/");

        assertTrue(result.getUrls().size() <= 5);
    }

    @Test
    void testRedirectTargetIsFollowedAsLink() {
        site.put("http://example.com/", HttpResponse.builder()
            .statusCode(302)
            .addHeader("Location", "/home")
            .build());
        page("http://example.com/home", "<p>welcome</p>");

        CrawlResult result = crawler(CrawlOptions.builder().followRobots(false).build(), CrawlListener.noOp())
            .crawl("http://example.com/");

        assertTrue(result.getUrls().contains("http://example.com/home"));
    }

    @Test
    void testFilteredHostsAreNotQueued() throws IOException {
        page("http://www.example.com/", "<a href=\"http://admin.example.com/\">admin</a><a href=\"/news\">news</a>");
        page("http://www.example.com/news", "<p>news</p>");
        page("http://admin.example.com/", "<a href=\"http://admin.example.com/users\">users</a>");

        CrawlResult result = new WebCrawler(executor(), CrawlOptions.builder().followRobots(false).build(),
            CrawlListener.noOp(), url -> !url.startsWith("http://admin.")).crawl("http://www.example.com/");

        assertTrue(result.getUrls().contains("http://www.example.com/news"));
        assertFalse(result.getUrls().contains("http://admin.example.com/"));
        verify(httpClient, never()).execute(argThat(r -> r != null && r.getUrl().startsWith("http://admin.")), any());
    }

    @Test
    void testFailedPagesDoNotAbortCrawl() throws IOException {
        page("http://example.com/", "<a href=\"/broken\">x</a><a href=\"/ok\">y</a>");
        page("http://example.com/ok", "fine");
        doThrow(new IOException("connection refused"))
            .when(httpClient).execute(argThat(r -> r != null && r.getUrl().endsWith("/broken")), any());

        CrawlResult result = crawler(CrawlOptions.builder().followRobots(false).build(), CrawlListener.noOp())
            .crawl("http://example.com/");

        assertEquals(1, result.getFailedPages());
        assertEquals(2, result.getPagesFetched());
    }

    @Test
    void testCancelledControlStopsCrawl() throws IOException {
        page("http://example.com/", "<a href=\"/next\">next</a>");
        control.cancel();

        CrawlResult result = crawler(CrawlOptions.builder().followRobots(false).build(), CrawlListener.noOp())
            .crawl("http://example.com/");

        assertEquals(0, result.getPagesFetched());
        verify(httpClient, never()).execute(any(), any());
    }
}
