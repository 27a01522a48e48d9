package webscan.http;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RequestExecutorTest {

    @Mock
    private HttpClient httpClient;

    private final List<Duration> sleeps = new ArrayList<>();
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        sleeps.clear();
        rateLimiter = new RateLimiter(RateLimiterConfig.builder()
            .minDelay(Duration.ZERO)
            .initialRequestsPerSecond(1000)
            .requestsPerSecondBounds(1, 1000)
            .build(), duration -> { }, System::nanoTime);
    }

    private RequestExecutor.Builder executor() {
        return RequestExecutor.builder(httpClient)
            .rateLimiter(rateLimiter)
            .sleeper(sleeps::add)
            .retryPolicy(RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(1))
                .build());
    }

    private static HttpResponse ok(String body) {
        return HttpResponse.builder().statusCode(200).body(body).build();
    }

    @Test
    void testSuccessfulRequestReturnsResponse() throws IOException {
        when(httpClient.execute(any(), any())).thenReturn(ok("hello"));

        RequestOutcome outcome = executor().build().send(HttpRequest.get("http://example.com/"));

        assertTrue(outcome.isOk());
        assertEquals("hello", outcome.getResponse().get().getBody());
        assertEquals(1, outcome.getAttempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testRetriesNetworkErrorsWithBackoff() throws IOException {
        when(httpClient.execute(any(), any()))
            .thenThrow(new IOException("connection reset"))
            .thenThrow(new IOException("connection reset"))
            .thenReturn(ok("recovered"));

        RequestOutcome outcome = executor().build().send(HttpRequest.get("http://example.com/"));

        assertTrue(outcome.isOk());
        assertEquals(3, outcome.getAttempts());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void testTimeoutAfterAllAttemptsIsInconclusive() throws IOException {
        when(httpClient.execute(any(), any())).thenThrow(new SocketTimeoutException("read timed out"));

        RequestOutcome outcome = executor().build().send(HttpRequest.get("http://example.com/"));

        assertFalse(outcome.isOk());
        assertTrue(outcome.isInconclusive());
        assertEquals(RequestOutcome.Kind.TIMEOUT, outcome.getKind());
        assertEquals(3, outcome.getAttempts());
        verify(httpClient, times(3)).execute(any(), any());
    }

    @Test
    void testServerErrorIsNotRetried() throws IOException {
        when(httpClient.execute(any(), any()))
            .thenReturn(HttpResponse.builder().statusCode(500).body("boom").build());

        RequestOutcome outcome = executor().build().send(HttpRequest.get("http://example.com/"));

        assertTrue(outcome.isOk());
        assertEquals(500, outcome.getResponse().get().getStatusCode());
        verify(httpClient, times(1)).execute(any(), any());
    }

    @Test
    void testBudgetIsConsumedOncePerLogicalRequest() throws IOException {
        when(httpClient.execute(any(), any()))
            .thenThrow(new IOException("reset"))
            .thenReturn(ok("a"))
            .thenReturn(ok("b"));
        ExecutionControl control = new ExecutionControl(2);
        RequestExecutor requestExecutor = executor().control(control).build();

        assertTrue(requestExecutor.send(HttpRequest.get("http://example.com/1")).isOk());
        assertTrue(requestExecutor.send(HttpRequest.get("http://example.com/2")).isOk());
        RequestOutcome third = requestExecutor.send(HttpRequest.get("http://example.com/3"));

        assertEquals(RequestOutcome.Kind.CANCELLED, third.getKind());
        assertTrue(control.isBudgetExhausted());
        assertEquals(2, control.getIssued());
        verify(httpClient, times(3)).execute(any(), any());
    }

    @Test
    void testCancelledControlSendsNothing() throws IOException {
        ExecutionControl control = ExecutionControl.unlimited();
        control.cancel();

        RequestOutcome outcome = executor().control(control).build().send(HttpRequest.get("http://example.com/"));

        assertEquals(RequestOutcome.Kind.CANCELLED, outcome.getKind());
        verify(httpClient, never()).execute(any(), any());
    }

    @Test
    void testSessionCookiesAreCapturedAndReplayed() throws IOException {
        when(httpClient.execute(any(), any()))
            .thenReturn(HttpResponse.builder().statusCode(200).addHeader("Set-Cookie", "sid=abc; Path=/").build())
            .thenReturn(ok("second"));
        RequestExecutor requestExecutor = executor().build();

        requestExecutor.send(HttpRequest.get("http://example.com/login"));
        requestExecutor.send(HttpRequest.get("http://example.com/account"));

        assertEquals("abc", requestExecutor.getSession().getCookie("sid").orElse(null));
        verify(httpClient).execute(argThat(r -> r != null && r.getUrl().endsWith("/account")
            && "abc".equals(r.getCookies().get("sid"))), any());
    }

    @Test
    void testFollowsRedirectsWhenEnabled() throws IOException {
        when(httpClient.execute(argThat(r -> r != null && r.getUrl().equals("http://example.com/old")), any()))
            .thenReturn(HttpResponse.builder().statusCode(302).addHeader("Location", "/new").build());
        when(httpClient.execute(argThat(r -> r != null && r.getUrl().equals("http://example.com/new")), any()))
            .thenReturn(ok("moved here"));

        RequestOutcome outcome = executor().followRedirects(true).build()
            .send(HttpRequest.get("http://example.com/old"));

        assertEquals("moved here", outcome.getResponse().get().getBody());
    }

    @Test
    void testRedirectToFilteredHostIsNotSent() throws IOException {
        when(httpClient.execute(argThat(r -> r != null && r.getUrl().equals("http://example.com/jump")), any()))
            .thenReturn(HttpResponse.builder().statusCode(302).addHeader("Location", "http://10.0.0.5/admin").build());
        ExecutionControl control = new ExecutionControl(10);

        RequestOutcome outcome = executor()
            .followRedirects(true)
            .control(control)
            .targetFilter(url -> !url.contains("10.0.0.5"))
            .build()
            .send(HttpRequest.get("http://example.com/jump"));

        assertEquals(RequestOutcome.Kind.REJECTED, outcome.getKind());
        assertTrue(outcome.isInconclusive());
        assertEquals(1, control.getIssued());
        verify(httpClient, never()).execute(argThat(r -> r != null && r.getUrl().contains("10.0.0.5")), any());
    }

    @Test
    void testReauthenticatesOnLoginRedirect() throws IOException {
        when(httpClient.execute(any(), any()))
            .thenReturn(HttpResponse.builder().statusCode(302).addHeader("Location", "/login").build())
            .thenReturn(ok("private data"));
        ReauthHandler handler = mock(ReauthHandler.class);
        when(handler.isLoginRedirect(any(), any())).thenAnswer(inv -> {
            HttpResponse response = inv.getArgument(1);
            return response.isRedirect();
        });
        when(handler.reauthenticate(any(), any())).thenReturn(true);

        RequestOutcome outcome = executor().reauthHandler(handler).build()
            .send(HttpRequest.get("http://example.com/private"));

        assertEquals("private data", outcome.getResponse().get().getBody());
        verify(handler).reauthenticate(eq(httpClient), any());
    }
}
