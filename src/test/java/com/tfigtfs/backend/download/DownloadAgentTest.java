package com.tfigtfs.backend.download;

import com.fasterxml.jackson.databind.JsonNode;
import com.tfigtfs.backend.client.ResourceClient;
import com.tfigtfs.backend.client.ResourceFetchException;
import com.tfigtfs.backend.client.ResourceResponse;
import com.tfigtfs.backend.service.MonitoringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DownloadAgentTest {

    private static final String URL = "https://example.org/feed";

    @Mock
    private ResourceClient client;
    @Mock
    private MonitoringService monitoring;

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-19T14:08:26Z"), ZoneOffset.UTC);
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    private AgentOptions options;

    @BeforeEach
    void setUp() {
        options = AgentOptions.builder()
                .clock(clock)
                .sleeper(sleeps::add)
                .monitoring(monitoring)
                .build();
    }

    private static ResourceResponse ok(String body) {
        return ResourceResponse.builder().status(200).body(body.getBytes(StandardCharsets.UTF_8)).build();
    }

    private static ResourceResponse ok(String body, HttpHeaders headers) {
        return ResourceResponse.builder().status(200).headers(headers)
                .body(body.getBytes(StandardCharsets.UTF_8)).build();
    }

    private static ResourceResponse status(int status) {
        return ResourceResponse.builder().status(status).build();
    }

    private static HttpHeaders etag(String tag) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ETAG, tag);
        return headers;
    }

    @Test
    void testRunCycle_Success_DeliversBodyAndWaitsForNextSlot() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        AtomicReference<byte[]> received = new AtomicReference<>();
        agent.registerBytesCallback(received::set);
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("payload"));

        CycleResult result = agent.runCycle();

        assertEquals(CycleResult.Outcome.SUCCESS, result.getOutcome());
        assertEquals(Duration.ofMinutes(1), result.getNextWait());
        assertEquals("payload", new String(received.get(), StandardCharsets.UTF_8));
        assertEquals(AgentState.WAITING_FOR_SCHEDULE, agent.getState());
        assertEquals(clock.instant(), agent.getLastSuccessAt().orElseThrow());
        verify(monitoring).recordPollingDuration(eq("test"), anyLong(), eq("SUCCESS"));
    }

    @Test
    void testRunCycle_CallbacksRunInRegistrationOrder() {
        DownloadAgent agent = DownloadAgent.manual("test", URL, client, options);
        List<String> calls = new ArrayList<>();
        agent.registerCallback(() -> calls.add("first"));
        agent.registerTextCallback(text -> calls.add("second:" + text));
        agent.registerCallback(() -> calls.add("third"));
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("x"));

        agent.runCycle();

        assertEquals(List.of("first", "second:x", "third"), calls);
    }

    @Test
    void testRunCycle_FailingCallback_OthersStillRunAndCycleFails() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        List<String> calls = new ArrayList<>();
        agent.registerBytesCallback(bytes -> {
            throw new IllegalArgumentException("bad payload");
        });
        agent.registerCallback(() -> calls.add("second"));
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("x"));

        CycleResult result = agent.runCycle();

        assertTrue(result.isFailed());
        assertEquals(Duration.ofSeconds(1), result.getNextWait());
        assertEquals(List.of("second"), calls);
        assertEquals(AgentState.BACKING_OFF, agent.getState());
        assertTrue(agent.getLastSuccessAt().isEmpty());
    }

    @Test
    void testRunCycle_CallbackThrowsError_OthersStillRunAndCycleFails() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        List<String> calls = new ArrayList<>();
        agent.registerBytesCallback(bytes -> {
            throw new OutOfMemoryError("Java heap space");
        });
        agent.registerCallback(() -> calls.add("second"));
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("x"));

        CycleResult result = agent.runCycle();

        assertEquals(CycleResult.Outcome.FAILED, result.getOutcome());
        assertEquals(List.of("second"), calls);
        assertEquals(AgentState.BACKING_OFF, agent.getState());
        verify(monitoring).recordPollingDuration(eq("test"), anyLong(), eq("FAILED"));
    }

    @Test
    void testRunCycle_ClientThrowsError_BacksOff() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        when(client.get(eq(URL), any(HttpHeaders.class))).thenThrow(new StackOverflowError());

        CycleResult result = agent.runCycle();

        assertTrue(result.isFailed());
        assertEquals(Duration.ofSeconds(1), result.getNextWait());
        assertEquals(AgentState.BACKING_OFF, agent.getState());
    }

    @Test
    void testRunCycle_BytesCallbacksReceiveTheirOwnCopy() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        AtomicReference<byte[]> received = new AtomicReference<>();
        agent.registerBytesCallback(bytes -> bytes[0] = 'X');
        agent.registerBytesCallback(received::set);
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("payload"));

        agent.runCycle();

        assertEquals("payload", new String(received.get(), StandardCharsets.UTF_8));
        assertEquals("payload", new String(agent.getLastResponse().orElseThrow().getBody(), StandardCharsets.UTF_8));
    }

    @Test
    void testRunCycle_ServerErrors_BackOffExponentiallyThenReset() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        agent.registerCallback(() -> { });
        when(client.get(eq(URL), any(HttpHeaders.class)))
                .thenReturn(status(500), status(503), status(502), ok("x"));

        assertEquals(Duration.ofSeconds(1), agent.runCycle().getNextWait());
        assertEquals(Duration.ofSeconds(2), agent.runCycle().getNextWait());
        assertEquals(Duration.ofSeconds(4), agent.runCycle().getNextWait());
        assertEquals(8, agent.getErrorWait());

        CycleResult result = agent.runCycle();

        assertFalse(result.isFailed());
        assertEquals(0, agent.getErrorWait());
    }

    @Test
    void testRunCycle_TooManyRequests_UsesMaxBackoff() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(status(429));

        CycleResult result = agent.runCycle();

        assertTrue(result.isFailed());
        assertEquals(Duration.ofSeconds(AgentOptions.EXP_BACKOFF_MAX_WAIT), result.getNextWait());
        assertTrue(agent.getLastResponse().isEmpty());
    }

    @Test
    void testRunCycle_TransportError_BacksOff() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        when(client.get(eq(URL), any(HttpHeaders.class)))
                .thenThrow(new ResourceFetchException("connection refused", null));

        CycleResult result = agent.runCycle();

        assertTrue(result.isFailed());
        assertEquals(Duration.ofSeconds(1), result.getNextWait());
        verify(monitoring).recordPollingDuration(eq("test"), anyLong(), eq("FAILED"));
    }

    @Test
    void testRunCycle_UnchangedEtag_SkipsDownload() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        List<byte[]> received = new ArrayList<>();
        agent.registerBytesCallback(received::add);
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("x", etag("\"v1\"")));
        when(client.head(eq(URL), any(HttpHeaders.class))).thenReturn(etag("\"v1\""));

        agent.runCycle();
        CycleResult second = agent.runCycle();

        assertEquals(CycleResult.Outcome.SKIPPED, second.getOutcome());
        assertEquals(1, received.size());
        verify(client, times(1)).get(anyString(), any(HttpHeaders.class));
    }

    @Test
    void testRunCycle_ChangedEtag_Downloads() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        agent.registerCallback(() -> { });
        when(client.get(eq(URL), any(HttpHeaders.class)))
                .thenReturn(ok("x", etag("\"v1\"")), ok("y", etag("\"v2\"")));
        when(client.head(eq(URL), any(HttpHeaders.class))).thenReturn(etag("\"v2\""));

        agent.runCycle();
        CycleResult second = agent.runCycle();

        assertEquals(CycleResult.Outcome.SUCCESS, second.getOutcome());
        assertEquals("\"v2\"", agent.getLastResponse().orElseThrow().getETag());
    }

    @Test
    void testRunCycle_RetryAfterFailure_SkipsEtagCheck() {
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, options);
        agent.registerCallback(() -> { });
        when(client.get(eq(URL), any(HttpHeaders.class)))
                .thenReturn(ok("x", etag("\"v1\"")), status(500), ok("x", etag("\"v1\"")));
        when(client.head(eq(URL), any(HttpHeaders.class))).thenReturn(etag("\"v2\""));

        agent.runCycle();
        assertTrue(agent.runCycle().isFailed());
        CycleResult retry = agent.runCycle();

        assertEquals(CycleResult.Outcome.SUCCESS, retry.getOutcome());
        verify(client, times(1)).head(anyString(), any(HttpHeaders.class));
        verify(client, times(3)).get(anyString(), any(HttpHeaders.class));
    }

    @Test
    void testRunCycle_AutoSchedule_SleepsFromCacheHeaders() {
        DownloadAgent agent = DownloadAgent.autoSleep("test", URL, client, options);
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CACHE_CONTROL, "max-age=100");
        headers.set(HttpHeaders.AGE, "40");
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("x", headers));

        CycleResult result = agent.runCycle();

        assertEquals(Duration.ofSeconds(60), result.getNextWait());
    }

    @Test
    void testRunCycle_AutoSchedule_NoHeaders_UsesDefaultWait() {
        DownloadAgent agent = DownloadAgent.autoSleep("test", URL, client, options);
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("x"));

        assertEquals(AgentOptions.DEFAULT_WAIT, agent.runCycle().getNextWait());
    }

    @Test
    void testRunCycle_JsonCallback_ReceivesParsedTree() {
        DownloadAgent agent = DownloadAgent.manual("test", URL, client, options);
        AtomicReference<JsonNode> received = new AtomicReference<>();
        agent.registerJsonCallback(received::set);
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("{\"stops\": [1358, 1359]}"));

        CycleResult result = agent.runCycle();

        assertFalse(result.isFailed());
        assertEquals(1359, received.get().get("stops").get(1).asInt());
    }

    @Test
    void testRunCycle_InvalidJson_FailsCycle() {
        DownloadAgent agent = DownloadAgent.manual("test", URL, client, options);
        agent.registerJsonCallback(json -> fail("should not be called"));
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("not json {"));

        assertTrue(agent.runCycle().isFailed());
    }

    @Test
    void testRunCycle_TextCallback_UsesContentTypeCharset() {
        DownloadAgent agent = DownloadAgent.manual("test", URL, client, options);
        AtomicReference<String> received = new AtomicReference<>();
        agent.registerTextCallback(received::set);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType("text", "plain", StandardCharsets.ISO_8859_1));
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ResourceResponse.builder()
                .status(200)
                .headers(headers)
                .body("Baile Átha Cliath".getBytes(StandardCharsets.ISO_8859_1))
                .build());

        agent.runCycle();

        assertEquals("Baile Átha Cliath", received.get());
    }

    @Test
    void testRunCycle_SendsConfiguredHeaders() {
        DownloadAgent agent = DownloadAgent.manual("test", URL, client, options);
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-API-KEY", "secret");
        agent.setHeaders(headers);
        when(client.get(eq(URL), argThat(h -> "secret".equals(h.getFirst("X-API-KEY"))))).thenReturn(ok("x"));

        assertFalse(agent.runCycle().isFailed());
    }

    @Test
    void testStart_ManualAgent_RetriesUntilSuccessThenStops() throws InterruptedException {
        DownloadAgent agent = DownloadAgent.manual("test", URL, client, options);
        agent.registerCallback(() -> { });
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(status(500), status(500), ok("x"));

        agent.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (agent.isAlive() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertFalse(agent.isAlive());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        assertEquals(AgentState.STOPPED, agent.getState());
        verify(client, times(3)).get(anyString(), any(HttpHeaders.class));
    }

    @Test
    void testStart_CallbackThrowsError_AgentThreadKeepsRetrying() throws InterruptedException {
        DownloadAgent agent = DownloadAgent.manual("test", URL, client, options);
        List<Integer> attempts = new CopyOnWriteArrayList<>();
        agent.registerBytesCallback(bytes -> {
            attempts.add(attempts.size());
            if (attempts.size() == 1) {
                throw new OutOfMemoryError("Java heap space");
            }
        });
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("x"));

        agent.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (agent.isAlive() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertFalse(agent.isAlive());
        assertEquals(2, attempts.size());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
        assertTrue(agent.getLastSuccessAt().isPresent());
    }

    @Test
    void testStop_InterruptsSleepingAgent() throws InterruptedException {
        AgentOptions realSleep = AgentOptions.builder().clock(clock).monitoring(monitoring).build();
        DownloadAgent agent = DownloadAgent.everyMinute("test", URL, client, realSleep);
        when(client.get(eq(URL), any(HttpHeaders.class))).thenReturn(ok("x"));

        agent.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (agent.getLastSuccessAt().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        agent.stop();
        deadline = System.currentTimeMillis() + 5000;
        while (agent.isAlive() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertFalse(agent.isAlive());
        assertEquals(AgentState.STOPPED, agent.getState());
    }
}
