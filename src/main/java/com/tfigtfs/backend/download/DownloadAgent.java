package com.tfigtfs.backend.download;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfigtfs.backend.client.HttpStatusException;
import com.tfigtfs.backend.client.ResourceClient;
import com.tfigtfs.backend.client.ResourceResponse;
import com.tfigtfs.backend.schedule.Sleeper;
import com.tfigtfs.backend.service.MonitoringService;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Keeps one remote resource fresh on its own thread.
 * <p>
 * Each cycle fetches the resource, hands the payload to every registered
 * callback in registration order, then waits according to its
 * {@link FetchSchedule}. Any failure (transport error, non-2xx status, or a
 * callback throwing) is logged and followed by an exponential backoff wait,
 * after which the same resource is fetched again without waiting for the
 * schedule. Nothing thrown inside the loop escapes the agent's thread.
 * <p>
 * Callbacks signal an invalid payload by throwing; one failing callback does
 * not stop the others but marks the whole cycle as failed. This includes
 * {@link Error}s such as running out of memory while parsing a large payload.
 * <p>
 * BYTES callbacks each receive their own copy of the body.
 */
@Slf4j
public class DownloadAgent {

    @Getter
    private final String name;
    @Getter
    private final String url;
    @Getter
    private final FetchSchedule schedule;

    private final ResourceClient client;
    private final BackoffPolicy backoff;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration defaultWait;
    private final MonitoringService monitoring;
    private final ObjectMapper objectMapper;

    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicReference<ResourceResponse> lastResponse = new AtomicReference<>();
    private final AtomicReference<AgentState> state = new AtomicReference<>(AgentState.IDLE);
    private final Thread agentThread;

    private volatile HttpHeaders requestHeaders = HttpHeaders.EMPTY;
    private volatile boolean running = true;
    private volatile Instant lastSuccessAt;
    private volatile boolean retrying;

    // only touched from the agent thread (or the caller of runCycle)
    private LocalDateTime nextExecTime;

    public DownloadAgent(String name, String url, FetchSchedule schedule, ResourceClient client,
            AgentOptions options) {
        this.name = name;
        this.url = url;
        this.schedule = schedule;
        this.client = client;
        this.backoff = new BackoffPolicy(options.getBackoffMaxWaitSeconds());
        this.clock = options.getClock();
        this.sleeper = options.getSleeper();
        this.defaultWait = options.getDefaultWait();
        this.monitoring = options.getMonitoring();
        this.objectMapper = options.getObjectMapper();
        this.nextExecTime = schedule.getAnchor();

        this.agentThread = new Thread(this::run, name + "-thread");
        this.agentThread.setDaemon(true);
    }

    public static DownloadAgent everyMinute(String name, String url, ResourceClient client, AgentOptions options) {
        return new DownloadAgent(name, url, FetchSchedule.everyMinute(options.getClock()), client, options);
    }

    public static DownloadAgent everyNMinutes(String name, String url, int minutes, ResourceClient client,
            AgentOptions options) {
        return new DownloadAgent(name, url, FetchSchedule.everyNMinutes(options.getClock(), minutes), client, options);
    }

    public static DownloadAgent hourly(String name, String url, Integer atMinute, ResourceClient client,
            AgentOptions options) {
        return new DownloadAgent(name, url, FetchSchedule.hourly(options.getClock(), atMinute), client, options);
    }

    public static DownloadAgent daily(String name, String url, Integer atHour, Integer atMinute,
            ResourceClient client, AgentOptions options) {
        return new DownloadAgent(name, url, FetchSchedule.daily(options.getClock(), atHour, atMinute), client,
                options);
    }

    /**
     * Uses the "Expires" and "Cache-Control" headers to decide how long to sleep
     * before re-querying the resource.
     */
    public static DownloadAgent autoSleep(String name, String url, ResourceClient client, AgentOptions options) {
        return new DownloadAgent(name, url, FetchSchedule.auto(), client, options);
    }

    public static DownloadAgent manual(String name, String url, ResourceClient client, AgentOptions options) {
        return new DownloadAgent(name, url, FetchSchedule.manual(), client, options);
    }

    public void registerCallback(Runnable callback) {
        subscribers.add(new Subscriber(PayloadType.NONE, describe(callback), response -> callback.run()));
    }

    public void registerBytesCallback(Consumer<byte[]> callback) {
        subscribers.add(new Subscriber(PayloadType.BYTES, describe(callback),
                response -> callback.accept(response.getBody().clone())));
    }

    public void registerTextCallback(Consumer<String> callback) {
        subscribers.add(new Subscriber(PayloadType.TEXT, describe(callback),
                response -> callback.accept(response.bodyAsText())));
    }

    public void registerJsonCallback(Consumer<JsonNode> callback) {
        subscribers.add(new Subscriber(PayloadType.JSON, describe(callback),
                response -> callback.accept(decodeJson(response))));
    }

    /**
     * Sets the headers sent with every request. Call before {@link #start()}.
     */
    public void setHeaders(HttpHeaders headers) {
        HttpHeaders copy = new HttpHeaders();
        copy.addAll(headers);
        this.requestHeaders = HttpHeaders.readOnlyHttpHeaders(copy);
    }

    public synchronized void start() {
        if (agentThread.getState() != Thread.State.NEW) {
            log.warn("⚠️ {} agent already started", name);
            return;
        }
        log.info("🚀 Starting {} agent | {} | {}", name, url, schedule);
        agentThread.start();
    }

    /**
     * Asks the loop to exit. Takes effect at the next wait; an in-flight fetch is
     * abandoned through interruption.
     */
    public void stop() {
        running = false;
        agentThread.interrupt();
    }

    public boolean isAlive() {
        return agentThread.isAlive();
    }

    public AgentState getState() {
        return state.get();
    }

    public Optional<ResourceResponse> getLastResponse() {
        return Optional.ofNullable(lastResponse.get());
    }

    public HttpHeaders getResponseHeaders() {
        ResourceResponse response = lastResponse.get();
        return response != null ? response.getHeaders() : HttpHeaders.EMPTY;
    }

    public Optional<Instant> getLastSuccessAt() {
        return Optional.ofNullable(lastSuccessAt);
    }

    public long getErrorWait() {
        return backoff.getErrorWait();
    }

    private void run() {
        try {
            while (running) {
                CycleResult result = runCycle();
                if (schedule.isManual() && !result.isFailed()) {
                    log.info("✅ {} agent finished its single fetch", name);
                    break;
                }
                if (!running) {
                    break;
                }
                Duration wait = result.getNextWait();
                log.debug("{} agent will sleep for {} secs.", name, wait.getSeconds());
                sleeper.sleep(wait);
                if (!result.isFailed()) {
                    transition(AgentState.IDLE);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("🛑 {} agent interrupted", name);
        } finally {
            transition(AgentState.STOPPED);
        }
    }

    /**
     * Runs one cycle synchronously: optional ETag pre-check, fetch, broadcast.
     * Does not sleep; the returned result says how long the loop should wait.
     * Concurrent callers (the agent thread and a manual refresh) are serialised.
     */
    public synchronized CycleResult runCycle() {
        if (!resourceNeedsUpdate()) {
            transition(AgentState.WAITING_FOR_SCHEDULE);
            monitoring.recordPollingDuration(name, 0, "SKIPPED");
            return CycleResult.skipped(scheduleWait());
        }

        transition(AgentState.FETCHING);
        long startMillis = System.currentTimeMillis();
        boolean rateLimited = false;
        boolean success;

        try {
            ResourceResponse response = client.get(url, requestHeaders);
            if (!response.isSuccessful()) {
                throw new HttpStatusException(name, response.getStatus());
            }
            lastResponse.set(response);
            log.info("📥 {} agent downloaded {} bytes", name, response.getBody().length);
            success = broadcastUpdate(response);
        } catch (HttpStatusException e) {
            rateLimited = e.isRateLimited();
            log.error("❌ {} agent: {}", name, e.getMessage());
            success = false;
        } catch (RuntimeException | Error e) {
            log.error("❌ {} agent encountered an exception", name, e);
            success = false;
        }

        long duration = System.currentTimeMillis() - startMillis;
        monitoring.recordPollingDuration(name, duration, success ? "SUCCESS" : "FAILED");

        if (success) {
            backoff.reset();
            retrying = false;
            lastSuccessAt = clock.instant();
            transition(AgentState.WAITING_FOR_SCHEDULE);
            return CycleResult.success(scheduleWait());
        }

        if (rateLimited) {
            log.error("⏳ {} agent: too many requests, using max exponential backoff wait...", name);
        }
        long wait = backoff.nextWait(rateLimited);
        retrying = true;
        transition(AgentState.BACKING_OFF);
        log.error("⏳ {} agent waiting {} secs. before retrying...", name, wait);
        return CycleResult.failed(Duration.ofSeconds(wait));
    }

    /**
     * False when the previous download carried an ETag and a HEAD request shows
     * it is unchanged. Retries after a failure always fetch.
     */
    boolean resourceNeedsUpdate() {
        ResourceResponse previous = lastResponse.get();
        if (retrying || previous == null || previous.getETag() == null) {
            return true;
        }

        try {
            String currentTag = client.head(url, requestHeaders).getETag();
            if (previous.getETag().equals(currentTag)) {
                log.warn("⚠️ {} agent may have woken up too early.", name);
                log.warn("   -> Etag is unchanged: {}", currentTag);
                log.warn("      remote resource will not be updated...");
                return false;
            }
        } catch (RuntimeException e) {
            log.warn("⚠️ {} agent could not check the Etag, downloading anyway: {}", name, e.getMessage());
        }
        return true;
    }

    private boolean broadcastUpdate(ResourceResponse response) {
        if (subscribers.isEmpty()) {
            log.warn("⚠️ No callbacks were registered for agent: {}", name);
            return true;
        }

        boolean success = true;
        for (Subscriber subscriber : subscribers) {
            try {
                subscriber.getDelivery().accept(response);
                log.debug("Successfully executed {} callback {}", subscriber.getPayloadType(),
                        subscriber.getDescription());
            } catch (RuntimeException | Error e) {
                SubscriberException failure = new SubscriberException(name, subscriber.getDescription(), e);
                log.error("❌ {}", failure.getMessage(), failure);
                success = false;
            }
        }
        return success;
    }

    private Duration scheduleWait() {
        switch (schedule.getKind()) {
            case FIXED_INTERVAL: {
                LocalDateTime now = LocalDateTime.now(clock);
                nextExecTime = FetchSchedule.nextExecutionTime(nextExecTime, schedule.getPeriod(), now);
                return Duration.between(now, nextExecTime);
            }
            case AUTO: {
                Duration wait = HeaderFreshness.autoWait(getResponseHeaders(), clock, defaultWait);
                log.info("💤 {} agent will sleep for {} secs.", name, wait.getSeconds());
                return wait;
            }
            default:
                return Duration.ZERO;
        }
    }

    private JsonNode decodeJson(ResourceResponse response) {
        try {
            return objectMapper.readTree(response.getBody());
        } catch (IOException e) {
            throw new UncheckedIOException("Response from " + url + " is not valid JSON", e);
        }
    }

    private void transition(AgentState next) {
        AgentState previous = state.getAndSet(next);
        if (previous != next) {
            log.debug("{} agent: {} -> {}", name, previous, next);
        }
    }

    private static String describe(Object callback) {
        return callback.getClass().getSimpleName();
    }

    @Value
    private static class Subscriber {
        PayloadType payloadType;
        String description;
        Consumer<ResourceResponse> delivery;
    }
}
