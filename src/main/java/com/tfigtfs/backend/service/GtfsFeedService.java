package com.tfigtfs.backend.service;

import com.tfigtfs.backend.client.ResourceClient;
import com.tfigtfs.backend.client.ResourceResponse;
import com.tfigtfs.backend.config.GtfsProperties;
import com.tfigtfs.backend.download.AgentOptions;
import com.tfigtfs.backend.download.CycleResult;
import com.tfigtfs.backend.download.DownloadAgent;
import com.tfigtfs.backend.exception.FeedNotReadyException;
import com.tfigtfs.backend.gtfs.RealtimeData;
import com.tfigtfs.backend.gtfs.StaticAssets;
import com.tfigtfs.backend.gtfs.StaticAssetsParser;
import com.tfigtfs.backend.model.AgentStatus;
import com.tfigtfs.backend.model.FeedStatus;
import com.tfigtfs.backend.schedule.Sleeper;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maintains the latest GTFS static assets and real-time data.
 * <p>
 * Owns one download agent per feed. Each agent hands its payload to a parser
 * callback that swaps the matching snapshot in whole, and to a second callback
 * that opens the readiness gate once both snapshots exist.
 */
@Service
@Slf4j
public class GtfsFeedService {

    public static final String STATIC_ASSETS = "static assets";
    public static final String REALTIME_DATA = "realtime data";
    public static final String API_KEY_HEADER = "X-API-KEY";

    private final GtfsProperties properties;
    private final Clock clock;
    private final MonitoringService monitoringService;

    @Getter
    private final DownloadAgent staticAssetAgent;
    @Getter
    private final DownloadAgent realtimeDataAgent;

    private final AtomicReference<StaticAssets> staticAssets = new AtomicReference<>();
    private final AtomicReference<RealtimeData> realtimeData = new AtomicReference<>();
    private final ReadinessGate dataAvailable = new ReadinessGate();

    @Autowired
    public GtfsFeedService(GtfsProperties properties, ResourceClient resourceClient,
            MonitoringService monitoringService, Clock clock) {
        this(properties, resourceClient, monitoringService, clock, Sleeper.SYSTEM);
    }

    GtfsFeedService(GtfsProperties properties, ResourceClient resourceClient, MonitoringService monitoringService,
            Clock clock, Sleeper sleeper) {
        this.properties = properties;
        this.clock = clock;
        this.monitoringService = monitoringService;

        if (properties.apiKeyCheck() && !properties.cached().enabled() && !properties.hasApiKey()) {
            throw new IllegalStateException("API key must be set (gtfs.api-key / GTFS_API_KEY)");
        }

        AgentOptions options = AgentOptions.builder()
                .clock(clock)
                .sleeper(sleeper)
                .defaultWait(Duration.ofSeconds(properties.polling().defaultWaitSeconds()))
                .backoffMaxWaitSeconds(properties.polling().backoffMaxWaitSeconds())
                .monitoring(monitoringService)
                .build();

        // the static archive changes rarely, let the server's cache headers decide
        staticAssetAgent = DownloadAgent.autoSleep(STATIC_ASSETS, properties.staticUrl(), resourceClient, options);
        staticAssetAgent.registerBytesCallback(this::newStaticAssets);

        realtimeDataAgent = DownloadAgent.everyNMinutes(REALTIME_DATA, properties.realtimeUrl(),
                properties.polling().realtimeIntervalMinutes(), resourceClient, options);
        realtimeDataAgent.registerBytesCallback(this::newRealtimeData);
        realtimeDataAgent.setHeaders(realtimeHeaders());

        staticAssetAgent.registerCallback(this::manageDataAvailable);
        realtimeDataAgent.registerCallback(this::manageDataAvailable);
    }

    private HttpHeaders realtimeHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setCacheControl("no-cache");
        if (properties.hasApiKey()) {
            headers.set(API_KEY_HEADER, properties.apiKey());
        }
        return headers;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.cached().enabled()) {
            loadCachedData();
            return;
        }
        if (!properties.polling().enabled()) {
            log.warn("⚠️ Feed polling is disabled, no data will be downloaded");
            return;
        }

        startAgents();
        try {
            Duration timeout = Duration.ofSeconds(properties.polling().startupTimeoutSeconds());
            if (!waitForDataAvailable(timeout)) {
                log.warn("⚠️ Feeds not available after {} secs., the agents keep trying in the background",
                        timeout.getSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ Interrupted while waiting for the feeds to become available");
        }
    }

    public void startAgents() {
        log.info("═══════════════════════════════════════════════════════════════════");
        log.info("🚌 GTFS AGENTS STARTING | Static: {} | Realtime: {}", properties.staticUrl(),
                properties.realtimeUrl());
        log.info("═══════════════════════════════════════════════════════════════════");
        staticAssetAgent.start();
        realtimeDataAgent.start();
    }

    @PreDestroy
    public void shutdown() {
        staticAssetAgent.stop();
        realtimeDataAgent.stop();
        StaticAssets current = staticAssets.get();
        if (current != null) {
            current.stopCalendarRefresh();
        }
    }

    /**
     * Callback for an updated static asset zip file.
     */
    void newStaticAssets(byte[] zipBytes) {
        StaticAssets assets = StaticAssetsParser.parse(zipBytes);
        GtfsProperties.Calendar window = properties.calendar();
        assets.startCalendarRefresh(window.startOffset(), window.stopOffset(), Duration.ofDays(window.refreshDays()),
                clock, null);

        log.info("🔄 Updating static assets");
        StaticAssets previous = staticAssets.getAndSet(assets);
        if (previous != null) {
            previous.stopCalendarRefresh();
        }
        monitoringService.recordSnapshotSize(STATIC_ASSETS, assets.getTrips().size());
    }

    /**
     * Callback for an updated real-time feed.
     */
    void newRealtimeData(byte[] feedBytes) {
        RealtimeData data = RealtimeData.parse(feedBytes);
        log.debug("Updating realtime data | {} stop updates", data.size());
        realtimeData.set(data);
        monitoringService.recordSnapshotSize(REALTIME_DATA, data.size());
    }

    /**
     * Opens the readiness gate once both snapshots exist.
     */
    void manageDataAvailable() {
        if (staticAssets.get() != null && realtimeData.get() != null) {
            dataAvailable.open();
        }
    }

    /**
     * Pauses until both the static assets and real-time data are available.
     *
     * @return false if the timeout elapsed first
     */
    public boolean waitForDataAvailable(Duration timeout) throws InterruptedException {
        return dataAvailable.await(timeout);
    }

    public boolean isDataAvailable() {
        return dataAvailable.isReady();
    }

    public Optional<StaticAssets> getStaticAssets() {
        return Optional.ofNullable(staticAssets.get());
    }

    public Optional<RealtimeData> getRealtimeData() {
        return Optional.ofNullable(realtimeData.get());
    }

    public StaticAssets requireStaticAssets() {
        return getStaticAssets().orElseThrow(() -> new FeedNotReadyException("Static assets not downloaded yet"));
    }

    /**
     * Runs one fetch cycle of the named feed on the caller's thread.
     *
     * @param feed "static" or "realtime"
     */
    public CycleResult refresh(String feed) {
        DownloadAgent agent = agentFor(feed);
        log.info("🔄 Manual refresh of {}", agent.getName());
        return agent.runCycle();
    }

    public FeedStatus getStatus() {
        FeedStatus.FeedStatusBuilder status = FeedStatus.builder()
                .ready(isDataAvailable())
                .cached(properties.cached().enabled())
                .agents(List.of(agentStatus(staticAssetAgent), agentStatus(realtimeDataAgent)));

        getStaticAssets().ifPresent(assets -> status
                .calendarBuiltFor(assets.getCalendarBuiltFor().orElse(null))
                .expandedCalendarSize(assets.getExpandedCalendar().size()));
        getRealtimeData().ifPresent(data -> status
                .realtimeTimestamp(data.getTimestampInstant())
                .realtimeUpdates(data.size()));
        return status.build();
    }

    private AgentStatus agentStatus(DownloadAgent agent) {
        Optional<ResourceResponse> last = agent.getLastResponse();
        return AgentStatus.builder()
                .name(agent.getName())
                .url(agent.getUrl())
                .schedule(agent.getSchedule().toString())
                .state(agent.getState())
                .lastSuccessAt(agent.getLastSuccessAt().orElse(null))
                .lastHttpStatus(last.map(ResourceResponse::getStatus).orElse(null))
                .etag(last.map(ResourceResponse::getETag).orElse(null))
                .errorWait(agent.getErrorWait())
                .build();
    }

    private DownloadAgent agentFor(String feed) {
        switch (feed.toLowerCase(Locale.ROOT)) {
            case "static":
                return staticAssetAgent;
            case "realtime":
                return realtimeDataAgent;
            default:
                throw new NoSuchElementException("Unknown feed: " + feed + " (expected static or realtime)");
        }
    }

    /**
     * Loads both feeds from local files instead of downloading them. Debug aid only.
     */
    void loadCachedData() {
        GtfsProperties.Cached cached = properties.cached();
        log.warn("⚠️ Running on cached data: {} and {}", cached.staticPath(), cached.realtimePath());
        newStaticAssets(readFile(cached.staticPath()));
        newRealtimeData(readFile(cached.realtimePath()));
        manageDataAvailable();
    }

    private static byte[] readFile(String path) {
        try {
            return Files.readAllBytes(Path.of(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read cached feed " + path, e);
        }
    }
}
