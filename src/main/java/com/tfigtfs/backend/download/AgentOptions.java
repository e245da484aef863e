package com.tfigtfs.backend.download;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tfigtfs.backend.schedule.Sleeper;
import com.tfigtfs.backend.service.MonitoringService;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators and tunables shared by the download agents.
 */
@Value
@Builder
public class AgentOptions {

    public static final Duration DEFAULT_WAIT = Duration.ofHours(1);
    public static final long EXP_BACKOFF_MAX_WAIT = 60;

    @Builder.Default
    Clock clock = Clock.systemDefaultZone();

    @Builder.Default
    Sleeper sleeper = Sleeper.SYSTEM;

    /** Used in auto mode when the headers do not say how long the resource stays fresh. */
    @Builder.Default
    Duration defaultWait = DEFAULT_WAIT;

    @Builder.Default
    long backoffMaxWaitSeconds = EXP_BACKOFF_MAX_WAIT;

    @Builder.Default
    MonitoringService monitoring = MonitoringService.NONE;

    @Builder.Default
    ObjectMapper objectMapper = new ObjectMapper();

    public static AgentOptions defaults() {
        return AgentOptions.builder().build();
    }
}
