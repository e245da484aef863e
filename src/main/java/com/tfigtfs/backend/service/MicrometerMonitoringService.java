package com.tfigtfs.backend.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@RequiredArgsConstructor
@Slf4j
public class MicrometerMonitoringService implements MonitoringService {

    private final MeterRegistry meterRegistry;

    private final Map<String, AtomicInteger> snapshotSizes = new ConcurrentHashMap<>();

    @Override
    public void recordPollingDuration(String resource, long durationMs, String status) {
        Timer.builder("gtfs.fetch.duration")
                .description("Duration of one download agent fetch cycle")
                .tags(Tags.of("resource", resource, "status", status))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded {} fetch: {}ms ({})", resource, durationMs, status);
    }

    @Override
    public void recordSnapshotSize(String resource, int count) {
        snapshotSizes.computeIfAbsent(resource, r -> meterRegistry.gauge("gtfs.snapshot.size",
                Tags.of("resource", r), new AtomicInteger())).set(count);
    }
}
