package com.tfigtfs.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GtfsPropertiesTest {

    private static GtfsProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bindOrCreate("gtfs", GtfsProperties.class);
    }

    @Test
    void testDefaults_WhenNothingConfigured() {
        GtfsProperties properties = bind(Map.of());

        assertEquals(GtfsProperties.DEFAULT_STATIC_URL, properties.staticUrl());
        assertEquals(GtfsProperties.DEFAULT_REALTIME_URL, properties.realtimeUrl());
        assertTrue(properties.apiKeyCheck());
        assertFalse(properties.hasApiKey());
        assertEquals(1, properties.polling().realtimeIntervalMinutes());
        assertEquals(3600L, properties.polling().defaultWaitSeconds());
        assertEquals(60L, properties.polling().backoffMaxWaitSeconds());
        assertEquals(-2, properties.calendar().startOffset());
        assertEquals(7, properties.calendar().stopOffset());
        assertEquals(1, properties.calendar().refreshDays());
        assertFalse(properties.cached().enabled());
    }

    @Test
    void testBinding_RelaxedNames() {
        GtfsProperties properties = bind(Map.of(
                "gtfs.api-key", "  secret ",
                "gtfs.polling.realtime-interval-minutes", "5",
                "gtfs.calendar.stop-offset", "14",
                "gtfs.cached.enabled", "true"));

        assertEquals("secret", properties.apiKey());
        assertTrue(properties.hasApiKey());
        assertEquals(5, properties.polling().realtimeIntervalMinutes());
        assertTrue(properties.polling().enabled());
        assertEquals(14, properties.calendar().stopOffset());
        assertEquals(-2, properties.calendar().startOffset());
        assertTrue(properties.cached().enabled());
        assertEquals("data/GTFS_Realtime.zip", properties.cached().staticPath());
    }
}
