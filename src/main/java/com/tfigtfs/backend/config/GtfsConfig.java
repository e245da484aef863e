package com.tfigtfs.backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(GtfsProperties.class)
public class GtfsConfig {

    // agents, the calendar refresh and the departures query all read time from here
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
