package com.tfigtfs.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "gtfs")
public record GtfsProperties(
    String staticUrl,
    String realtimeUrl,
    String apiKey,
    Boolean apiKeyCheck,
    @Valid Polling polling,
    @Valid Calendar calendar,
    @Valid Http http,
    @Valid Cached cached
) {

  public static final String DEFAULT_STATIC_URL =
      "https://www.transportforireland.ie/transitData/Data/GTFS_Realtime.zip";
  public static final String DEFAULT_REALTIME_URL =
      "https://api.nationaltransport.ie/gtfsr/v2/TripUpdates";

  public GtfsProperties {
    if (staticUrl == null || staticUrl.isBlank()) {
      staticUrl = DEFAULT_STATIC_URL;
    }
    if (realtimeUrl == null || realtimeUrl.isBlank()) {
      realtimeUrl = DEFAULT_REALTIME_URL;
    }
    if (apiKey != null) {
      apiKey = apiKey.trim();
    }
    if (apiKeyCheck == null) {
      apiKeyCheck = true;
    }
    if (polling == null) {
      polling = new Polling(null, null, null, null, null);
    }
    if (calendar == null) {
      calendar = new Calendar(null, null, null);
    }
    if (http == null) {
      http = new Http(null, null);
    }
    if (cached == null) {
      cached = new Cached(null, null, null);
    }
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isEmpty();
  }

  public record Polling(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer realtimeIntervalMinutes,
      @NotNull @Min(1) Long defaultWaitSeconds,
      @NotNull @Min(1) Long backoffMaxWaitSeconds,
      @NotNull @Min(0) Long startupTimeoutSeconds
  ) {
    public Polling {
      if (enabled == null) {
        enabled = true;
      }
      if (realtimeIntervalMinutes == null) {
        realtimeIntervalMinutes = 1;
      }
      if (defaultWaitSeconds == null) {
        defaultWaitSeconds = 3600L;
      }
      if (backoffMaxWaitSeconds == null) {
        backoffMaxWaitSeconds = 60L;
      }
      if (startupTimeoutSeconds == null) {
        startupTimeoutSeconds = 60L;
      }
    }
  }

  /**
   * Window of the expanded service calendar, in days relative to today.
   */
  public record Calendar(
      @NotNull Integer startOffset,
      @NotNull Integer stopOffset,
      @NotNull @Min(1) Integer refreshDays
  ) {
    public Calendar {
      if (startOffset == null) {
        startOffset = -2;
      }
      if (stopOffset == null) {
        stopOffset = 7;
      }
      if (refreshDays == null) {
        refreshDays = 1;
      }
    }
  }

  public record Http(
      @NotNull @Min(1) Integer timeoutSeconds,
      @NotNull @Min(1) Integer maxBodySizeMb
  ) {
    public Http {
      if (timeoutSeconds == null) {
        timeoutSeconds = 120;
      }
      if (maxBodySizeMb == null) {
        maxBodySizeMb = 512;
      }
    }
  }

  /**
   * Serves local copies of both feeds instead of polling. Debug aid only.
   */
  public record Cached(
      @NotNull Boolean enabled,
      String staticPath,
      String realtimePath
  ) {
    public Cached {
      if (enabled == null) {
        enabled = false;
      }
      if (staticPath == null || staticPath.isBlank()) {
        staticPath = "data/GTFS_Realtime.zip";
      }
      if (realtimePath == null || realtimePath.isBlank()) {
        realtimePath = "data/realtime_data.bin";
      }
    }
  }
}
