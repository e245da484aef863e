package com.tfigtfs.backend.controller;

import com.tfigtfs.backend.model.StopDepartures;
import com.tfigtfs.backend.service.DepartureService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/departures")
@RequiredArgsConstructor
@Tag(name = "Departures", description = "Scheduled and real-time departures by stop number")
public class DepartureController {

    private final DepartureService departureService;

    @Operation(summary = "Get Departures", description = "Departures from one or more stops, keyed by stop number. Non-numeric and unknown stop numbers are ignored.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Departures found"),
            @ApiResponse(responseCode = "400", description = "Invalid parameters", content = @Content),
            @ApiResponse(responseCode = "503", description = "Feeds not loaded yet", content = @Content)
    })
    @GetMapping
    public Map<String, StopDepartures> getDepartures(
            @Parameter(description = "Stop number (stop_code), repeatable", required = true, example = "1358") @RequestParam("stop") List<String> stops,
            @Parameter(description = "Look-ahead window in minutes") @RequestParam(defaultValue = "90") int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("minutes must be positive");
        }
        return departureService.departures(stops, Duration.ofMinutes(minutes));
    }
}
