package com.tfigtfs.backend.controller;

import com.tfigtfs.backend.gtfs.StaticAssets;
import com.tfigtfs.backend.service.GtfsFeedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/calendar")
@RequiredArgsConstructor
@Tag(name = "Calendar", description = "Expanded service calendar")
public class CalendarController {

    private final GtfsFeedService feedService;
    private final Clock clock;

    @Operation(summary = "Services Running", description = "Service ids running on a date, from the expanded calendar. Dates outside the expansion window return an empty list.")
    @GetMapping
    public List<String> getServices(
            @Parameter(description = "Date (yyyy-MM-dd), defaults to today in the feed timezone", example = "2025-06-19") @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        StaticAssets assets = feedService.requireStaticAssets();
        LocalDate day = date != null ? date : assets.today(clock);
        return assets.servicesRunningOn(day).stream().sorted().collect(Collectors.toList());
    }
}
