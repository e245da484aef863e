package com.tfigtfs.backend.controller;

import com.tfigtfs.backend.model.FeedStatus;
import com.tfigtfs.backend.service.GtfsFeedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/status")
@RequiredArgsConstructor
@Tag(name = "Status", description = "Feed readiness and download agent state")
public class StatusController {

    private final GtfsFeedService feedService;

    @Operation(summary = "Feed Status", description = "Readiness, per-agent state and snapshot timestamps.")
    @GetMapping
    public FeedStatus getStatus() {
        return feedService.getStatus();
    }
}
