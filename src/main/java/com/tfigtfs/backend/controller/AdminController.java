package com.tfigtfs.backend.controller;

import com.tfigtfs.backend.download.CycleResult;
import com.tfigtfs.backend.service.GtfsFeedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Administrative operations for manual feed refreshing")
public class AdminController {

    private final GtfsFeedService feedService;

    @Operation(summary = "Trigger Manual Refresh", description = "Runs one fetch cycle of the static or realtime feed synchronously.")
    @ApiResponse(responseCode = "200", description = "Refresh completed successfully")
    @ApiResponse(responseCode = "502", description = "Download or parsing failed, the agent is backing off")
    @PostMapping("/refresh/{feed}")
    public ResponseEntity<CycleResult> refresh(
            @Parameter(description = "Feed to refresh: static or realtime", required = true) @PathVariable String feed) {
        log.info("🔄 ADMIN: Manual refresh triggered for {}", feed);
        CycleResult result = feedService.refresh(feed);
        HttpStatus status = result.isFailed() ? HttpStatus.BAD_GATEWAY : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
