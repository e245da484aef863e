package com.tfigtfs.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedStatus {

    private boolean ready;
    private boolean cached;

    @Builder.Default
    private List<AgentStatus> agents = new ArrayList<>();

    private LocalDate calendarBuiltFor;
    private int expandedCalendarSize;
    private Instant realtimeTimestamp;
    private int realtimeUpdates;
}
