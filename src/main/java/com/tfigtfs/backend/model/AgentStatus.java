package com.tfigtfs.backend.model;

import com.tfigtfs.backend.download.AgentState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStatus {
    private String name;
    private String url;
    private String schedule;
    private AgentState state;
    private Instant lastSuccessAt;
    private Integer lastHttpStatus;
    private String etag;

    // seconds the next failure would wait
    private long errorWait;
}
