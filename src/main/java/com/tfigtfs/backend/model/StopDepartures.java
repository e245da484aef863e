package com.tfigtfs.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopDepartures {
    private String stopNumber;
    private String stopName;

    @Builder.Default
    private List<Departure> departures = new ArrayList<>();
}
