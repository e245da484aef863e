package com.tfigtfs.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stop {

    private String stopId;

    // Irish stop number shown on the bus stop pole
    private String stopCode;

    private String stopName;
    private Double lat;
    private Double lon;
}
