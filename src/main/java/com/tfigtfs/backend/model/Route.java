package com.tfigtfs.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Route {
    private String routeId;
    private String agencyId;
    private String routeShortName;
    private String routeLongName;
}
