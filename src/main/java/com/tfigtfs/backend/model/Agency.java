package com.tfigtfs.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agency {
    private String agencyId;
    private String agencyName;
    private String agencyTimezone;
}
