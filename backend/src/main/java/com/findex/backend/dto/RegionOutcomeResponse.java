package com.findex.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegionOutcomeResponse {
    private String region;
    private String status;
    private long rows;
    private String reason;
}
