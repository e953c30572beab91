package com.findex.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportStatusResponse {
    private String exportId;
    private String status;
    private List<String> regions;
    private String fileName;
    private String currentRegion;
    private int detectorsFound;
    private int pagesProcessed;
    private int lastPageFindings;
    private long totalRows;
    private List<RegionOutcomeResponse> regionOutcomes;
    private String errorMessage;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
}
