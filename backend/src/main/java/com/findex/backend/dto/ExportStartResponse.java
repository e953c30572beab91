package com.findex.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportStartResponse {
    private String exportId;
    private String status;
    private String fileName;
    private Instant createdAt;
}
