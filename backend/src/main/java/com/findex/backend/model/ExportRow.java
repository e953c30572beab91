package com.findex.backend.model;

import java.util.List;

public record ExportRow(
        String region,
        String findingId,
        String title,
        String description,
        String severity,
        String createdAt,
        String updatedAt
) {

    public static final List<String> HEADER = List.of(
            "Region", "FindingId", "Title", "Description", "Severity", "CreatedAt", "UpdatedAt");

    public List<String> values() {
        return List.of(region, findingId, title, description, severity, createdAt, updatedAt);
    }
}
