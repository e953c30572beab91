package com.findex.backend.model;

/**
 * A GuardDuty finding reduced to the fields the export needs. Values are kept
 * exactly as the service returned them; any of them may be null here and are
 * checked when the finding is flattened into a row.
 */
public record Finding(
        String id,
        String title,
        String description,
        Double severity,
        String createdAt,
        String updatedAt
) {
}
