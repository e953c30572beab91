package com.findex.backend.service;

import com.findex.backend.exception.IncompleteRecordException;
import com.findex.backend.model.ExportRow;
import com.findex.backend.model.Finding;
import com.findex.backend.model.Region;
import com.findex.backend.util.SeverityFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens findings into CSV rows. Every column is required; a null value is
 * an {@link IncompleteRecordException}, an empty string is kept as is.
 */
@Component
public class ExportRowMapper {

    public ExportRow toRow(Region region, Finding finding) {
        String id = require(finding.id(), null, "Id");
        String title = require(finding.title(), id, "Title");
        String description = require(finding.description(), id, "Description");
        Double severity = finding.severity();
        if (severity == null || !Double.isFinite(severity)) {
            throw new IncompleteRecordException(id, "Severity");
        }
        String createdAt = require(finding.createdAt(), id, "CreatedAt");
        String updatedAt = require(finding.updatedAt(), id, "UpdatedAt");
        return new ExportRow(region.name(), id, title, description,
                SeverityFormat.format(severity), createdAt, updatedAt);
    }

    /**
     * Maps a whole batch before anything is written, so a page with one bad
     * record contributes no rows.
     */
    public List<ExportRow> toRows(Region region, List<Finding> findings) {
        List<ExportRow> rows = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            rows.add(toRow(region, finding));
        }
        return rows;
    }

    private static String require(String value, String findingId, String field) {
        if (value == null) {
            throw new IncompleteRecordException(findingId, field);
        }
        return value;
    }
}
