package com.findex.backend.model;

import com.findex.backend.exception.ExportException;

import java.util.List;

public record ExportResult(
        String sinkName,
        long totalRows,
        ExportState state,
        List<RegionOutcome> regionOutcomes,
        ExportException failure
) {

    public ExportResult {
        regionOutcomes = regionOutcomes == null ? List.of() : List.copyOf(regionOutcomes);
    }

    public boolean isSuccess() {
        return state == ExportState.DONE;
    }

    public String failureMessage() {
        return failure != null ? failure.getMessage() : null;
    }

    public long failedRegions() {
        return regionOutcomes.stream().filter(outcome -> !outcome.succeeded()).count();
    }
}
