package com.findex.backend.model;

/**
 * A single progress observation. {@code totalRows} never decreases across the
 * observations of one export.
 */
public record ExportProgress(
        Event event,
        String region,
        String detectorId,
        int detectorsFound,
        int pageNumber,
        int pageFindingIds,
        int pageRows,
        long totalRows
) {

    public enum Event {
        REGION_STARTED,
        PAGE_PROCESSED,
        DETECTOR_FINISHED,
        REGION_FINISHED,
        REGION_FAILED
    }
}
