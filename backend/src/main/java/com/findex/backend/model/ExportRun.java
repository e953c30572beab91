package com.findex.backend.model;

import com.findex.backend.exception.ExportException;
import com.findex.backend.util.CancellationToken;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live status of one export, updated by the worker thread and read by status
 * requests. Kept in memory only.
 */
@Getter
public class ExportRun {

    public enum Status {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED;

        public boolean isFinished() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    private final String id;
    private final List<String> regions;
    private final String fileName;
    private final Path filePath;
    private final Instant createdAt;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final List<RegionOutcome> regionOutcomes = new CopyOnWriteArrayList<>();

    private volatile Status status = Status.PENDING;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile String currentRegion;
    private volatile int detectorsFound;
    private volatile int pagesProcessed;
    private volatile int lastPageFindings;
    private volatile long totalRows;
    private volatile String errorMessage;
    private volatile ExportException failure;

    public ExportRun(String id, List<String> regions, String fileName, Path filePath, Instant createdAt) {
        this.id = id;
        this.regions = List.copyOf(regions);
        this.fileName = fileName;
        this.filePath = filePath;
        this.createdAt = createdAt;
    }

    public synchronized boolean markRunning() {
        if (status != Status.PENDING) {
            return false;
        }
        status = Status.RUNNING;
        startedAt = Instant.now();
        return true;
    }

    public synchronized void apply(ExportProgress progress) {
        currentRegion = progress.region();
        switch (progress.event()) {
            case REGION_STARTED -> {
                detectorsFound = progress.detectorsFound();
                lastPageFindings = 0;
            }
            case PAGE_PROCESSED -> {
                pagesProcessed++;
                lastPageFindings = progress.pageFindingIds();
            }
            default -> {
            }
        }
        if (progress.totalRows() > totalRows) {
            totalRows = progress.totalRows();
        }
    }

    public synchronized void finish(ExportResult result) {
        regionOutcomes.clear();
        regionOutcomes.addAll(result.regionOutcomes());
        totalRows = result.totalRows();
        errorMessage = result.failureMessage();
        failure = result.failure();
        status = switch (result.state()) {
            case DONE -> Status.COMPLETED;
            case CANCELLED -> Status.CANCELLED;
            default -> Status.FAILED;
        };
        completedAt = Instant.now();
    }

    public synchronized void fail(String message) {
        fail(message, null);
    }

    public synchronized void fail(String message, ExportException cause) {
        if (startedAt == null) {
            startedAt = Instant.now();
        }
        status = Status.FAILED;
        errorMessage = message != null ? message : "Export failed";
        failure = cause;
        completedAt = Instant.now();
    }

    /**
     * Requests cancellation. A pending run is finished immediately; a running
     * one finishes once the worker observes the token.
     */
    public synchronized boolean cancel() {
        if (status.isFinished()) {
            return false;
        }
        cancellationToken.cancel("cancelled by caller");
        if (status == Status.PENDING) {
            status = Status.CANCELLED;
            completedAt = Instant.now();
        }
        return true;
    }
}
