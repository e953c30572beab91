package com.findex.backend.service;

import com.findex.backend.config.ExportSettings;
import com.findex.backend.exception.ExportCancelledException;
import com.findex.backend.exception.ExportException;
import com.findex.backend.exception.InvalidSelectionException;
import com.findex.backend.exception.SinkWriteException;
import com.findex.backend.model.Detector;
import com.findex.backend.model.ExportProgress;
import com.findex.backend.model.ExportResult;
import com.findex.backend.model.ExportRow;
import com.findex.backend.model.ExportState;
import com.findex.backend.model.FailurePolicy;
import com.findex.backend.model.Finding;
import com.findex.backend.model.FindingPage;
import com.findex.backend.model.Region;
import com.findex.backend.model.RegionOutcome;
import com.findex.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one export: regions in the order given, detectors in provider order,
 * pages in cursor order. Each page is resolved and written before the next one
 * is requested, so at most one page of findings is held per region worker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportAggregator {

    private final DetectorEnumerator detectorEnumerator;
    private final FindingPaginator findingPaginator;
    private final FindingBatchResolver batchResolver;
    private final ExportRowMapper rowMapper;
    private final ExportSettings exportSettings;
    @Qualifier("regionExecutor")
    private final Executor regionExecutor;

    public ExportResult export(List<Region> regions, ExportSink sink, ExportProgressListener listener,
                               CancellationToken cancellation) {
        return export(regions, sink, listener, cancellation, exportSettings.failurePolicy());
    }

    /**
     * Runs the export to completion or to the first failure the policy does not
     * tolerate. Export failures ({@link ExportException}) are reported in the
     * result; rows written before a failure stay in the sink.
     *
     * @throws InvalidSelectionException if no region is given
     * @throws RuntimeException any other unexpected failure from a region worker, rethrown as is
     */
    public ExportResult export(List<Region> regions, ExportSink sink, ExportProgressListener listener,
                               CancellationToken cancellation, FailurePolicy policy) {
        if (regions == null || regions.isEmpty()) {
            throw new InvalidSelectionException("At least one region must be selected");
        }
        ExportPass pass = new ExportPass(sink, listener, cancellation, policy, regions.size());
        log.info("Exporting {} regions to {} (policy={}, parallelism={})",
                regions.size(), sink.name(), policy, exportSettings.regionParallelism());

        if (exportSettings.regionParallelism() > 1 && regions.size() > 1) {
            runParallel(regions, pass);
        } else {
            for (int position = 0; position < regions.size(); position++) {
                if (!runRegion(position, regions.get(position), pass)) {
                    break;
                }
            }
        }

        ExportResult result = pass.result();
        log.info("Export to {} finished: state={} rows={} failedRegions={}",
                sink.name(), result.state(), result.totalRows(), result.failedRegions());
        return result;
    }

    private void runParallel(List<Region> regions, ExportPass pass) {
        List<CompletableFuture<Void>> futures = new ArrayList<>(regions.size());
        for (int position = 0; position < regions.size(); position++) {
            int index = position;
            Region region = regions.get(position);
            futures.add(CompletableFuture.runAsync(() -> runRegion(index, region, pass), regionExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    /**
     * @return false when the export must stop
     */
    private boolean runRegion(int position, Region region, ExportPass pass) {
        if (pass.failure.get() != null) {
            return false;
        }
        RegionTally tally = new RegionTally();
        try {
            exportRegion(region, tally, pass);
            pass.outcomes[position] = RegionOutcome.succeeded(position, region, tally.rows);
            return true;
        } catch (ExportException e) {
            pass.outcomes[position] = RegionOutcome.failed(position, region, tally.rows, e.getMessage());
            if (pass.tolerates(e)) {
                log.warn("Region {} failed, continuing with remaining regions: {}", region, e.getMessage());
                pass.emit(ExportProgress.Event.REGION_FAILED, region.name(), null, tally.detectors, 0);
                return true;
            }
            log.error("Region {} failed, aborting export: {}", region, e.getMessage());
            pass.abort(e);
            return false;
        } catch (RuntimeException e) {
            pass.outcomes[position] = RegionOutcome.failed(position, region, tally.rows, e.getMessage());
            pass.abort.cancel("unexpected failure in region " + region);
            throw e;
        }
    }

    private void exportRegion(Region region, RegionTally tally, ExportPass pass) {
        pass.abort.throwIfCancelled();
        pass.transition(ExportState.PER_REGION);
        log.info("Starting export for region {}", region);

        List<Detector> detectors = detectorEnumerator.listDetectors(region, pass.abort);
        tally.detectors = detectors.size();
        pass.emit(ExportProgress.Event.REGION_STARTED, region.name(), null, detectors.size(), 0);

        for (Detector detector : detectors) {
            pass.transition(ExportState.PER_DETECTOR);
            FindingPageCursor cursor = findingPaginator.pages(detector, pass.abort);
            while (cursor.hasNext()) {
                pass.abort.throwIfCancelled();
                pass.transition(ExportState.PER_PAGE);
                FindingPage page = cursor.next();
                if (page.isEmpty()) {
                    log.info("No findings on page {} for detector {}", page.pageNumber(), detector.id());
                } else {
                    log.info("Found {} findings on page {} for detector {}",
                            page.size(), page.pageNumber(), detector.id());
                }
                List<Finding> findings = batchResolver.resolve(detector, page.findingIds(), pass.abort);
                pass.transition(ExportState.FLATTENING);
                List<ExportRow> rows = rowMapper.toRows(region, findings);
                pass.write(detector, page, rows);
                tally.rows += rows.size();
            }
            log.info("Finished processing detector {}. Total pages: {}", detector.id(), cursor.pagesFetched());
            pass.emit(ExportProgress.Event.DETECTOR_FINISHED, region.name(), detector.id(),
                    detectors.size(), cursor.pagesFetched());
        }

        log.info("Completed region {}. Total findings so far: {}", region, pass.sink.rowCount());
        pass.emit(ExportProgress.Event.REGION_FINISHED, region.name(), null, detectors.size(), 0);
    }

    private static final class RegionTally {
        private int detectors;
        private long rows;
    }

    /**
     * Mutable state of one export call, shared by its region workers.
     */
    private static final class ExportPass {

        private final ExportSink sink;
        private final ExportProgressListener listener;
        private final CancellationToken cancellation;
        private final CancellationToken abort;
        private final FailurePolicy policy;
        private final RegionOutcome[] outcomes;
        private final AtomicReference<ExportException> failure = new AtomicReference<>();
        private final Object writeLock = new Object();
        private volatile ExportState state = ExportState.IDLE;

        private ExportPass(ExportSink sink, ExportProgressListener listener, CancellationToken cancellation,
                           FailurePolicy policy, int regionCount) {
            this.sink = sink;
            this.listener = listener != null ? listener : ExportProgressListener.noop();
            this.cancellation = cancellation != null ? cancellation : CancellationToken.none();
            this.abort = this.cancellation.child();
            this.policy = policy != null ? policy : FailurePolicy.ABORT;
            this.outcomes = new RegionOutcome[regionCount];
        }

        private void transition(ExportState next) {
            if (!state.isTerminal()) {
                state = next;
            }
        }

        private boolean tolerates(ExportException e) {
            return policy == FailurePolicy.ISOLATE
                    && !(e instanceof SinkWriteException)
                    && !(e instanceof ExportCancelledException)
                    && !cancellation.isCancelled();
        }

        private void abort(ExportException e) {
            if (failure.compareAndSet(null, e)) {
                abort.cancel("aborted after failure: " + e.getMessage());
            }
        }

        /**
         * Appends a page and reports it under one lock, so observers see totals
         * in write order.
         */
        private void write(Detector detector, FindingPage page, List<ExportRow> rows) {
            synchronized (writeLock) {
                abort.throwIfCancelled();
                if (!rows.isEmpty()) {
                    sink.append(rows);
                }
                notifyListener(new ExportProgress(ExportProgress.Event.PAGE_PROCESSED, detector.region().name(),
                        detector.id(), 0, page.pageNumber(), page.size(), rows.size(), sink.rowCount()));
            }
        }

        private void emit(ExportProgress.Event event, String region, String detectorId,
                          int detectors, int pageNumber) {
            synchronized (writeLock) {
                notifyListener(new ExportProgress(event, region, detectorId, detectors, pageNumber,
                        0, 0, sink.rowCount()));
            }
        }

        private void notifyListener(ExportProgress progress) {
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed on {}: {}", progress.event(), e.getMessage(), e);
            }
        }

        private ExportResult result() {
            ExportException cause = failure.get();
            ExportState end;
            if (cause == null) {
                end = ExportState.DONE;
            } else if (cause instanceof ExportCancelledException) {
                end = ExportState.CANCELLED;
            } else {
                end = ExportState.FAILED;
            }
            state = end;
            List<RegionOutcome> attempted = Arrays.stream(outcomes).filter(Objects::nonNull).toList();
            return new ExportResult(sink.name(), sink.rowCount(), end, attempted, cause);
        }
    }
}
