package com.findex.backend.service;

import com.findex.backend.exception.ExportException;
import com.findex.backend.model.ExportResult;
import com.findex.backend.model.ExportRun;
import com.findex.backend.model.FailurePolicy;
import com.findex.backend.model.Region;
import com.findex.backend.util.MdcKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExportRunExecutor {

    private final ExportAggregator exportAggregator;
    private final ExportFileStore exportFileStore;

    /**
     * Runs one export into the run's reserved file and records the outcome on
     * the run. Never throws; the caller inspects the run afterwards.
     */
    public void executeRun(ExportRun run, List<Region> regions, FailurePolicy policy, String correlationId) {
        Map<String, String> previousContext = MDC.getCopyOfContextMap();
        MDC.put(MdcKeys.EXPORT_ID, run.getId());
        if (correlationId != null) {
            MDC.put(MdcKeys.CORRELATION_ID, correlationId);
        }
        log.info("EXPORT START: exportId={} regions={} file={}", run.getId(), run.getRegions(), run.getFileName());
        try {
            if (!run.markRunning()) {
                log.info("Export {} was cancelled before execution started.", run.getId());
                return;
            }
            try (ExportSink sink = exportFileStore.open(run.getFilePath())) {
                ExportResult result = exportAggregator.export(regions, sink, run::apply,
                        run.getCancellationToken(), policy);
                run.finish(result);
            }
            switch (run.getStatus()) {
                case COMPLETED -> log.info("Export {} completed with {} rows in {}",
                        run.getId(), run.getTotalRows(), run.getFileName());
                case CANCELLED -> log.info("Export {} cancelled after {} rows", run.getId(), run.getTotalRows());
                default -> log.warn("Export {} failed after {} rows: {}",
                        run.getId(), run.getTotalRows(), run.getErrorMessage());
            }
        } catch (ExportException ex) {
            log.error("Export {} failed: {}", run.getId(), ex.getMessage(), ex);
            run.fail(ex.getMessage(), ex);
        } catch (Exception ex) {
            log.error("Export {} failed unexpectedly", run.getId(), ex);
            run.fail(ex.getMessage());
        } finally {
            log.info("EXPORT STOP: exportId={} status={}", run.getId(), run.getStatus());
            if (previousContext != null) {
                MDC.setContextMap(previousContext);
            } else {
                MDC.clear();
            }
        }
    }
}
