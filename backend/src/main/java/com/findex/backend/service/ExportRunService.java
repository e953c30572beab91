package com.findex.backend.service;

import com.findex.backend.config.ExportSettings;
import com.findex.backend.dto.ExportRequest;
import com.findex.backend.dto.ExportStartResponse;
import com.findex.backend.dto.ExportStatusResponse;
import com.findex.backend.dto.RegionOutcomeResponse;
import com.findex.backend.exception.ConflictException;
import com.findex.backend.exception.ExportFailedException;
import com.findex.backend.exception.InvalidSelectionException;
import com.findex.backend.exception.NotFoundException;
import com.findex.backend.model.ExportRun;
import com.findex.backend.model.FailurePolicy;
import com.findex.backend.model.Region;
import com.findex.backend.model.RegionOutcome;
import com.findex.backend.repository.ExportRunRepository;
import com.findex.backend.util.CancellationToken;
import com.findex.backend.util.MdcKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExportRunService {

    private final RegionResolver regionResolver;
    private final ExportFileStore exportFileStore;
    private final ExportRunRepository exportRunRepository;
    private final ExportRunExecutor exportRunExecutor;
    private final ExportSettings exportSettings;

    @Qualifier("exportExecutor")
    private final Executor exportExecutor;

    public List<String> listRegions(String prefix) {
        String effective = prefix != null ? prefix : exportSettings.regionPrefix();
        return regionResolver.listRegions(effective, CancellationToken.none()).stream()
                .map(Region::name)
                .toList();
    }

    public ExportStartResponse startRun(ExportRequest request) {
        List<Region> selection = validateSelection(request.getRegions());
        ExportRun run = createRun(selection);
        FailurePolicy policy = resolvePolicy(request);
        String correlationId = MDC.get(MdcKeys.CORRELATION_ID);
        try {
            exportExecutor.execute(() -> exportRunExecutor.executeRun(run, selection, policy, correlationId));
        } catch (TaskRejectedException e) {
            run.fail("Export queue is full");
            throw new ConflictException("Too many exports in progress, try again later");
        }
        log.info("Queued export {} for regions {} into {}", run.getId(), run.getRegions(), run.getFileName());
        return ExportStartResponse.builder()
                .exportId(run.getId())
                .status(run.getStatus().name())
                .fileName(run.getFileName())
                .createdAt(run.getCreatedAt())
                .build();
    }

    /**
     * Runs the export on the calling thread.
     *
     * @return the name of the written file
     * @throws ExportFailedException when the export does not complete
     */
    public String runNow(ExportRequest request) {
        List<Region> selection = validateSelection(request.getRegions());
        ExportRun run = createRun(selection);
        exportRunExecutor.executeRun(run, selection, resolvePolicy(request), MDC.get(MdcKeys.CORRELATION_ID));
        if (run.getStatus() != ExportRun.Status.COMPLETED) {
            throw new ExportFailedException(run);
        }
        return run.getFileName();
    }

    public ExportStatusResponse getStatus(String exportId) {
        return toStatus(findRun(exportId));
    }

    public List<ExportStatusResponse> listRuns() {
        return exportRunRepository.findAllNewestFirst().stream()
                .map(this::toStatus)
                .toList();
    }

    public ExportStatusResponse cancel(String exportId) {
        ExportRun run = findRun(exportId);
        if (!run.cancel()) {
            throw new ConflictException("Export " + exportId + " already finished with status " + run.getStatus());
        }
        log.info("Cancellation requested for export {}", exportId);
        return toStatus(run);
    }

    /**
     * Path of the export file. Partial files of failed or cancelled runs are
     * served as well, once they hold at least one row.
     */
    public Path artifact(String exportId) {
        ExportRun run = findRun(exportId);
        if (run.getTotalRows() == 0 && !run.getStatus().isFinished()) {
            throw new ConflictException("Export " + exportId + " has not written any rows yet");
        }
        if (!Files.isRegularFile(run.getFilePath())) {
            throw new NotFoundException("Export file " + run.getFileName() + " is no longer available");
        }
        return run.getFilePath();
    }

    /**
     * Rejects an empty selection before anything remote happens, then checks
     * every requested name against the discoverable regions. Duplicates and
     * order are kept.
     */
    List<Region> validateSelection(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new InvalidSelectionException("At least one region must be selected");
        }
        List<String> names = new ArrayList<>(requested.size());
        for (String name : requested) {
            if (name == null || name.isBlank()) {
                throw new InvalidSelectionException("Region names must not be blank");
            }
            names.add(name.trim());
        }
        Set<String> known = new LinkedHashSet<>(listRegions(""));
        List<String> unknown = names.stream()
                .filter(name -> !known.contains(name))
                .distinct()
                .toList();
        if (!unknown.isEmpty()) {
            throw new InvalidSelectionException("Unknown or unavailable regions: " + String.join(", ", unknown), unknown);
        }
        return names.stream().map(Region::new).toList();
    }

    private ExportRun createRun(List<Region> selection) {
        Path file = exportFileStore.reserve();
        ExportRun run = new ExportRun(
                UUID.randomUUID().toString(),
                selection.stream().map(Region::name).toList(),
                file.getFileName().toString(),
                file,
                Instant.now());
        return exportRunRepository.save(run);
    }

    private FailurePolicy resolvePolicy(ExportRequest request) {
        return request.getFailurePolicy() != null ? request.getFailurePolicy() : exportSettings.failurePolicy();
    }

    private ExportRun findRun(String exportId) {
        return exportRunRepository.findById(exportId)
                .orElseThrow(() -> new NotFoundException("Export not found: " + exportId));
    }

    private ExportStatusResponse toStatus(ExportRun run) {
        return ExportStatusResponse.builder()
                .exportId(run.getId())
                .status(run.getStatus().name())
                .regions(run.getRegions())
                .fileName(run.getFileName())
                .currentRegion(run.getCurrentRegion())
                .detectorsFound(run.getDetectorsFound())
                .pagesProcessed(run.getPagesProcessed())
                .lastPageFindings(run.getLastPageFindings())
                .totalRows(run.getTotalRows())
                .regionOutcomes(run.getRegionOutcomes().stream().map(this::toOutcome).toList())
                .errorMessage(run.getErrorMessage())
                .createdAt(run.getCreatedAt())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .build();
    }

    private RegionOutcomeResponse toOutcome(RegionOutcome outcome) {
        return RegionOutcomeResponse.builder()
                .region(outcome.region())
                .status(outcome.status().name())
                .rows(outcome.rows())
                .reason(outcome.reason())
                .build();
    }
}
