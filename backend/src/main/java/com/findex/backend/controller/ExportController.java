package com.findex.backend.controller;

import com.findex.backend.dto.ExportRequest;
import com.findex.backend.dto.ExportStartResponse;
import com.findex.backend.dto.ExportStatusResponse;
import com.findex.backend.model.FailurePolicy;
import com.findex.backend.service.ExportRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/api/export")
@RequiredArgsConstructor
@Tag(name = "Exports")
public class ExportController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ExportRunService exportRunService;

    @PostMapping
    @Operation(summary = "Start an asynchronous findings export")
    public ResponseEntity<ExportStartResponse> start(@Valid @RequestBody ExportRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(exportRunService.startRun(request));
    }

    @GetMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Export findings on the request thread and return the file name")
    public ResponseEntity<String> exportNow(
            @RequestParam(value = "regions", required = false) List<String> regions,
            @RequestParam(value = "failurePolicy", required = false) FailurePolicy failurePolicy) {
        ExportRequest request = ExportRequest.builder()
                .regions(regions)
                .failurePolicy(failurePolicy)
                .build();
        return ResponseEntity.ok(exportRunService.runNow(request));
    }

    @GetMapping("/runs")
    @Operation(summary = "List export runs of this process, newest first")
    public ResponseEntity<List<ExportStatusResponse>> listRuns() {
        return ResponseEntity.ok(exportRunService.listRuns());
    }

    @GetMapping("/{exportId}")
    @Operation(summary = "Get export status")
    public ResponseEntity<ExportStatusResponse> status(@PathVariable String exportId) {
        return ResponseEntity.ok(exportRunService.getStatus(exportId));
    }

    @PostMapping("/{exportId}/cancel")
    @Operation(summary = "Cancel a pending or running export")
    public ResponseEntity<ExportStatusResponse> cancel(@PathVariable String exportId) {
        return ResponseEntity.ok(exportRunService.cancel(exportId));
    }

    @GetMapping("/{exportId}/download")
    @Operation(summary = "Download the export CSV, partial files included")
    public ResponseEntity<Resource> download(@PathVariable String exportId) {
        Path file = exportRunService.artifact(exportId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + file.getFileName())
                .contentType(TEXT_CSV)
                .body(new FileSystemResource(file));
    }
}
