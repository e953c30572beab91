package com.findex.backend.service;

import com.findex.backend.config.ExportSettings;
import com.findex.backend.exception.SinkWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Names and creates export files under the configured output directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportFileStore {

    static final String PREFIX = "guardduty_findings_";
    static final String EXTENSION = ".csv";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_SUFFIX = 10_000;

    private final ExportSettings exportSettings;
    private final Clock clock;

    /**
     * Creates an empty file named after the current local time. When the name is
     * taken a numeric suffix is added, so two exports in the same second never
     * share a file.
     */
    public Path reserve() {
        Path dir = exportSettings.outputDir();
        String stem = PREFIX + LocalDateTime.now(clock).format(STAMP);
        try {
            Files.createDirectories(dir);
            for (int suffix = 0; suffix < MAX_SUFFIX; suffix++) {
                String fileName = suffix == 0 ? stem + EXTENSION : stem + "_" + suffix + EXTENSION;
                Path candidate = dir.resolve(fileName);
                try {
                    Files.createFile(candidate);
                    log.debug("Reserved export file {}", candidate);
                    return candidate;
                } catch (FileAlreadyExistsException taken) {
                    log.debug("Export file {} already exists", candidate);
                }
            }
        } catch (IOException e) {
            throw new SinkWriteException(dir.toString(), "cannot create export file: " + e.getMessage(), e);
        }
        throw new SinkWriteException(dir.toString(), "no free file name for " + stem, null);
    }

    public CsvExportSink open(Path path) {
        return CsvExportSink.open(path);
    }
}
