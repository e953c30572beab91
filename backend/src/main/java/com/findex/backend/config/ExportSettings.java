package com.findex.backend.config;

import com.findex.backend.model.FailurePolicy;

import java.nio.file.Path;

/**
 * Immutable export settings handed to the pipeline components.
 */
public record ExportSettings(
        String regionPrefix,
        Path outputDir,
        int pageSize,
        FailurePolicy failurePolicy,
        int regionParallelism
) {

    /** GetFindings accepts at most this many ids per call. */
    public static final int MAX_PAGE_SIZE = 50;

    public ExportSettings {
        if (regionPrefix == null) {
            regionPrefix = "";
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("findex.export.page-size must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (failurePolicy == null) {
            failurePolicy = FailurePolicy.ABORT;
        }
        if (regionParallelism < 1) {
            throw new IllegalArgumentException("findex.export.region-parallelism must be at least 1");
        }
    }

    public static ExportSettings defaults(Path outputDir) {
        return new ExportSettings("us-", outputDir, MAX_PAGE_SIZE, FailurePolicy.ABORT, 1);
    }

    public ExportSettings withFailurePolicy(FailurePolicy policy) {
        return new ExportSettings(regionPrefix, outputDir, pageSize, policy, regionParallelism);
    }

    public ExportSettings withRegionParallelism(int parallelism) {
        return new ExportSettings(regionPrefix, outputDir, pageSize, failurePolicy, parallelism);
    }

    public ExportSettings withPageSize(int size) {
        return new ExportSettings(regionPrefix, outputDir, size, failurePolicy, regionParallelism);
    }
}
