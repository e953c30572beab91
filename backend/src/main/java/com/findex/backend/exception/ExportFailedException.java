package com.findex.backend.exception;

import com.findex.backend.model.ExportRun;

/**
 * Raised by the synchronous export path so the caller sees the cause together
 * with how many rows were committed before the failure.
 */
public class ExportFailedException extends ExportException {

    private final String exportId;
    private final String fileName;
    private final long rowsWritten;

    public ExportFailedException(ExportRun run) {
        super(run.getErrorMessage() != null ? run.getErrorMessage() : "Export " + run.getId() + " did not complete",
                run.getFailure());
        this.exportId = run.getId();
        this.fileName = run.getFileName();
        this.rowsWritten = run.getTotalRows();
    }

    public String getExportId() {
        return exportId;
    }

    public String getFileName() {
        return fileName;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }
}
