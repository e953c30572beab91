package com.findex.backend.exception;

public class ExportCancelledException extends ExportException {

    public ExportCancelledException(String message) {
        super(message);
    }
}
