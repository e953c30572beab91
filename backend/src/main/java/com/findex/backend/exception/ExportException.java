package com.findex.backend.exception;

/**
 * Base type for every failure that terminates an export.
 */
public abstract class ExportException extends RuntimeException {

    protected ExportException(String message) {
        super(message);
    }

    protected ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
