package com.findex.backend.exception;

public class SinkWriteException extends ExportException {

    private final String sinkName;

    public SinkWriteException(String sinkName, String message, Throwable cause) {
        super("Write to " + sinkName + " failed: " + message, cause);
        this.sinkName = sinkName;
    }

    public String getSinkName() {
        return sinkName;
    }
}
