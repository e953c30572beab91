package com.findex.backend.model;

public enum ExportState {
    IDLE,
    PER_REGION,
    PER_DETECTOR,
    PER_PAGE,
    FLATTENING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
