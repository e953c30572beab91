package com.findex.backend.exception;

import java.util.List;

public class InvalidSelectionException extends ExportException {

    private final List<String> rejectedRegions;

    public InvalidSelectionException(String message) {
        this(message, List.of());
    }

    public InvalidSelectionException(String message, List<String> rejectedRegions) {
        super(message);
        this.rejectedRegions = List.copyOf(rejectedRegions);
    }

    public List<String> getRejectedRegions() {
        return rejectedRegions;
    }
}
