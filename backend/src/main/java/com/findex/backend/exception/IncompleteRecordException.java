package com.findex.backend.exception;

public class IncompleteRecordException extends ExportException {

    private final String findingId;
    private final String missingField;

    public IncompleteRecordException(String findingId, String missingField) {
        super("Finding " + (findingId != null ? findingId : "<unknown>") + " is missing required field " + missingField);
        this.findingId = findingId;
        this.missingField = missingField;
    }

    public String getFindingId() {
        return findingId;
    }

    public String getMissingField() {
        return missingField;
    }
}
