package com.findex.backend.exception;

/**
 * A call to EC2 or GuardDuty failed: transport, authentication, throttling,
 * malformed response or deadline expiry. Never retried.
 */
public class RemoteServiceException extends ExportException {

    private final String operation;
    private final String region;
    private final int statusCode;

    public RemoteServiceException(String operation, String region, String message) {
        this(operation, region, -1, message, null);
    }

    public RemoteServiceException(String operation, String region, String message, Throwable cause) {
        this(operation, region, -1, message, cause);
    }

    public RemoteServiceException(String operation, String region, int statusCode, String message, Throwable cause) {
        super(operation + " failed in " + region + ": " + message, cause);
        this.operation = operation;
        this.region = region;
        this.statusCode = statusCode;
    }

    public String getOperation() {
        return operation;
    }

    public String getRegion() {
        return region;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
