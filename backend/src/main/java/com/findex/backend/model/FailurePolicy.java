package com.findex.backend.model;

public enum FailurePolicy {
    /** Stop the whole export on the first fatal error. */
    ABORT,
    /** Record a failed region and continue with the next one. */
    ISOLATE
}
