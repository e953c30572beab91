package com.findex.backend.model;

public record RegionOutcome(int position, String region, Status status, long rows, String reason) {

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    public static RegionOutcome succeeded(int position, Region region, long rows) {
        return new RegionOutcome(position, region.name(), Status.SUCCEEDED, rows, null);
    }

    public static RegionOutcome failed(int position, Region region, long rows, String reason) {
        return new RegionOutcome(position, region.name(), Status.FAILED, rows, reason);
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
