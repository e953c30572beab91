package com.findex.backend.model;

import java.util.Objects;

public record Detector(Region region, String id) {

    public Detector {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String toString() {
        return region.name() + "/" + id;
    }
}
