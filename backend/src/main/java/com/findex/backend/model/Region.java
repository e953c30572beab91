package com.findex.backend.model;

import java.util.Objects;

/**
 * An AWS region name, fetched fresh for every export.
 */
public record Region(String name) {

    public Region {
        Objects.requireNonNull(name, "name");
    }

    public static Region of(String name) {
        return new Region(name.trim());
    }

    @Override
    public String toString() {
        return name;
    }
}
