package com.findex.backend.service;

import com.findex.backend.model.ExportProgress;

@FunctionalInterface
public interface ExportProgressListener {

    void onProgress(ExportProgress progress);

    static ExportProgressListener noop() {
        return progress -> {
        };
    }
}
