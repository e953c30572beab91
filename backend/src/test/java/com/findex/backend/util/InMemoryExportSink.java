package com.findex.backend.util;

import com.findex.backend.exception.SinkWriteException;
import com.findex.backend.model.ExportRow;
import com.findex.backend.service.ExportSink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class InMemoryExportSink implements ExportSink {

    private final List<ExportRow> rows = new ArrayList<>();
    private int failOnAppend = -1;
    private int appends;
    private boolean closed;

    /** Makes the n-th append (1-based) fail with an I/O error. */
    public InMemoryExportSink failOnAppend(int n) {
        this.failOnAppend = n;
        return this;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public synchronized void append(List<ExportRow> batch) {
        appends++;
        if (appends == failOnAppend) {
            throw new SinkWriteException(name(), "disk full", new IOException("disk full"));
        }
        rows.addAll(batch);
    }

    @Override
    public synchronized long rowCount() {
        return rows.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    public synchronized List<ExportRow> rows() {
        return List.copyOf(rows);
    }

    public synchronized List<String> findingIds() {
        return rows.stream().map(ExportRow::findingId).toList();
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
