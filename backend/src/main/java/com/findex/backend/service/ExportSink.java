package com.findex.backend.service;

import com.findex.backend.model.ExportRow;

import java.util.List;

/**
 * Destination of exported rows. Implementations are safe for concurrent
 * appends and make each appended batch durable before returning.
 */
public interface ExportSink extends AutoCloseable {

    String name();

    /**
     * @throws com.findex.backend.exception.SinkWriteException if the rows cannot be written
     */
    void append(List<ExportRow> rows);

    long rowCount();

    @Override
    void close();
}
