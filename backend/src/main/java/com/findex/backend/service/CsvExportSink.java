package com.findex.backend.service;

import com.findex.backend.exception.SinkWriteException;
import com.findex.backend.model.ExportRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * UTF-8 CSV file with the fixed export header. Fields containing a comma,
 * quote or line break are quoted and embedded quotes doubled.
 */
@Slf4j
public class CsvExportSink implements ExportSink {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(ExportRow.HEADER.toArray(String[]::new))
            .setRecordSeparator("\n")
            .build();

    private final Path path;
    private final CSVPrinter printer;
    private long rowCount;
    private boolean closed;

    private CsvExportSink(Path path, CSVPrinter printer) {
        this.path = path;
        this.printer = printer;
    }

    /**
     * Opens the file, truncating anything already there, and writes the header.
     */
    public static CsvExportSink open(Path path) {
        Writer writer = null;
        try {
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return over(path, writer);
        } catch (IOException e) {
            closeQuietly(writer, e);
            throw new SinkWriteException(path.toString(), "cannot open file", e);
        }
    }

    static CsvExportSink over(Path path, Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, FORMAT);
        printer.flush();
        return new CsvExportSink(path, printer);
    }

    @Override
    public String name() {
        return path.getFileName().toString();
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void append(List<ExportRow> rows) {
        if (closed) {
            throw new SinkWriteException(name(), "sink is closed", null);
        }
        try {
            for (ExportRow row : rows) {
                printer.printRecord(row.values());
            }
            printer.flush();
            rowCount += rows.size();
        } catch (IOException e) {
            throw new SinkWriteException(name(), e.getMessage(), e);
        }
    }

    @Override
    public synchronized long rowCount() {
        return rowCount;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            printer.close(true);
            log.debug("Closed {} after {} rows", path, rowCount);
        } catch (IOException e) {
            throw new SinkWriteException(name(), "close failed: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Writer writer, IOException primary) {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}
