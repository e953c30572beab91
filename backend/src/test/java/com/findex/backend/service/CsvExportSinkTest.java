package com.findex.backend.service;

import com.findex.backend.exception.SinkWriteException;
import com.findex.backend.model.ExportRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvExportSinkTest {

    private static final String HEADER = "Region,FindingId,Title,Description,Severity,CreatedAt,UpdatedAt\n";

    @TempDir
    Path dir;

    @Test
    void headerIsWrittenOnOpen() throws Exception {
        Path file = dir.resolve("out.csv");

        try (CsvExportSink sink = CsvExportSink.open(file)) {
            assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(HEADER);
            assertThat(sink.rowCount()).isZero();
        }
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(HEADER);
    }

    @Test
    void rowsAreDurableAfterEachAppendAndQuotedWhenNeeded() throws Exception {
        Path file = dir.resolve("out.csv");
        CsvExportSink sink = CsvExportSink.open(file);

        sink.append(List.of(new ExportRow("us-east-1", "f1", "Plain", "simple", "5.0", "c1", "u1")));
        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .isEqualTo(HEADER + "us-east-1,f1,Plain,simple,5.0,c1,u1\n");

        sink.append(List.of(new ExportRow("us-east-1", "f2", "A, B", "say \"hi\"\nbye", "7.0", "c2", "u2")));
        sink.close();

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(HEADER
                + "us-east-1,f1,Plain,simple,5.0,c1,u1\n"
                + "us-east-1,f2,\"A, B\",\"say \"\"hi\"\"\nbye\",7.0,c2,u2\n");
        assertThat(sink.rowCount()).isEqualTo(2);
    }

    @Test
    void appendAfterCloseFails() {
        CsvExportSink sink = CsvExportSink.open(dir.resolve("out.csv"));
        sink.close();

        assertThatThrownBy(() -> sink.append(List.of(new ExportRow("r", "f", "t", "d", "1.0", "c", "u"))))
                .isInstanceOf(SinkWriteException.class);
    }

    @Test
    void unwritableLocationFailsWithSinkWriteException() {
        Path file = dir.resolve("missing-dir").resolve("out.csv");

        assertThatThrownBy(() -> CsvExportSink.open(file))
                .isInstanceOf(SinkWriteException.class)
                .hasMessageContaining("cannot open file");
    }

    @Test
    void failedFlushDoesNotCountTheBatch() {
        FlakyWriter writer = new FlakyWriter();
        CsvExportSink sink = openOver(writer);
        sink.append(List.of(new ExportRow("us-east-1", "f1", "t", "d", "1.0", "c", "u")));

        writer.failFlush = true;

        assertThatThrownBy(() -> sink.append(List.of(
                new ExportRow("us-east-1", "f2", "t", "d", "1.0", "c", "u"),
                new ExportRow("us-east-1", "f3", "t", "d", "1.0", "c", "u"))))
                .isInstanceOf(SinkWriteException.class);
        assertThat(sink.rowCount()).isEqualTo(1);
    }

    private CsvExportSink openOver(Writer writer) {
        try {
            return CsvExportSink.over(dir.resolve("out.csv"), writer);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static final class FlakyWriter extends Writer {
        private final StringBuilder written = new StringBuilder();
        private boolean failFlush;

        @Override
        public void write(char[] buffer, int offset, int length) {
            written.append(buffer, offset, length);
        }

        @Override
        public void flush() throws IOException {
            if (failFlush) {
                throw new IOException("disk full");
            }
        }

        @Override
        public void close() {
        }
    }
}
