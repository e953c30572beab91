package com.findex.backend.repository;

import com.findex.backend.model.ExportRun;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExportRunRepositoryTest {

    private static ExportRun run(String id, long createdAtSeconds) {
        return new ExportRun(id, List.of("us-east-1"), id + ".csv", Path.of(id + ".csv"),
                Instant.ofEpochSecond(createdAtSeconds));
    }

    @Test
    void oldestFinishedRunsAreEvictedOverCapacity() {
        ExportRunRepository repository = new ExportRunRepository(2);
        ExportRun first = run("first", 1);
        ExportRun second = run("second", 2);
        first.cancel();
        second.cancel();
        repository.save(first);
        repository.save(second);

        repository.save(run("third", 3));

        assertThat(repository.findById("first")).isEmpty();
        assertThat(repository.findAllNewestFirst()).extracting(ExportRun::getId)
                .containsExactly("third", "second");
    }

    @Test
    void unfinishedRunsAreNeverEvicted() {
        ExportRunRepository repository = new ExportRunRepository(1);
        repository.save(run("pending", 1));
        ExportRun running = run("running", 2);
        running.markRunning();
        repository.save(running);

        assertThat(repository.findAllNewestFirst()).extracting(ExportRun::getId)
                .containsExactly("running", "pending");
    }
}
