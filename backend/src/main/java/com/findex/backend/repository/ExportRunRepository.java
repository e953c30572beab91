package com.findex.backend.repository;

import com.findex.backend.model.ExportRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Export runs of the current process. Nothing survives a restart. Once more than
 * {@code maxRuns} are held, the oldest finished runs are dropped; pending and
 * running ones are always kept.
 */
@Slf4j
@Repository
public class ExportRunRepository {

    static final int DEFAULT_MAX_RUNS = 100;

    private final Map<String, ExportRun> runs = new ConcurrentHashMap<>();
    private final int maxRuns;

    public ExportRunRepository() {
        this(DEFAULT_MAX_RUNS);
    }

    @Autowired
    public ExportRunRepository(@Value("${findex.export.max-retained-runs:100}") int maxRuns) {
        this.maxRuns = Math.max(1, maxRuns);
    }

    public ExportRun save(ExportRun run) {
        runs.put(run.getId(), run);
        evictFinished();
        return run;
    }

    public Optional<ExportRun> findById(String id) {
        return Optional.ofNullable(runs.get(id));
    }

    public List<ExportRun> findAllNewestFirst() {
        return runs.values().stream()
                .sorted(Comparator.comparing(ExportRun::getCreatedAt).reversed())
                .toList();
    }

    private synchronized void evictFinished() {
        int excess = runs.size() - maxRuns;
        if (excess <= 0) {
            return;
        }
        List<ExportRun> evicted = runs.values().stream()
                .filter(run -> run.getStatus().isFinished())
                .sorted(Comparator.comparing(ExportRun::getCreatedAt))
                .limit(excess)
                .toList();
        evicted.forEach(run -> runs.remove(run.getId()));
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} finished export runs", evicted.size());
        }
    }
}
