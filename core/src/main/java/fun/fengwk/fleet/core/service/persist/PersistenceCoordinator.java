package fun.fengwk.fleet.core.service.persist;

import fun.fengwk.fleet.core.service.job.Job;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans each completed job out to the active sinks.
 *
 * <p>Each sink gets its own retries with exponential backoff. A sink that fails every attempt is
 * reported in the {@link PersistenceReport}; it never changes the job's state.
 *
 * @author fengwk
 */
@Slf4j
public class PersistenceCoordinator {

    private final List<ResultSink> sinks;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final List<ResultSink> activeSinks = new CopyOnWriteArrayList<>();

    public PersistenceCoordinator(List<ResultSink> sinks, int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        this.sinks = List.copyOf(sinks);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0L, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.activeSinks.addAll(this.sinks);
    }

    /**
     * Health-check every sink. Unhealthy sinks are skipped until the next call.
     */
    public void initialize() {
        List<ResultSink> healthy = new ArrayList<>();
        for (ResultSink sink : sinks) {
            if (checkHealth(sink)) {
                healthy.add(sink);
            } else {
                log.warn("result sink unavailable, skipped for this run, sink={}", sink.name());
            }
        }
        activeSinks.clear();
        activeSinks.addAll(healthy);
        log.info("persistence initialized, activeSinks={}", healthy.stream().map(ResultSink::name).toList());
    }

    public List<String> activeSinkNames() {
        return activeSinks.stream().map(ResultSink::name).toList();
    }

    /**
     * Write the job's result to every active sink.
     */
    public PersistenceReport persist(Job job) {
        JobResultRecord record = JobResultRecord.from(job);
        List<String> written = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (ResultSink sink : activeSinks) {
            String error = writeWithRetry(sink, record);
            if (error == null) {
                written.add(sink.name());
            } else {
                failed.put(sink.name(), error);
            }
        }
        return new PersistenceReport(record.getExternalKey(), written, failed);
    }

    private String writeWithRetry(ResultSink sink, JobResultRecord record) {
        long backoffMs = initialBackoffMs;
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sink.write(record);
                return null;
            } catch (RuntimeException ex) {
                lastError = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                log.warn("result write failed, sink={}, runId={}, key={}, attempt={}/{}, error={}",
                    sink.name(), record.getRunId(), record.getExternalKey(), attempt, maxAttempts, lastError);
            }
            if (attempt < maxAttempts) {
                if (!sleep(backoffMs)) {
                    return lastError + " (interrupted)";
                }
                backoffMs = Math.min(maxBackoffMs, Math.max(1L, backoffMs * 2));
            }
        }
        log.error("result write gave up, sink={}, runId={}, key={}, attempts={}",
            sink.name(), record.getRunId(), record.getExternalKey(), maxAttempts);
        return lastError;
    }

    private boolean checkHealth(ResultSink sink) {
        try {
            return sink.isHealthy();
        } catch (RuntimeException ex) {
            log.warn("result sink health check failed, sink={}, error={}", sink.name(), ex.getMessage());
            return false;
        }
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

}
