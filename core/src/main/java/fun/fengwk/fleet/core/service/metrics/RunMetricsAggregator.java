package fun.fengwk.fleet.core.service.metrics;

import fun.fengwk.fleet.core.service.director.RunState;
import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.model.FailureKind;
import fun.fengwk.fleet.core.service.job.model.JobError;
import fun.fengwk.fleet.core.service.job.model.JobResult;
import fun.fengwk.fleet.core.service.job.model.JobState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.IntSupplier;

/**
 * Live counters of one run, fed by the workers.
 *
 * <p>Updates and snapshots share one monitor so every snapshot satisfies
 * {@code processed = succeeded + failed} and {@code processed + inFlight <= total}.
 * After {@link #freeze(RunState)} further events are ignored.
 *
 * @author fengwk
 */
@Slf4j
public class RunMetricsAggregator {

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final String runId;
    private final int total;
    private final Clock clock;
    private final long throughputWindowMs;
    private final Instant startedAt;
    private final Deque<Instant> recentCompletions = new ArrayDeque<>();

    private volatile IntSupplier activeWorkers = () -> 0;
    private volatile IntSupplier leasedSessions = () -> 0;

    private RunState runState = RunState.RUNNING;
    private Instant finishedAt;
    private int succeeded;
    private int failed;
    private int cancelled;
    private int inFlight;
    private long totalFieldsExtracted;
    private long totalArtifacts;
    private long totalErrors;
    private long recoverableErrors;
    private long persistenceErrors;
    private long totalJobDurationMs;

    public RunMetricsAggregator(String runId, int total, long throughputWindowMs, Clock clock) {
        this.runId = runId;
        this.total = total;
        this.clock = clock;
        this.throughputWindowMs = Math.max(1L, throughputWindowMs);
        this.startedAt = clock.instant();
    }

    public void bindGauges(IntSupplier activeWorkers, IntSupplier leasedSessions) {
        this.activeWorkers = activeWorkers;
        this.leasedSessions = leasedSessions;
    }

    /**
     * A worker began an attempt of the job.
     */
    public synchronized void onJobStarted(Job job) {
        if (finishedAt != null) {
            return;
        }
        inFlight++;
    }

    /**
     * An attempt failed and the job goes back to the queue.
     */
    public synchronized void onRetry(Job job) {
        if (finishedAt != null) {
            return;
        }
        inFlight = Math.max(0, inFlight - 1);
        totalErrors++;
        recoverableErrors++;
    }

    /**
     * A job a worker was driving reached a terminal state.
     */
    public synchronized void onJobCompleted(Job job) {
        if (finishedAt != null) {
            return;
        }
        inFlight = Math.max(0, inFlight - 1);
        recordTerminal(job);
    }

    /**
     * A job that never left the queue was failed, for example on cancellation.
     */
    public synchronized void onJobDiscarded(Job job) {
        if (finishedAt != null) {
            return;
        }
        recordTerminal(job);
    }

    public synchronized void onPersistenceFailure(String sinkName, Job job) {
        if (finishedAt != null) {
            return;
        }
        persistenceErrors++;
        log.debug("persistence failure counted, runId={}, sink={}, key={}", runId, sinkName, job.getExternalKey());
    }

    /**
     * Track a non-terminal run state change.
     */
    public synchronized void updateState(RunState state) {
        if (finishedAt != null) {
            return;
        }
        runState = state;
    }

    /**
     * Fix the end instant and final state. Idempotent.
     */
    public synchronized RunMetrics freeze(RunState finalState) {
        if (finishedAt == null) {
            runState = finalState;
            finishedAt = clock.instant();
        }
        return snapshot();
    }

    public synchronized boolean isFrozen() {
        return finishedAt != null;
    }

    public synchronized RunMetrics snapshot() {
        Instant now = clock.instant();
        Instant end = finishedAt == null ? now : finishedAt;
        long elapsedMs = Math.max(0L, Duration.between(startedAt, end).toMillis());
        int processed = succeeded + failed;

        double currentThroughput = elapsedMs <= 0 ? 0D : processed * MILLIS_PER_HOUR / elapsedMs;
        double rollingThroughput = rollingThroughput(end, elapsedMs);

        Instant eta = null;
        Long etaRemainingMs = null;
        int remaining = total - processed;
        if (processed > 0 && remaining > 0 && finishedAt == null) {
            long remainingMs = (long) ((double) elapsedMs * remaining / processed);
            etaRemainingMs = remainingMs;
            eta = now.plusMillis(remainingMs);
        }

        return RunMetrics.builder()
            .runId(runId)
            .runState(runState)
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .total(total)
            .processed(processed)
            .succeeded(succeeded)
            .failed(failed)
            .inFlight(inFlight)
            .cancelled(cancelled)
            .currentThroughputPerHour(currentThroughput)
            .rollingThroughputPerHour(rollingThroughput)
            .meanJobDurationMs(processed == 0 ? 0L : totalJobDurationMs / processed)
            .eta(eta)
            .etaRemainingMs(etaRemainingMs)
            .totalFieldsExtracted(totalFieldsExtracted)
            .totalArtifacts(totalArtifacts)
            .totalErrors(totalErrors)
            .recoverableErrors(recoverableErrors)
            .persistenceErrors(persistenceErrors)
            .activeWorkers(finishedAt == null ? activeWorkers.getAsInt() : 0)
            .leasedSessions(finishedAt == null ? leasedSessions.getAsInt() : 0)
            .capturedAt(now)
            .build();
    }

    private void recordTerminal(Job job) {
        Instant now = clock.instant();
        if (job.getState() == JobState.COMPLETED) {
            succeeded++;
            JobResult result = job.getResult();
            if (result != null) {
                totalFieldsExtracted += result.getFieldCount();
                totalArtifacts += result.getArtifactCount();
            }
        } else {
            failed++;
            totalErrors++;
            JobError lastError = job.getLastError();
            if (lastError != null && lastError.getKind() == FailureKind.CANCELLED) {
                cancelled++;
            }
        }
        totalJobDurationMs += job.getTiming().getElapsed().toMillis();
        recentCompletions.addLast(now);
        trimWindow(now);
    }

    private double rollingThroughput(Instant end, long elapsedMs) {
        trimWindow(end);
        long windowMs = Math.min(throughputWindowMs, elapsedMs);
        if (windowMs <= 0) {
            return 0D;
        }
        return recentCompletions.size() * MILLIS_PER_HOUR / windowMs;
    }

    private void trimWindow(Instant now) {
        Instant cutoff = now.minusMillis(throughputWindowMs);
        while (!recentCompletions.isEmpty() && recentCompletions.peekFirst().isBefore(cutoff)) {
            recentCompletions.pollFirst();
        }
    }

}
