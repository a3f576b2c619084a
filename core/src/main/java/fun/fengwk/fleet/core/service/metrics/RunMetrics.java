package fun.fengwk.fleet.core.service.metrics;

import fun.fengwk.fleet.core.service.director.RunState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of a run's progress.
 *
 * @author fengwk
 */
@Value
@Builder
public class RunMetrics {

    String runId;
    RunState runState;
    Instant startedAt;

    /**
     * Set once the run is frozen.
     */
    Instant finishedAt;

    int total;
    int processed;
    int succeeded;
    int failed;
    int inFlight;
    int cancelled;

    /**
     * Jobs per hour since the run started.
     */
    double currentThroughputPerHour;

    /**
     * Jobs per hour over the recent completion window.
     */
    double rollingThroughputPerHour;

    long meanJobDurationMs;

    /**
     * Projected completion instant, null before the first job finishes or once nothing remains.
     */
    Instant eta;

    /**
     * Milliseconds until {@link #eta}, null whenever the eta is.
     */
    Long etaRemainingMs;

    long totalFieldsExtracted;
    long totalArtifacts;
    long totalErrors;
    long recoverableErrors;
    long persistenceErrors;
    int activeWorkers;
    int leasedSessions;
    Instant capturedAt;

    public double percentComplete() {
        if (total <= 0) {
            return 100D;
        }
        return processed * 100D / total;
    }

    public double successRate() {
        if (processed <= 0) {
            return 0D;
        }
        return succeeded * 100D / processed;
    }

}
