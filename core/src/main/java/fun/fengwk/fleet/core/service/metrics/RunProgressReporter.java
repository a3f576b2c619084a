package fun.fengwk.fleet.core.service.metrics;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic progress line of a running batch.
 *
 * @author fengwk
 */
@Slf4j
public class RunProgressReporter {

    private final RunMetricsAggregator aggregator;
    private final long intervalMs;
    private final String runId;
    private ScheduledExecutorService scheduler;

    public RunProgressReporter(String runId, RunMetricsAggregator aggregator, long intervalMs) {
        this.runId = runId;
        this.aggregator = aggregator;
        this.intervalMs = Math.max(1L, intervalMs);
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "fleet-monitor-" + runId);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::report, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
    }

    void report() {
        try {
            log.info(format(aggregator.snapshot()));
        } catch (RuntimeException ex) {
            // A failing report must not cancel the schedule.
            log.warn("run progress report failed, runId={}", runId, ex);
        }
    }

    public static String format(RunMetrics metrics) {
        return String.format(
            Locale.ROOT,
            "run progress, runId=%s, state=%s, processed=%d/%d (%.1f%%), succeeded=%d, failed=%d, inFlight=%d, "
                + "throughput=%.1f/h, rollingThroughput=%.1f/h, eta=%s",
            metrics.getRunId(),
            metrics.getRunState(),
            metrics.getProcessed(),
            metrics.getTotal(),
            metrics.percentComplete(),
            metrics.getSucceeded(),
            metrics.getFailed(),
            metrics.getInFlight(),
            metrics.getCurrentThroughputPerHour(),
            metrics.getRollingThroughputPerHour(),
            metrics.getEta() == null ? "n/a" : metrics.getEta().toString()
        );
    }

}
