package fun.fengwk.fleet.core.service.director;

import fun.fengwk.fleet.core.service.browser.pool.BrowserPool;
import fun.fengwk.fleet.core.service.browser.pool.BrowserPoolConfig;
import fun.fengwk.fleet.core.service.browser.pool.BrowserPoolException;
import fun.fengwk.fleet.core.service.browser.pool.BrowserSessionFactory;
import fun.fengwk.fleet.core.service.extraction.ExtractionCollaborator;
import fun.fengwk.fleet.core.service.extraction.ExtractionErrorClassifier;
import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.JobQueue;
import fun.fengwk.fleet.core.service.job.model.FailureKind;
import fun.fengwk.fleet.core.service.job.model.JobSpec;
import fun.fengwk.fleet.core.service.job.model.JobState;
import fun.fengwk.fleet.core.service.job.worker.JobAttemptRunner;
import fun.fengwk.fleet.core.service.job.worker.JobWorkerPool;
import fun.fengwk.fleet.core.service.job.worker.WorkerPoolConfig;
import fun.fengwk.fleet.core.service.metrics.RunMetrics;
import fun.fengwk.fleet.core.service.metrics.RunMetricsAggregator;
import fun.fengwk.fleet.core.service.metrics.RunProgressReporter;
import fun.fengwk.fleet.core.service.persist.PersistenceCoordinator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Facade that wires queue, browser pool, workers, metrics and persistence into runs.
 *
 * <p>Only one run is active at a time. Startup order per run: browser pool, sinks, workers,
 * progress reporter. Teardown runs in reverse and always returns every browser lease.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class FleetDirector {

    private final FleetProperties fleetProperties;
    private final BrowserSessionFactory browserSessionFactory;
    private final ExtractionCollaborator extractionCollaborator;
    private final ExtractionErrorClassifier errorClassifier;
    private final PersistenceCoordinator persistenceCoordinator;
    private final RunIdGenerator runIdGenerator;
    private final Clock clock;

    private final Object submitLock = new Object();
    private final Map<String, FleetRun> runs = new ConcurrentHashMap<>();
    private final Deque<FleetRun> runHistory = new ArrayDeque<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile FleetRun latestRun;

    public FleetDirector(
        FleetProperties fleetProperties,
        BrowserSessionFactory browserSessionFactory,
        ExtractionCollaborator extractionCollaborator,
        ExtractionErrorClassifier errorClassifier,
        PersistenceCoordinator persistenceCoordinator,
        RunIdGenerator runIdGenerator,
        Clock clock
    ) {
        this.fleetProperties = fleetProperties;
        this.browserSessionFactory = browserSessionFactory;
        this.extractionCollaborator = extractionCollaborator;
        this.errorClassifier = errorClassifier;
        this.persistenceCoordinator = persistenceCoordinator;
        this.runIdGenerator = runIdGenerator;
        this.clock = clock;
    }

    /**
     * Validate the batch, create a run and queue its jobs.
     *
     * @return the new run id
     * @throws RunRejectedException another run is active or the director is shut down
     * @throws IllegalArgumentException the batch is empty or carries a blank key
     */
    public String submit(List<JobSpec> specs) {
        List<JobSpec> accepted = normalizeSpecs(specs);
        synchronized (submitLock) {
            if (shutdown.get()) {
                throw new RunRejectedException("director is shut down");
            }
            FleetRun current = latestRun;
            if (current != null && !current.getState().isTerminal()) {
                throw new RunRejectedException("run " + current.getRunId() + " is still " + current.getState());
            }

            String runId = runIdGenerator.next();
            List<Job> jobs = new ArrayList<>(accepted.size());
            JobQueue jobQueue = new JobQueue();
            for (JobSpec spec : accepted) {
                Job job = new Job(runId, spec, fleetProperties.getMaxAttempts(), fleetProperties.getTotalSteps(), clock);
                jobs.add(job);
                jobQueue.enqueue(job);
            }
            RunMetricsAggregator metrics = new RunMetricsAggregator(
                runId, jobs.size(), fleetProperties.getThroughputWindowMs(), clock);
            metrics.updateState(RunState.SUBMITTED);
            FleetRun run = new FleetRun(runId, clock.instant(), jobs, jobQueue, metrics);
            runs.put(runId, run);
            runHistory.addLast(run);
            latestRun = run;
            evictFinishedRuns();
            log.info("run submitted, runId={}, jobs={}", runId, jobs.size());
            return runId;
        }
    }

    /**
     * Run the latest submitted run on the calling thread.
     */
    public RunMetrics run() {
        FleetRun run = latestRun;
        if (run == null) {
            throw new IllegalStateException("no run submitted");
        }
        return run(run.getRunId());
    }

    /**
     * Drive a submitted run to its end on the calling thread.
     *
     * @return the frozen metrics of the run
     */
    public RunMetrics run(String runId) {
        FleetRun run = requireRun(runId);
        WorkerPoolConfig workerConfig = WorkerPoolConfig.builder()
            .workerCount(fleetProperties.getWorkerCount())
            .queuePollIntervalMs(fleetProperties.getQueuePollIntervalMs())
            .jobSoftTimeoutMs(fleetProperties.getJobSoftTimeoutMs())
            .acquireTimeoutMs(fleetProperties.getAcquireTimeoutMs())
            .build();
        BrowserPool browserPool = new BrowserPool("fleet-" + runId, BrowserPoolConfig.builder()
            .capacity(fleetProperties.getPoolCapacity())
            .acquireTimeoutMs(fleetProperties.getAcquireTimeoutMs())
            .shutdownGraceMs(fleetProperties.getShutdownGraceMs())
            .build(), browserSessionFactory);
        JobAttemptRunner attemptRunner = new JobAttemptRunner(
            runId, browserPool, extractionCollaborator, errorClassifier, workerConfig);
        JobWorkerPool workerPool = new JobWorkerPool(
            runId,
            workerConfig,
            run.jobQueue(),
            attemptRunner,
            persistenceCoordinator,
            run.aggregator(),
            run.pauseGate(),
            (workerId, job, error) -> halt(run, "worker " + workerId + " failed: " + error.getMessage(), error)
        );

        if (!run.markRunning(browserPool, workerPool)) {
            attemptRunner.shutdown();
            if (run.getState().isTerminal()) {
                return run.metrics();
            }
            throw new IllegalStateException("run " + runId + " was already started, state=" + run.getState());
        }

        RunProgressReporter reporter = new RunProgressReporter(runId, run.aggregator(), fleetProperties.getMonitorIntervalMs());
        run.aggregator().bindGauges(workerPool::busyWorkers, browserPool::getLeasedCount);
        log.info("run starting, runId={}, jobs={}, workers={}, poolCapacity={}",
            runId, run.getJobs().size(), fleetProperties.getWorkerCount(), fleetProperties.getPoolCapacity());
        try {
            browserPool.initialize();
            persistenceCoordinator.initialize();
            if (!run.isCancelRequested()) {
                workerPool.start();
                reporter.start();
            }
            if (run.isCancelRequested()) {
                discardPending(run, "run cancelled");
            }
            run.jobQueue().awaitDrained();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("run interrupted, cancelling, runId={}", runId);
            requestCancel(run);
        } catch (RuntimeException ex) {
            log.error("run failed, runId={}", runId, ex);
            halt(run, ex.getMessage(), ex);
        } finally {
            teardown(run, browserPool, workerPool, reporter);
        }
        return run.metrics();
    }

    /**
     * Submit a batch and run it on a background thread.
     */
    public String start(List<JobSpec> specs) {
        String runId = submit(specs);
        Thread thread = new Thread(() -> {
            try {
                run(runId);
            } catch (RuntimeException ex) {
                log.error("background run failed, runId={}", runId, ex);
            }
        }, "fleet-director-" + runId);
        thread.setDaemon(true);
        thread.start();
        return runId;
    }

    /**
     * Cancel a run: queued jobs fail as cancelled, in-flight phases are interrupted. Waits until the
     * run has returned every lease when it had started.
     *
     * @return false if the run already ended or a cancellation is underway
     */
    public boolean cancel(String runId) {
        FleetRun run = requireRun(runId);
        if (!requestCancel(run)) {
            return false;
        }
        if (run.getState() == RunState.SUBMITTED) {
            finishUnstarted(run);
        }
        awaitFinished(run);
        return true;
    }

    public boolean pause(String runId) {
        FleetRun run = requireRun(runId);
        boolean paused = run.pause();
        if (paused) {
            log.info("run paused, runId={}", runId);
        }
        return paused;
    }

    public boolean resume(String runId) {
        FleetRun run = requireRun(runId);
        boolean resumed = run.resume();
        if (resumed) {
            log.info("run resumed, runId={}", runId);
        }
        return resumed;
    }

    public RunMetrics status(String runId) {
        return requireRun(runId).metrics();
    }

    /**
     * Jobs of a run, optionally only those in the given state.
     */
    public List<Job> jobs(String runId, JobState state) {
        return requireRun(runId).getJobs(state);
    }

    public FleetRun getRun(String runId) {
        return requireRun(runId);
    }

    public Optional<FleetRun> latestRun() {
        return Optional.ofNullable(latestRun);
    }

    /**
     * Cancel any active run and refuse new ones. Idempotent.
     */
    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        FleetRun run;
        synchronized (submitLock) {
            run = latestRun;
        }
        if (run != null && !run.getState().isTerminal()) {
            log.info("director shutting down, cancelling active run, runId={}", run.getRunId());
            cancel(run.getRunId());
            BrowserPool browserPool = run.browserPool();
            if (browserPool != null && !run.isFinished()) {
                // The run thread did not finish in time, take the sessions back here.
                shutdownPool(run, browserPool, 0L);
            }
        }
        log.info("director shutdown completed");
    }

    private boolean requestCancel(FleetRun run) {
        if (!run.requestCancel()) {
            return false;
        }
        log.info("cancelling run, runId={}, state={}", run.getRunId(), run.getState());
        run.jobQueue().close();
        JobWorkerPool workerPool = run.workerPool();
        if (workerPool != null) {
            workerPool.cancel();
        }
        discardPending(run, "run cancelled");
        return true;
    }

    private void halt(FleetRun run, String reason, Throwable error) {
        if (!run.recordFault(error)) {
            return;
        }
        log.error("halting run, runId={}, reason={}", run.getRunId(), reason);
        run.jobQueue().close();
        JobWorkerPool workerPool = run.workerPool();
        if (workerPool != null) {
            workerPool.cancel();
        }
        discardPending(run, "run halted: " + reason);
    }

    private void discardPending(FleetRun run, String reason) {
        for (Job job : run.jobQueue().drainPending()) {
            try {
                job.lifecycle().fail(FailureKind.CANCELLED, reason);
                run.aggregator().onJobDiscarded(job);
            } finally {
                run.jobQueue().markDone(job);
            }
        }
    }

    private void evictFinishedRuns() {
        int retained = Math.max(1, fleetProperties.getRetainedRuns());
        while (runHistory.size() > retained && runHistory.peekFirst().getState().isTerminal()) {
            FleetRun evicted = runHistory.pollFirst();
            runs.remove(evicted.getRunId());
            log.debug("finished run evicted, runId={}", evicted.getRunId());
        }
    }

    private void finishUnstarted(FleetRun run) {
        if (run.finishIfUnstarted(RunState.CANCELLED)) {
            log.info("run cancelled before start, runId={}", run.getRunId());
        }
    }

    private void teardown(FleetRun run, BrowserPool browserPool, JobWorkerPool workerPool, RunProgressReporter reporter) {
        run.markStopping();
        run.jobQueue().close();
        reporter.stop();
        long graceMs = fleetProperties.getShutdownGraceMs();
        if (!workerPool.stop(graceMs)) {
            log.warn("workers still running after grace period, runId={}", run.getRunId());
        }
        discardPending(run, run.isCancelRequested() ? "run cancelled" : "run stopped");
        shutdownPool(run, browserPool, graceMs);

        RunState finalState;
        if (run.getFault() != null) {
            finalState = RunState.FAILED;
        } else if (run.isCancelRequested()) {
            finalState = RunState.CANCELLED;
        } else {
            finalState = RunState.COMPLETED;
        }
        run.finish(finalState);
        logSummary(run.metrics());
    }

    private void shutdownPool(FleetRun run, BrowserPool browserPool, long graceMs) {
        try {
            browserPool.shutdown(graceMs);
        } catch (BrowserPoolException ex) {
            log.warn("browser pool shutdown reported failures, runId={}, failures={}",
                run.getRunId(), ex.getSuppressed().length, ex);
        }
    }

    private void awaitFinished(FleetRun run) {
        long timeoutMs = fleetProperties.getShutdownGraceMs() * 2 + fleetProperties.getQueuePollIntervalMs();
        try {
            if (!run.awaitFinished(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("run did not finish in time, runId={}, timeoutMs={}", run.getRunId(), timeoutMs);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while waiting for run to finish, runId={}", run.getRunId());
        }
    }

    private void logSummary(RunMetrics metrics) {
        Duration elapsed = metrics.getFinishedAt() == null
            ? Duration.ZERO
            : Duration.between(metrics.getStartedAt(), metrics.getFinishedAt());
        log.info(
            "run finished, runId={}, state={}, total={}, succeeded={}, failed={}, cancelled={}, successRate={}%, "
                + "elapsed={}, fields={}, artifacts={}, errors={}, recoverableErrors={}, persistenceErrors={}",
            metrics.getRunId(),
            metrics.getRunState(),
            metrics.getTotal(),
            metrics.getSucceeded(),
            metrics.getFailed(),
            metrics.getCancelled(),
            Math.round(metrics.successRate()),
            elapsed,
            metrics.getTotalFieldsExtracted(),
            metrics.getTotalArtifacts(),
            metrics.getTotalErrors(),
            metrics.getRecoverableErrors(),
            metrics.getPersistenceErrors()
        );
    }

    private FleetRun requireRun(String runId) {
        if (!StringUtils.hasText(runId)) {
            throw new IllegalArgumentException("runId is blank");
        }
        FleetRun run = runs.get(runId.trim());
        if (run == null) {
            throw new RunNotFoundException(runId);
        }
        return run;
    }

    private List<JobSpec> normalizeSpecs(List<JobSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("batch has no jobs");
        }
        Map<String, JobSpec> byKey = new LinkedHashMap<>();
        for (JobSpec spec : specs) {
            if (spec == null || !StringUtils.hasText(spec.getExternalKey())) {
                throw new IllegalArgumentException("job key is blank");
            }
            String key = spec.getExternalKey().trim();
            if (byKey.containsKey(key)) {
                log.info("duplicate job key ignored, key={}", key);
                continue;
            }
            byKey.put(key, JobSpec.builder()
                .externalKey(key)
                .priority(spec.getPriority())
                .displayName(spec.getDisplayName())
                .build());
        }
        return new ArrayList<>(byKey.values());
    }

}
