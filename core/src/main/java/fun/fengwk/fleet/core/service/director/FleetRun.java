package fun.fengwk.fleet.core.service.director;

import fun.fengwk.fleet.core.service.browser.pool.BrowserPool;
import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.JobQueue;
import fun.fengwk.fleet.core.service.job.model.JobState;
import fun.fengwk.fleet.core.service.job.worker.JobWorkerPool;
import fun.fengwk.fleet.core.service.job.worker.PauseGate;
import fun.fengwk.fleet.core.service.metrics.RunMetrics;
import fun.fengwk.fleet.core.service.metrics.RunMetricsAggregator;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One submitted batch and everything the director created for it.
 *
 * @author fengwk
 */
public class FleetRun {

    private final String runId;
    private final Instant submittedAt;
    private final List<Job> jobs;
    private final JobQueue jobQueue;
    private final RunMetricsAggregator metrics;
    private final PauseGate pauseGate = new PauseGate();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicReference<Throwable> fault = new AtomicReference<>();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile RunState state = RunState.SUBMITTED;
    private volatile BrowserPool browserPool;
    private volatile JobWorkerPool workerPool;
    private volatile RunMetrics finalMetrics;

    FleetRun(String runId, Instant submittedAt, List<Job> jobs, JobQueue jobQueue, RunMetricsAggregator metrics) {
        this.runId = runId;
        this.submittedAt = submittedAt;
        this.jobs = List.copyOf(jobs);
        this.jobQueue = jobQueue;
        this.metrics = metrics;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Every job of the run in submission order.
     */
    public List<Job> getJobs() {
        return jobs;
    }

    public List<Job> getJobs(JobState state) {
        if (state == null) {
            return jobs;
        }
        return jobs.stream().filter(job -> job.getState() == state).toList();
    }

    /**
     * Jobs that reached a terminal state.
     */
    public List<Job> getTerminalJobs() {
        return jobs.stream().filter(Job::isTerminal).toList();
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public Throwable getFault() {
        return fault.get();
    }

    /**
     * Final metrics once the run finished, otherwise a live snapshot.
     */
    public RunMetrics metrics() {
        RunMetrics frozen = finalMetrics;
        return frozen != null ? frozen : metrics.snapshot();
    }

    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    JobQueue jobQueue() {
        return jobQueue;
    }

    RunMetricsAggregator aggregator() {
        return metrics;
    }

    PauseGate pauseGate() {
        return pauseGate;
    }

    BrowserPool browserPool() {
        return browserPool;
    }

    JobWorkerPool workerPool() {
        return workerPool;
    }

    synchronized boolean markRunning(BrowserPool browserPool, JobWorkerPool workerPool) {
        if (state != RunState.SUBMITTED) {
            return false;
        }
        this.browserPool = browserPool;
        this.workerPool = workerPool;
        changeState(RunState.RUNNING);
        return true;
    }

    synchronized boolean pause() {
        if (state != RunState.RUNNING) {
            return false;
        }
        pauseGate.pause();
        changeState(RunState.PAUSED);
        return true;
    }

    synchronized boolean resume() {
        if (state != RunState.PAUSED) {
            return false;
        }
        pauseGate.resume();
        changeState(RunState.RUNNING);
        return true;
    }

    boolean requestCancel() {
        return !state.isTerminal() && cancelRequested.compareAndSet(false, true);
    }

    boolean recordFault(Throwable error) {
        return fault.compareAndSet(null, error);
    }

    synchronized void markStopping() {
        if (!state.isTerminal()) {
            pauseGate.resume();
            changeState(RunState.STOPPING);
        }
    }

    synchronized boolean finishIfUnstarted(RunState finalState) {
        if (state != RunState.SUBMITTED) {
            return false;
        }
        finish(finalState);
        return true;
    }

    synchronized void finish(RunState finalState) {
        if (state.isTerminal()) {
            return;
        }
        pauseGate.resume();
        state = finalState;
        finalMetrics = metrics.freeze(finalState);
        finished.countDown();
    }

    private void changeState(RunState next) {
        state = next;
        metrics.updateState(next);
    }

    @Override
    public String toString() {
        return "FleetRun{runId=" + runId + ", state=" + state + ", jobs=" + jobs.size() + "}";
    }

}
