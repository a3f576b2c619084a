package fun.fengwk.fleet.core.service.job.worker;

import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.JobQueue;
import fun.fengwk.fleet.core.service.job.model.FailureKind;
import fun.fengwk.fleet.core.service.metrics.RunMetricsAggregator;
import fun.fengwk.fleet.core.service.persist.PersistenceCoordinator;
import fun.fengwk.fleet.core.service.persist.PersistenceReport;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads sharing one job queue and one browser pool.
 *
 * <p>Each worker waits at the pause gate, polls the queue, runs one attempt, then persists,
 * requeues or finishes the job. Attempt errors are recorded on the job; only errors outside an
 * attempt stop a worker, and those are reported to the {@link WorkerFaultListener}.
 *
 * @author fengwk
 */
@Slf4j
public class JobWorkerPool {

    private final String runId;
    private final WorkerPoolConfig config;
    private final JobQueue jobQueue;
    private final JobAttemptRunner attemptRunner;
    private final PersistenceCoordinator persistenceCoordinator;
    private final RunMetricsAggregator metrics;
    private final PauseGate pauseGate;
    private final WorkerFaultListener faultListener;

    private final List<Thread> workerThreads = new CopyOnWriteArrayList<>();
    private final Set<Thread> persistingWorkers = ConcurrentHashMap.newKeySet();
    private final Object interruptLock = new Object();
    private final AtomicInteger busyWorkers = new AtomicInteger(0);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public JobWorkerPool(
        String runId,
        WorkerPoolConfig config,
        JobQueue jobQueue,
        JobAttemptRunner attemptRunner,
        PersistenceCoordinator persistenceCoordinator,
        RunMetricsAggregator metrics,
        PauseGate pauseGate,
        WorkerFaultListener faultListener
    ) {
        this.runId = runId;
        this.config = config;
        this.jobQueue = jobQueue;
        this.attemptRunner = attemptRunner;
        this.persistenceCoordinator = persistenceCoordinator;
        this.metrics = metrics;
        this.pauseGate = pauseGate;
        this.faultListener = faultListener;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("worker pool already started, runId=" + runId);
        }
        int workerCount = Math.max(1, config.getWorkerCount());
        for (int i = 1; i <= workerCount; i++) {
            Thread thread = new Thread(new Worker(), "fleet-worker-" + runId + "-" + i);
            thread.setDaemon(true);
            workerThreads.add(thread);
            thread.start();
        }
        log.info("worker pool started, runId={}, workers={}", runId, workerCount);
    }

    /**
     * Stop taking jobs and interrupt in-flight attempts. Workers persisting a completed job are
     * left to finish their writes.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        log.info("cancelling workers, runId={}", runId);
        synchronized (interruptLock) {
            for (Thread thread : workerThreads) {
                if (!persistingWorkers.contains(thread)) {
                    thread.interrupt();
                }
            }
        }
    }

    /**
     * Interrupt and join every worker.
     *
     * @return true if all workers ended within the timeout
     */
    public boolean stop(long timeoutMs) {
        stopped.set(true);
        for (Thread thread : workerThreads) {
            thread.interrupt();
        }
        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        boolean allStopped = true;
        for (Thread thread : workerThreads) {
            long remaining = deadline - System.currentTimeMillis();
            try {
                if (remaining > 0) {
                    thread.join(remaining);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("interrupted while stopping workers, runId={}", runId);
                allStopped = false;
                break;
            }
            if (thread.isAlive()) {
                log.warn("worker did not stop in time, runId={}, worker={}", runId, thread.getName());
                allStopped = false;
            }
        }
        attemptRunner.shutdown();
        return allStopped;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Workers currently driving a job.
     */
    public int busyWorkers() {
        return busyWorkers.get();
    }

    public int aliveWorkers() {
        int alive = 0;
        for (Thread thread : workerThreads) {
            if (thread.isAlive()) {
                alive++;
            }
        }
        return alive;
    }

    private boolean process(Job job) {
        String workerId = Thread.currentThread().getName();
        boolean inFlight = false;
        boolean settled = false;
        busyWorkers.incrementAndGet();
        try {
            if (cancelled.get()) {
                job.lifecycle().fail(FailureKind.CANCELLED, "run cancelled before the job started");
                metrics.onJobDiscarded(job);
                settled = true;
                jobQueue.markDone(job);
                return true;
            }

            job.lifecycle().begin(workerId);
            metrics.onJobStarted(job);
            inFlight = true;

            AttemptOutcome outcome = attemptRunner.runAttempt(job, cancelled::get);
            switch (outcome) {
                case COMPLETED:
                    persist(job);
                    metrics.onJobCompleted(job);
                    settled = true;
                    jobQueue.markDone(job);
                    break;
                case RETRY:
                    metrics.onRetry(job);
                    inFlight = false;
                    settled = true;
                    if (!jobQueue.requeue(job)) {
                        job.lifecycle().fail(FailureKind.CANCELLED, "queue closed before retry");
                        metrics.onJobDiscarded(job);
                        jobQueue.markDone(job);
                    }
                    break;
                case FAILED:
                    metrics.onJobCompleted(job);
                    settled = true;
                    jobQueue.markDone(job);
                    break;
                default:
                    throw new IllegalStateException("unknown attempt outcome: " + outcome);
            }
            return true;
        } catch (RuntimeException ex) {
            log.error("worker fault, runId={}, worker={}, job={}", runId, workerId, job, ex);
            if (!settled) {
                settleAfterFault(job, ex, inFlight);
            }
            faultListener.onWorkerFault(workerId, job, ex);
            return false;
        } finally {
            busyWorkers.decrementAndGet();
        }
    }

    private void settleAfterFault(Job job, RuntimeException fault, boolean inFlight) {
        try {
            if (!job.isTerminal()) {
                job.lifecycle().fail(FailureKind.FATAL, "worker fault: " + fault.getMessage());
            }
            if (inFlight) {
                metrics.onJobCompleted(job);
            } else {
                metrics.onJobDiscarded(job);
            }
        } finally {
            jobQueue.markDone(job);
        }
    }

    private void persist(Job job) {
        Thread current = Thread.currentThread();
        boolean interrupted;
        synchronized (interruptLock) {
            persistingWorkers.add(current);
            // A cancel that landed after the last phase must not cut the sink backoff short.
            interrupted = Thread.interrupted();
        }
        try {
            PersistenceReport report = persistenceCoordinator.persist(job);
            report.getFailedSinks().keySet().forEach(sink -> metrics.onPersistenceFailure(sink, job));
        } catch (RuntimeException ex) {
            // The job stays completed, only the write is lost.
            log.warn("persist job failed, runId={}, key={}", runId, job.getExternalKey(), ex);
            metrics.onPersistenceFailure("all", job);
        } finally {
            synchronized (interruptLock) {
                persistingWorkers.remove(current);
            }
            if (interrupted || cancelled.get()) {
                current.interrupt();
            }
        }
    }

    private class Worker implements Runnable {

        @Override
        public void run() {
            long pollIntervalMs = Math.max(1L, config.getQueuePollIntervalMs());
            try {
                while (!stopped.get() && !cancelled.get()) {
                    pauseGate.awaitOpen();
                    Job job = jobQueue.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                    if (job == null) {
                        if (jobQueue.isClosed()) {
                            return;
                        }
                        continue;
                    }
                    if (!process(job)) {
                        return;
                    }
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                log.debug("worker exited, runId={}, worker={}", runId, Thread.currentThread().getName());
            }
        }

    }

}
