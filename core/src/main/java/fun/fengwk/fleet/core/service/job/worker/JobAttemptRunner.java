package fun.fengwk.fleet.core.service.job.worker;

import fun.fengwk.fleet.core.service.browser.pool.BrowserLease;
import fun.fengwk.fleet.core.service.browser.pool.BrowserPool;
import fun.fengwk.fleet.core.service.browser.pool.BrowserPoolBusyException;
import fun.fengwk.fleet.core.service.browser.pool.BrowserPoolException;
import fun.fengwk.fleet.core.service.extraction.ExtractionCollaborator;
import fun.fengwk.fleet.core.service.extraction.ExtractionContext;
import fun.fengwk.fleet.core.service.extraction.ExtractionErrorClassifier;
import fun.fengwk.fleet.core.service.extraction.ExtractionPhase;
import fun.fengwk.fleet.core.service.extraction.PhaseResult;
import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.model.FailureKind;
import fun.fengwk.fleet.core.service.job.model.JobState;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Drives one attempt of a job: lease a session, run every extraction phase under the job's soft
 * timeout, then record the outcome on the job's state machine.
 *
 * <p>Phases run on a separate executor so the worker can stop waiting when the budget runs out.
 * The lease is returned on every exit path before this method returns.
 *
 * @author fengwk
 */
@Slf4j
public class JobAttemptRunner {

    private final BrowserPool browserPool;
    private final ExtractionCollaborator collaborator;
    private final ExtractionErrorClassifier errorClassifier;
    private final long jobSoftTimeoutMs;
    private final long acquireTimeoutMs;
    private final ExecutorService phaseExecutor;

    public JobAttemptRunner(
        String runId,
        BrowserPool browserPool,
        ExtractionCollaborator collaborator,
        ExtractionErrorClassifier errorClassifier,
        WorkerPoolConfig config
    ) {
        this.browserPool = browserPool;
        this.collaborator = collaborator;
        this.errorClassifier = errorClassifier;
        this.jobSoftTimeoutMs = Math.max(1L, config.getJobSoftTimeoutMs());
        this.acquireTimeoutMs = Math.max(1L, config.getAcquireTimeoutMs());
        AtomicInteger threadIdGen = new AtomicInteger(1);
        this.phaseExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "fleet-phase-" + runId + "-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Run the attempt the caller has already begun on the job's state machine.
     *
     * @param cancelled checked at every phase boundary
     * @throws BrowserPoolException the pool is shut down, which no retry can fix
     */
    public AttemptOutcome runAttempt(Job job, BooleanSupplier cancelled) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(jobSoftTimeoutMs);

        BrowserLease lease;
        try {
            lease = browserPool.acquire(Math.min(acquireTimeoutMs, remainingMs(deadline)));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return fail(job, FailureKind.CANCELLED, "interrupted while waiting for a browser session");
        } catch (BrowserPoolBusyException ex) {
            return fail(job, FailureKind.TIMEOUT, "no browser session available: " + ex.getMessage());
        } catch (BrowserPoolException ex) {
            if (browserPool.isShutdown()) {
                throw ex;
            }
            return fail(job, FailureKind.RESOURCE, ex.getMessage());
        }

        try (BrowserLease held = lease; ExtractionContext context = new ExtractionContext(job, held.getSession())) {
            log.debug("browser session leased, runId={}, key={}, leaseId={}, slotId={}",
                job.getRunId(), job.getExternalKey(), held.getLeaseId(), held.getSlotId());
            for (ExtractionPhase phase : ExtractionPhase.values()) {
                if (isCancelled(cancelled)) {
                    return fail(job, FailureKind.CANCELLED, "run cancelled before " + phase);
                }
                job.lifecycle().advance(phase.getJobState());
                PhaseResult result = runPhase(phase, context, deadline);
                if (!result.isSuccess()) {
                    FailureKind kind = result.getFailureKind();
                    if (kind == FailureKind.RESOURCE || kind == FailureKind.TIMEOUT) {
                        held.markBroken(kind + " during " + phase);
                    }
                    return fail(job, kind, result.getMessage());
                }
            }
            if (isCancelled(cancelled)) {
                return fail(job, FailureKind.CANCELLED, "run cancelled before persisting");
            }
            job.lifecycle().advance(JobState.PERSISTING);
            job.lifecycle().complete(context.toResult());
            log.info("job completed, runId={}, key={}, attempt={}, fields={}",
                job.getRunId(), job.getExternalKey(), job.getAttemptCount(), job.getResult().getFieldCount());
            return AttemptOutcome.COMPLETED;
        }
    }

    public void shutdown() {
        phaseExecutor.shutdownNow();
    }

    private PhaseResult runPhase(ExtractionPhase phase, ExtractionContext context, long deadline) {
        long remainingMs = remainingMs(deadline);
        if (remainingMs <= 0) {
            return PhaseResult.failure(FailureKind.TIMEOUT, "soft timeout of " + jobSoftTimeoutMs + "ms reached before " + phase);
        }

        Future<PhaseResult> future = phaseExecutor.submit(() -> collaborator.execute(phase, context));
        try {
            PhaseResult result = future.get(remainingMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return PhaseResult.failure(FailureKind.RETRYABLE, phase + " returned no result");
            }
            return result;
        } catch (TimeoutException ex) {
            future.cancel(true);
            context.detach();
            return PhaseResult.failure(FailureKind.TIMEOUT, "soft timeout of " + jobSoftTimeoutMs + "ms exceeded during " + phase);
        } catch (InterruptedException ex) {
            future.cancel(true);
            context.detach();
            Thread.currentThread().interrupt();
            return PhaseResult.failure(FailureKind.CANCELLED, "interrupted during " + phase);
        } catch (CancellationException ex) {
            context.detach();
            return PhaseResult.failure(FailureKind.CANCELLED, phase + " was cancelled");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            FailureKind kind = errorClassifier.classify(cause);
            log.debug("phase threw, runId={}, key={}, phase={}, kind={}",
                context.getRunId(), context.getExternalKey(), phase, kind, cause);
            return PhaseResult.failure(kind, phase + " failed: " + describe(cause));
        }
    }

    private AttemptOutcome fail(Job job, FailureKind kind, String message) {
        JobState next = job.lifecycle().fail(kind, message);
        return next == JobState.RETRYING ? AttemptOutcome.RETRY : AttemptOutcome.FAILED;
    }

    private boolean isCancelled(BooleanSupplier cancelled) {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    private long remainingMs(long deadline) {
        return TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

}
