package fun.fengwk.fleet.core.service.job;

import fun.fengwk.fleet.core.service.job.model.FailureKind;
import fun.fengwk.fleet.core.service.job.model.JobError;
import fun.fengwk.fleet.core.service.job.model.JobResult;
import fun.fengwk.fleet.core.service.job.model.JobState;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Lifecycle tracker of one job: transitions, progress, error log and attempt counter.
 *
 * <p>Every method is synchronized so observers never see a half-applied transition.
 *
 * @author fengwk
 */
@Slf4j
public class JobStateMachine {

    private final Job job;

    JobStateMachine(Job job) {
        this.job = job;
    }

    /**
     * Start a new attempt: {@code PENDING|RETRYING -> STARTING}.
     *
     * @throws IllegalJobTransitionException the job cannot start or its attempts are exhausted
     */
    public synchronized void begin(String workerId) {
        JobState current = job.getState();
        if (!(current == JobState.PENDING || current == JobState.RETRYING)) {
            throw new IllegalJobTransitionException(job.getExternalKey(), current, JobState.STARTING);
        }
        if (job.getAttemptCount() >= job.getMaxAttempts()) {
            throw new IllegalJobTransitionException(job.getExternalKey(), current, JobState.STARTING,
                "attempts exhausted (" + job.getAttemptCount() + "/" + job.getMaxAttempts() + ")");
        }
        Instant now = job.now();
        job.incrementAttempt();
        job.setWorkerId(workerId);
        job.markStarted(now);
        job.enterState(JobState.STARTING, now);
        job.setCompletedSteps(JobState.STARTING.checkpoint(job.getTotalSteps()));
        log.debug("job attempt started, runId={}, key={}, attempt={}/{}, workerId={}",
            job.getRunId(), job.getExternalKey(), job.getAttemptCount(), job.getMaxAttempts(), workerId);
    }

    /**
     * Move forward to the next phase once the current one has completed.
     */
    public synchronized void advance(JobState next) {
        JobState current = job.getState();
        if (!next.isActive() || !current.canTransitionTo(next)) {
            throw new IllegalJobTransitionException(job.getExternalKey(), current, next);
        }
        job.enterState(next, job.now());
        raiseProgress(next.checkpoint(job.getTotalSteps()));
    }

    /**
     * Record intermediate progress. Values are clamped so progress never moves back or past the total.
     *
     * @return the progress after the update
     */
    public synchronized int reportProgress(int completedSteps) {
        if (!job.getState().isActive()) {
            return job.getCompletedSteps();
        }
        raiseProgress(completedSteps);
        return job.getCompletedSteps();
    }

    /**
     * {@code PERSISTING -> COMPLETED} with the job's result.
     */
    public synchronized void complete(JobResult result) {
        JobState current = job.getState();
        if (!current.canTransitionTo(JobState.COMPLETED)) {
            throw new IllegalJobTransitionException(job.getExternalKey(), current, JobState.COMPLETED);
        }
        Instant now = job.now();
        job.setResult(result.toBuilder().completedAt(now).build());
        job.setCompletedSteps(job.getTotalSteps());
        job.enterState(JobState.COMPLETED, now);
        job.markFinished(now);
    }

    /**
     * Record a failed attempt and decide between a retry and terminal failure.
     *
     * <p>Retryable kinds go to {@code RETRYING} while attempts remain. Fatal and cancelled failures
     * are terminal regardless. Pending and retrying jobs fail terminally.
     *
     * @return {@link JobState#RETRYING} or {@link JobState#FAILED}
     */
    public synchronized JobState fail(FailureKind kind, String message) {
        JobState current = job.getState();
        if (current.isTerminal()) {
            throw new IllegalJobTransitionException(job.getExternalKey(), current, JobState.FAILED);
        }
        Instant now = job.now();
        job.appendError(new JobError(job.getAttemptCount(), now, kind, message));

        boolean retry = current.isActive()
            && kind.isRetryable()
            && job.getAttemptCount() < job.getMaxAttempts();
        if (retry) {
            job.enterState(JobState.RETRYING, now);
            job.setCompletedSteps(0);
            log.info("job attempt failed, will retry, runId={}, key={}, attempt={}/{}, kind={}, error={}",
                job.getRunId(), job.getExternalKey(), job.getAttemptCount(), job.getMaxAttempts(), kind, message);
            return JobState.RETRYING;
        }

        job.enterState(JobState.FAILED, now);
        job.markFinished(now);
        log.warn("job failed, runId={}, key={}, attempt={}/{}, kind={}, error={}",
            job.getRunId(), job.getExternalKey(), job.getAttemptCount(), job.getMaxAttempts(), kind, message);
        return JobState.FAILED;
    }

    private void raiseProgress(int completedSteps) {
        int clamped = Math.min(job.getTotalSteps(), Math.max(job.getCompletedSteps(), completedSteps));
        job.setCompletedSteps(clamped);
    }

}
