package fun.fengwk.fleet.core.service.job.worker;

/**
 * What the worker does with a job after one attempt.
 *
 * @author fengwk
 */
public enum AttemptOutcome {

    /**
     * The job completed and its result should be persisted.
     */
    COMPLETED,

    /**
     * The attempt failed and the job goes back to the queue.
     */
    RETRY,

    /**
     * The job failed terminally.
     */
    FAILED

}
