package fun.fengwk.fleet.core.service.job.model;

/**
 * Classification of a failed job attempt.
 *
 * @author fengwk
 */
public enum FailureKind {

    /**
     * Transient failure such as a navigation error or a portal hiccup.
     */
    RETRYABLE(true),

    /**
     * Failure a retry cannot fix, such as an unknown client key.
     */
    FATAL(false),

    /**
     * The browser session became unusable. The lease is marked broken and the job retried.
     */
    RESOURCE(true),

    /**
     * The job exceeded its soft timeout.
     */
    TIMEOUT(true),

    /**
     * The run was cancelled.
     */
    CANCELLED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

}
