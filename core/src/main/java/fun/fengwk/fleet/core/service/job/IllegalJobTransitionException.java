package fun.fengwk.fleet.core.service.job;

import fun.fengwk.fleet.core.service.job.model.JobState;

/**
 * Exception thrown when a job is driven along an edge its lifecycle does not allow.
 *
 * @author fengwk
 */
public class IllegalJobTransitionException extends IllegalStateException {

    private final String externalKey;
    private final JobState from;
    private final JobState to;

    public IllegalJobTransitionException(String externalKey, JobState from, JobState to) {
        this(externalKey, from, to, "illegal transition " + from + " -> " + to);
    }

    public IllegalJobTransitionException(String externalKey, JobState from, JobState to, String reason) {
        super("job " + externalKey + ": " + reason);
        this.externalKey = externalKey;
        this.from = from;
        this.to = to;
    }

    public String getExternalKey() {
        return externalKey;
    }

    public JobState getFrom() {
        return from;
    }

    public JobState getTo() {
        return to;
    }

}
