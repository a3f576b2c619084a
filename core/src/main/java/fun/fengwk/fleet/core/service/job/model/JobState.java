package fun.fengwk.fleet.core.service.job.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a job.
 *
 * <p>The forward path is {@code PENDING -> STARTING -> NAVIGATING -> EXTRACTING -> PROCESSING ->
 * VALIDATING -> PERSISTING -> COMPLETED}. {@code FAILED} and {@code RETRYING} are reachable from
 * every active state.
 *
 * @author fengwk
 */
public enum JobState {

    PENDING(0),
    STARTING(1),
    NAVIGATING(5),
    EXTRACTING(30),
    PROCESSING(45),
    VALIDATING(48),
    PERSISTING(50),
    COMPLETED(50),
    FAILED(0),
    RETRYING(0);

    private static final int CHECKPOINT_SCALE = 50;

    private final int checkpoint;

    JobState(int checkpoint) {
        this.checkpoint = checkpoint;
    }

    /**
     * Progress reached once this state is entered, for the given total step count.
     */
    public int checkpoint(int totalSteps) {
        return (int) ((long) checkpoint * totalSteps / CHECKPOINT_SCALE);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a worker is driving the job in this state.
     */
    public boolean isActive() {
        return this == STARTING
            || this == NAVIGATING
            || this == EXTRACTING
            || this == PROCESSING
            || this == VALIDATING
            || this == PERSISTING;
    }

    public boolean canTransitionTo(JobState next) {
        return allowedTargets().contains(next);
    }

    private Set<JobState> allowedTargets() {
        switch (this) {
            case PENDING:
            case RETRYING:
                return EnumSet.of(STARTING, FAILED);
            case STARTING:
                return EnumSet.of(NAVIGATING, FAILED, RETRYING);
            case NAVIGATING:
                return EnumSet.of(EXTRACTING, FAILED, RETRYING);
            case EXTRACTING:
                return EnumSet.of(PROCESSING, FAILED, RETRYING);
            case PROCESSING:
                return EnumSet.of(VALIDATING, FAILED, RETRYING);
            case VALIDATING:
                return EnumSet.of(PERSISTING, FAILED, RETRYING);
            case PERSISTING:
                return EnumSet.of(COMPLETED, FAILED, RETRYING);
            default:
                return EnumSet.noneOf(JobState.class);
        }
    }

}
