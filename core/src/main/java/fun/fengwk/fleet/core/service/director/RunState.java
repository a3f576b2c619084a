package fun.fengwk.fleet.core.service.director;

/**
 * Lifecycle of a run: {@code SUBMITTED -> RUNNING <-> PAUSED -> STOPPING -> COMPLETED | CANCELLED | FAILED}.
 *
 * @author fengwk
 */
public enum RunState {

    SUBMITTED,
    RUNNING,
    PAUSED,
    STOPPING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

}
