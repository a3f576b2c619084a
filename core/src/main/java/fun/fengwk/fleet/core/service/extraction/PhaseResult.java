package fun.fengwk.fleet.core.service.extraction;

import fun.fengwk.fleet.core.service.job.model.FailureKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Explicit outcome of one extraction phase.
 *
 * @author fengwk
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PhaseResult {

    private static final PhaseResult SUCCESS = new PhaseResult(true, null, null);

    boolean success;
    FailureKind failureKind;
    String message;

    public static PhaseResult success() {
        return SUCCESS;
    }

    public static PhaseResult failure(FailureKind kind, String message) {
        if (kind == null) {
            throw new IllegalArgumentException("failure kind is null");
        }
        return new PhaseResult(false, kind, message);
    }

}
