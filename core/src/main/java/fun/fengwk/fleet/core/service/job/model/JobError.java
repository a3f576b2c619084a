package fun.fengwk.fleet.core.service.job.model;

import lombok.Value;

import java.time.Instant;

/**
 * One recorded failure of a job attempt.
 *
 * @author fengwk
 */
@Value
public class JobError {

    int attempt;
    Instant timestamp;
    FailureKind kind;
    String message;

}
