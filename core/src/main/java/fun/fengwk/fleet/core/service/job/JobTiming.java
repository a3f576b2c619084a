package fun.fengwk.fleet.core.service.job;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Timing of a job across all of its attempts.
 *
 * @author fengwk
 */
@Value
@Builder
public class JobTiming {

    /**
     * First attempt start, null while pending.
     */
    Instant startedAt;

    /**
     * Terminal instant, null until the job is completed or failed.
     */
    Instant finishedAt;

    Duration navigation;
    Duration extraction;
    Duration processing;
    Duration validation;

    /**
     * Time from first start to the terminal instant, or to now while the job is open.
     */
    Duration elapsed;

}
