package fun.fengwk.fleet.core.service.job;

import lombok.Value;

/**
 * Completed steps of the current attempt out of a fixed total.
 *
 * @author fengwk
 */
@Value
public class JobProgress {

    int completed;
    int total;

    public double percent() {
        if (total <= 0) {
            return 0D;
        }
        return completed * 100D / total;
    }

}
