package fun.fengwk.fleet.core.service.job.model;

import lombok.Builder;
import lombok.Value;

/**
 * Submitted description of one client job.
 *
 * @author fengwk
 */
@Value
@Builder
public class JobSpec {

    /**
     * Stable external key of the client, such as a tax id.
     */
    String externalKey;

    @Builder.Default
    JobPriority priority = JobPriority.MEDIUM;

    String displayName;

}
