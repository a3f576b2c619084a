package fun.fengwk.fleet.core.service.job.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a completed job.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class JobResult {

    /**
     * Extracted fields by name, in extraction order.
     */
    @Singular
    Map<String, String> fields;

    /**
     * References of downloaded documents.
     */
    @Singular
    List<String> artifacts;

    /**
     * Stamped by the job lifecycle when the job completes.
     */
    Instant completedAt;

    public int getFieldCount() {
        return fields.size();
    }

    public int getArtifactCount() {
        return artifacts.size();
    }

}
