package fun.fengwk.fleet.core.service.persist;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of persisting one job to every active sink.
 *
 * @author fengwk
 */
@Value
public class PersistenceReport {

    String externalKey;
    List<String> writtenSinks;

    /**
     * Last error message of each sink that failed all its attempts, by sink name.
     */
    Map<String, String> failedSinks;

    public boolean isFullyWritten() {
        return failedSinks.isEmpty();
    }

}
