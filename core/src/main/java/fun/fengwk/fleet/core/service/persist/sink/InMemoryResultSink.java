package fun.fengwk.fleet.core.service.persist.sink;

import fun.fengwk.fleet.core.service.persist.JobResultRecord;
import fun.fengwk.fleet.core.service.persist.ResultSink;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest result of each client key for lookups.
 *
 * @author fengwk
 */
@Component
public class InMemoryResultSink implements ResultSink {

    public static final String NAME = "memory";

    private final Map<String, JobResultRecord> latestByKey = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void write(JobResultRecord record) {
        latestByKey.put(record.getExternalKey(), record);
    }

    public Optional<JobResultRecord> find(String externalKey) {
        return Optional.ofNullable(latestByKey.get(externalKey));
    }

    public int size() {
        return latestByKey.size();
    }

}
