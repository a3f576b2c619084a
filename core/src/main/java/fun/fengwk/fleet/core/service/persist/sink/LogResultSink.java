package fun.fengwk.fleet.core.service.persist.sink;

import fun.fengwk.fleet.core.service.persist.JobResultRecord;
import fun.fengwk.fleet.core.service.persist.ResultSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs one line per result.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class LogResultSink implements ResultSink {

    public static final String NAME = "log";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void write(JobResultRecord record) {
        log.info("job result, runId={}, key={}, attempts={}, fields={}, artifacts={}, elapsedMs={}",
            record.getRunId(),
            record.getExternalKey(),
            record.getAttempts(),
            record.getFields().size(),
            record.getArtifacts().size(),
            record.getElapsedMs());
    }

}
