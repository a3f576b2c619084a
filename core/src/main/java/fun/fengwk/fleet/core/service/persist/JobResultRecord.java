package fun.fengwk.fleet.core.service.persist;

import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.model.JobPriority;
import fun.fengwk.fleet.core.service.job.model.JobResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of a completed job as handed to sinks.
 *
 * @author fengwk
 */
@Value
@Builder
public class JobResultRecord {

    String runId;
    String externalKey;
    String displayName;
    JobPriority priority;
    int attempts;
    Map<String, String> fields;
    List<String> artifacts;
    Instant startedAt;
    Instant completedAt;
    long elapsedMs;

    public static JobResultRecord from(Job job) {
        JobResult result = job.getResult();
        if (result == null) {
            throw new IllegalArgumentException("job has no result: " + job);
        }
        return JobResultRecord.builder()
            .runId(job.getRunId())
            .externalKey(job.getExternalKey())
            .displayName(job.getDisplayName())
            .priority(job.getPriority())
            .attempts(job.getAttemptCount())
            .fields(result.getFields())
            .artifacts(result.getArtifacts())
            .startedAt(job.getTiming().getStartedAt())
            .completedAt(result.getCompletedAt())
            .elapsedMs(job.getTiming().getElapsed().toMillis())
            .build();
    }

}
