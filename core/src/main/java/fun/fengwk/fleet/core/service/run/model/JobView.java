package fun.fengwk.fleet.core.service.run.model;

import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.model.JobError;
import fun.fengwk.fleet.core.service.job.model.JobResult;
import lombok.Builder;
import lombok.Data;

/**
 * Read-only view of one job.
 *
 * @author fengwk
 */
@Data
@Builder
public class JobView {

    private String externalKey;
    private String displayName;
    private String priority;
    private String state;
    private int attempts;
    private int maxAttempts;
    private double progressPercent;
    private int fieldCount;
    private int errorCount;
    private String lastError;
    private long elapsedMs;

    public static JobView from(Job job) {
        JobError lastError = job.getLastError();
        JobResult result = job.getResult();
        return JobView.builder()
            .externalKey(job.getExternalKey())
            .displayName(job.getDisplayName())
            .priority(job.getPriority().name())
            .state(job.getState().name())
            .attempts(job.getAttemptCount())
            .maxAttempts(job.getMaxAttempts())
            .progressPercent(job.getProgress().percent())
            .fieldCount(result == null ? 0 : result.getFieldCount())
            .errorCount(job.getErrors().size())
            .lastError(lastError == null ? null : lastError.getKind() + ": " + lastError.getMessage())
            .elapsedMs(job.getTiming().getElapsed().toMillis())
            .build();
    }

}
