package fun.fengwk.fleet.core.service.job;

import fun.fengwk.fleet.core.service.job.model.JobError;
import fun.fengwk.fleet.core.service.job.model.JobPriority;
import fun.fengwk.fleet.core.service.job.model.JobResult;
import fun.fengwk.fleet.core.service.job.model.JobSpec;
import fun.fengwk.fleet.core.service.job.model.JobState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One client unit of work inside a run.
 *
 * <p>Readers see a consistent view through volatile fields. All mutation goes through
 * {@link #lifecycle()}, which only the worker owning the job calls.
 *
 * @author fengwk
 */
public class Job {

    private final String runId;
    private final String externalKey;
    private final String displayName;
    private final JobPriority priority;
    private final int maxAttempts;
    private final int totalSteps;
    private final Clock clock;
    private final JobStateMachine lifecycle;

    private final List<JobError> errors = new CopyOnWriteArrayList<>();
    private final Map<JobState, Duration> phaseDurations = new EnumMap<>(JobState.class);

    private volatile JobState state = JobState.PENDING;
    private volatile int attemptCount;
    private volatile int completedSteps;
    private volatile JobResult result;
    private volatile String workerId;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile Instant stateEnteredAt;

    public Job(String runId, JobSpec spec, int maxAttempts, int totalSteps, Clock clock) {
        this.runId = runId;
        this.externalKey = spec.getExternalKey();
        this.displayName = spec.getDisplayName();
        this.priority = spec.getPriority() == null ? JobPriority.MEDIUM : spec.getPriority();
        this.maxAttempts = Math.max(1, maxAttempts);
        this.totalSteps = Math.max(1, totalSteps);
        this.clock = clock;
        this.lifecycle = new JobStateMachine(this);
    }

    /**
     * State machine driving this job. Only the owning worker may call it.
     */
    public JobStateMachine lifecycle() {
        return lifecycle;
    }

    public String getRunId() {
        return runId;
    }

    public String getExternalKey() {
        return externalKey;
    }

    public String getDisplayName() {
        return displayName;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public JobState getState() {
        return state;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public JobProgress getProgress() {
        return new JobProgress(completedSteps, totalSteps);
    }

    /**
     * Result of the job, null until it is completed.
     */
    public JobResult getResult() {
        return result;
    }

    public List<JobError> getErrors() {
        return List.copyOf(errors);
    }

    public JobError getLastError() {
        return errors.isEmpty() ? null : errors.get(errors.size() - 1);
    }

    public String getWorkerId() {
        return workerId;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public JobTiming getTiming() {
        Instant start = startedAt;
        Instant end = finishedAt;
        Map<JobState, Duration> phases;
        synchronized (lifecycle) {
            phases = new EnumMap<>(phaseDurations);
        }
        Duration elapsed = start == null ? Duration.ZERO : Duration.between(start, end == null ? clock.instant() : end);
        return JobTiming.builder()
            .startedAt(start)
            .finishedAt(end)
            .navigation(phases.getOrDefault(JobState.NAVIGATING, Duration.ZERO))
            .extraction(phases.getOrDefault(JobState.EXTRACTING, Duration.ZERO))
            .processing(phases.getOrDefault(JobState.PROCESSING, Duration.ZERO))
            .validation(phases.getOrDefault(JobState.VALIDATING, Duration.ZERO))
            .elapsed(elapsed)
            .build();
    }

    @Override
    public String toString() {
        return "Job{runId=" + runId
            + ", key=" + externalKey
            + ", priority=" + priority
            + ", state=" + state
            + ", attempt=" + attemptCount + "/" + maxAttempts
            + "}";
    }

    // Mutators below are guarded by the lifecycle monitor.

    int getTotalSteps() {
        return totalSteps;
    }

    int getCompletedSteps() {
        return completedSteps;
    }

    Instant now() {
        return clock.instant();
    }

    void enterState(JobState next, Instant now) {
        Instant entered = stateEnteredAt;
        if (entered != null && state.isActive()) {
            phaseDurations.merge(state, Duration.between(entered, now), Duration::plus);
        }
        state = next;
        stateEnteredAt = now;
    }

    void incrementAttempt() {
        attemptCount++;
    }

    void setCompletedSteps(int completedSteps) {
        this.completedSteps = completedSteps;
    }

    void setResult(JobResult result) {
        this.result = result;
    }

    void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    void markStarted(Instant now) {
        if (startedAt == null) {
            startedAt = now;
        }
    }

    void markFinished(Instant now) {
        finishedAt = now;
    }

    void appendError(JobError error) {
        errors.add(error);
    }

}
