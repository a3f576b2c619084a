package fun.fengwk.fleet.core.service.extraction;

import fun.fengwk.fleet.core.service.job.model.JobState;

/**
 * Phases an extraction collaborator runs for each job attempt, in order.
 *
 * @author fengwk
 */
public enum ExtractionPhase {

    NAVIGATION(JobState.NAVIGATING),
    EXTRACTION(JobState.EXTRACTING),
    PROCESSING(JobState.PROCESSING),
    VALIDATION(JobState.VALIDATING);

    private final JobState jobState;

    ExtractionPhase(JobState jobState) {
        this.jobState = jobState;
    }

    /**
     * State the job is in while this phase runs.
     */
    public JobState getJobState() {
        return jobState;
    }

}
