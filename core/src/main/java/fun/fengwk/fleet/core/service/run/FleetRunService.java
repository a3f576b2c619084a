package fun.fengwk.fleet.core.service.run;

import fun.fengwk.fleet.core.service.run.model.JobListResponse;
import fun.fengwk.fleet.core.service.run.model.JobResultResponse;
import fun.fengwk.fleet.core.service.run.model.RunCommandResponse;
import fun.fengwk.fleet.core.service.run.model.RunStatusResponse;
import fun.fengwk.fleet.core.service.run.model.RunSubmitResponse;

import java.util.List;

/**
 * Submission api of the fleet. Errors are reported in the responses, never thrown.
 *
 * @author fengwk
 */
public interface FleetRunService {

    /**
     * Start a run in the background.
     *
     * @param entries one job per entry: {@code KEY[,PRIORITY[,DISPLAY NAME]]}
     */
    RunSubmitResponse submitBatch(List<String> entries);

    /**
     * @param runId blank means the latest run
     */
    RunStatusResponse getRunStatus(String runId);

    RunCommandResponse cancelRun(String runId);

    RunCommandResponse pauseRun(String runId);

    RunCommandResponse resumeRun(String runId);

    JobListResponse listJobs(String runId, String state);

    JobResultResponse findResult(String externalKey);

}
