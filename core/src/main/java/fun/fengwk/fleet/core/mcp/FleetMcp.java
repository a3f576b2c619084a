package fun.fengwk.fleet.core.mcp;

import fun.fengwk.fleet.core.service.run.FleetRunService;
import fun.fengwk.fleet.core.utils.PlainTextToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fleet run tools.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class FleetMcp {

    private final FleetRunService fleetRunService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "submit_batch",
        description = """
            Submit a batch of client jobs and start processing it in the background.
            Only one run can be active at a time.
            Return format: the run id and job count; or an error message.""",
        resultConverter = PlainTextToolCallResultConverter.class)
    public String submitBatch(
        @ToolParam(description = """
            One job per entry: KEY[,PRIORITY[,DISPLAY NAME]].
            - KEY: client key, e.g. a tax id.
            - PRIORITY: CRITICAL, HIGH, MEDIUM, LOW or BACKGROUND, default MEDIUM.
            Duplicate keys are submitted once.""") List<String> jobs
    ) {
        return mcpFormatter.format("fleet_submit_result.ftl", fleetRunService.submitBatch(jobs));
    }

    @Tool(name = "run_status",
        description = """
            Show progress of a run: processed/total, succeeded, failed, in-flight, throughput and ETA.""",
        resultConverter = PlainTextToolCallResultConverter.class)
    public String runStatus(
        @ToolParam(description = "run id, default the latest run", required = false) String runId
    ) {
        return mcpFormatter.format("fleet_run_status_result.ftl", fleetRunService.getRunStatus(runId));
    }

    @Tool(name = "cancel_run",
        description = """
            Cancel a run. Queued jobs fail as cancelled and in-flight jobs are interrupted.
            Returns once every browser session is back.""",
        resultConverter = PlainTextToolCallResultConverter.class)
    public String cancelRun(
        @ToolParam(description = "run id, default the latest run", required = false) String runId
    ) {
        return mcpFormatter.format("fleet_command_result.ftl", fleetRunService.cancelRun(runId));
    }

    @Tool(name = "pause_run",
        description = "Pause a running run. Jobs already in flight finish, no new job starts until resumed.",
        resultConverter = PlainTextToolCallResultConverter.class)
    public String pauseRun(
        @ToolParam(description = "run id, default the latest run", required = false) String runId
    ) {
        return mcpFormatter.format("fleet_command_result.ftl", fleetRunService.pauseRun(runId));
    }

    @Tool(name = "resume_run",
        description = "Resume a paused run.",
        resultConverter = PlainTextToolCallResultConverter.class)
    public String resumeRun(
        @ToolParam(description = "run id, default the latest run", required = false) String runId
    ) {
        return mcpFormatter.format("fleet_command_result.ftl", fleetRunService.resumeRun(runId));
    }

    @Tool(name = "list_jobs",
        description = "List the jobs of a run with state, attempts, progress and last error.",
        resultConverter = PlainTextToolCallResultConverter.class)
    public String listJobs(
        @ToolParam(description = "run id, default the latest run", required = false) String runId,
        @ToolParam(description = """
            only jobs in this state: PENDING, STARTING, NAVIGATING, EXTRACTING, PROCESSING, VALIDATING, \
            PERSISTING, COMPLETED, FAILED or RETRYING; default all""", required = false) String state
    ) {
        return mcpFormatter.format("fleet_job_list_result.ftl", fleetRunService.listJobs(runId, state));
    }

    @Tool(name = "job_result",
        description = "Show the latest stored result of a client: extracted fields and document links.",
        resultConverter = PlainTextToolCallResultConverter.class)
    public String jobResult(
        @ToolParam(description = "client key") String externalKey
    ) {
        return mcpFormatter.format("fleet_job_result.ftl", fleetRunService.findResult(externalKey));
    }

}
