package fun.fengwk.fleet.core.service.run.impl;

import fun.fengwk.fleet.core.service.director.FleetDirector;
import fun.fengwk.fleet.core.service.director.FleetRun;
import fun.fengwk.fleet.core.service.director.JobSpecParser;
import fun.fengwk.fleet.core.service.director.RunNotFoundException;
import fun.fengwk.fleet.core.service.director.RunRejectedException;
import fun.fengwk.fleet.core.service.job.model.JobSpec;
import fun.fengwk.fleet.core.service.job.model.JobState;
import fun.fengwk.fleet.core.service.persist.JobResultRecord;
import fun.fengwk.fleet.core.service.persist.sink.InMemoryResultSink;
import fun.fengwk.fleet.core.service.run.FleetRunService;
import fun.fengwk.fleet.core.service.run.model.JobListResponse;
import fun.fengwk.fleet.core.service.run.model.JobResultResponse;
import fun.fengwk.fleet.core.service.run.model.JobView;
import fun.fengwk.fleet.core.service.run.model.RunCommandResponse;
import fun.fengwk.fleet.core.service.run.model.RunStatusResponse;
import fun.fengwk.fleet.core.service.run.model.RunSubmitResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FleetRunServiceImpl implements FleetRunService {

    private final FleetDirector fleetDirector;
    private final JobSpecParser jobSpecParser;
    private final InMemoryResultSink inMemoryResultSink;

    @Override
    public RunSubmitResponse submitBatch(List<String> entries) {
        try {
            List<JobSpec> specs = jobSpecParser.parse(entries == null ? List.of() : entries);
            String runId = fleetDirector.start(specs);
            return RunSubmitResponse.builder()
                .statusCode(200)
                .runId(runId)
                .jobCount(fleetDirector.getRun(runId).getJobs().size())
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("batch invalid, error={}", ex.getMessage());
            return RunSubmitResponse.builder().statusCode(400).error(ex.getMessage()).build();
        } catch (RunRejectedException ex) {
            log.warn("batch rejected, error={}", ex.getMessage());
            return RunSubmitResponse.builder().statusCode(409).error(ex.getMessage()).build();
        } catch (Exception ex) {
            log.warn("batch submit failed, error={}", ex.getMessage(), ex);
            return RunSubmitResponse.builder().statusCode(500).error(ex.getMessage()).build();
        }
    }

    @Override
    public RunStatusResponse getRunStatus(String runId) {
        try {
            String resolved = resolveRunId(runId);
            return RunStatusResponse.builder()
                .statusCode(200)
                .metrics(fleetDirector.status(resolved))
                .build();
        } catch (RunNotFoundException ex) {
            return RunStatusResponse.builder().statusCode(404).error(ex.getMessage()).build();
        } catch (IllegalArgumentException ex) {
            return RunStatusResponse.builder().statusCode(400).error(ex.getMessage()).build();
        } catch (Exception ex) {
            log.warn("run status failed, runId={}, error={}", runId, ex.getMessage(), ex);
            return RunStatusResponse.builder().statusCode(500).error(ex.getMessage()).build();
        }
    }

    @Override
    public RunCommandResponse cancelRun(String runId) {
        return command("cancel", runId, fleetDirector::cancel);
    }

    @Override
    public RunCommandResponse pauseRun(String runId) {
        return command("pause", runId, fleetDirector::pause);
    }

    @Override
    public RunCommandResponse resumeRun(String runId) {
        return command("resume", runId, fleetDirector::resume);
    }

    @Override
    public JobListResponse listJobs(String runId, String state) {
        try {
            String resolved = resolveRunId(runId);
            JobState filter = parseState(state);
            List<JobView> jobs = fleetDirector.jobs(resolved, filter).stream().map(JobView::from).toList();
            return JobListResponse.builder()
                .statusCode(200)
                .runId(resolved)
                .stateFilter(filter == null ? null : filter.name())
                .jobs(jobs)
                .build();
        } catch (RunNotFoundException ex) {
            return JobListResponse.builder().statusCode(404).error(ex.getMessage()).build();
        } catch (IllegalArgumentException ex) {
            return JobListResponse.builder().statusCode(400).error(ex.getMessage()).build();
        } catch (Exception ex) {
            log.warn("list jobs failed, runId={}, error={}", runId, ex.getMessage(), ex);
            return JobListResponse.builder().statusCode(500).error(ex.getMessage()).build();
        }
    }

    @Override
    public JobResultResponse findResult(String externalKey) {
        if (!StringUtils.hasText(externalKey)) {
            return JobResultResponse.builder().statusCode(400).error("externalKey is blank").build();
        }
        String key = externalKey.trim();
        Optional<JobResultRecord> record = inMemoryResultSink.find(key);
        if (record.isEmpty()) {
            return JobResultResponse.builder()
                .statusCode(404)
                .externalKey(key)
                .error("no result stored for " + key)
                .build();
        }
        return JobResultResponse.builder()
            .statusCode(200)
            .externalKey(key)
            .record(record.get())
            .build();
    }

    private RunCommandResponse command(String name, String runId, Function<String, Boolean> action) {
        try {
            String resolved = resolveRunId(runId);
            boolean accepted = action.apply(resolved);
            FleetRun run = fleetDirector.getRun(resolved);
            return RunCommandResponse.builder()
                .statusCode(200)
                .runId(resolved)
                .command(name)
                .accepted(accepted)
                .state(run.getState().name())
                .build();
        } catch (RunNotFoundException ex) {
            return RunCommandResponse.builder().statusCode(404).command(name).runId(runId).error(ex.getMessage()).build();
        } catch (IllegalArgumentException ex) {
            return RunCommandResponse.builder().statusCode(400).command(name).runId(runId).error(ex.getMessage()).build();
        } catch (Exception ex) {
            log.warn("{} run failed, runId={}, error={}", name, runId, ex.getMessage(), ex);
            return RunCommandResponse.builder().statusCode(500).command(name).runId(runId).error(ex.getMessage()).build();
        }
    }

    private String resolveRunId(String runId) {
        if (StringUtils.hasText(runId)) {
            return runId.trim();
        }
        return fleetDirector.latestRun()
            .map(FleetRun::getRunId)
            .orElseThrow(() -> new IllegalArgumentException("no run submitted yet"));
    }

    private JobState parseState(String state) {
        if (!StringUtils.hasText(state)) {
            return null;
        }
        try {
            return JobState.valueOf(state.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown job state: " + state, ex);
        }
    }

}
