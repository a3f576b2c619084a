package fun.fengwk.fleet.core.service.run.impl;

import fun.fengwk.fleet.core.service.director.FleetDirector;
import fun.fengwk.fleet.core.service.director.FleetRun;
import fun.fengwk.fleet.core.service.director.JobSpecParser;
import fun.fengwk.fleet.core.service.director.RunNotFoundException;
import fun.fengwk.fleet.core.service.director.RunRejectedException;
import fun.fengwk.fleet.core.service.director.RunState;
import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.model.JobState;
import fun.fengwk.fleet.core.service.persist.JobResultRecord;
import fun.fengwk.fleet.core.service.persist.sink.InMemoryResultSink;
import fun.fengwk.fleet.core.service.run.model.JobListResponse;
import fun.fengwk.fleet.core.service.run.model.JobResultResponse;
import fun.fengwk.fleet.core.service.run.model.RunCommandResponse;
import fun.fengwk.fleet.core.service.run.model.RunStatusResponse;
import fun.fengwk.fleet.core.service.run.model.RunSubmitResponse;
import fun.fengwk.fleet.core.testing.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class FleetRunServiceImplTest {

    @Mock
    private FleetDirector director;

    private InMemoryResultSink memorySink;
    private FleetRunServiceImpl service;

    @BeforeEach
    void setUp() {
        memorySink = new InMemoryResultSink();
        service = new FleetRunServiceImpl(director, new JobSpecParser(), memorySink);
    }

    @Test
    public void shouldStartParsedBatch() {
        FleetRun run = mock(FleetRun.class);
        when(run.getJobs()).thenReturn(List.of(
            TestJobs.pending("EXE-1", "B100", Clock.systemUTC()),
            TestJobs.pending("EXE-1", "B200", Clock.systemUTC())));
        when(director.start(anyList())).thenReturn("EXE-1");
        when(director.getRun("EXE-1")).thenReturn(run);

        RunSubmitResponse response = service.submitBatch(List.of("B100,high", "B200"));

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getRunId()).isEqualTo("EXE-1");
        assertThat(response.getJobCount()).isEqualTo(2);
    }

    @Test
    public void shouldRejectMalformedBatchWithoutStartingRun() {
        RunSubmitResponse response = service.submitBatch(List.of("B100,someday"));

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getError()).contains("line 1");
        verify(director, never()).start(anyList());
    }

    @Test
    public void shouldReportConflictWhenRunIsActive() {
        when(director.start(anyList())).thenThrow(new RunRejectedException("run EXE-1 is still RUNNING"));

        RunSubmitResponse response = service.submitBatch(List.of("B100"));

        assertThat(response.getStatusCode()).isEqualTo(409);
        assertThat(response.getError()).contains("EXE-1");
    }

    @Test
    public void shouldResolveBlankRunIdToLatestRun() {
        FleetRun run = mock(FleetRun.class);
        when(run.getRunId()).thenReturn("EXE-2");
        when(director.latestRun()).thenReturn(Optional.of(run));

        RunStatusResponse response = service.getRunStatus(" ");

        assertThat(response.getStatusCode()).isEqualTo(200);
        verify(director).status("EXE-2");
    }

    @Test
    public void shouldReportMissingRun() {
        when(director.status("EXE-404")).thenThrow(new RunNotFoundException("EXE-404"));

        assertThat(service.getRunStatus("EXE-404").getStatusCode()).isEqualTo(404);
        when(director.latestRun()).thenReturn(Optional.empty());
        assertThat(service.getRunStatus(null).getStatusCode()).isEqualTo(400);
    }

    @Test
    public void shouldReportCommandOutcomeAndState() {
        FleetRun run = mock(FleetRun.class);
        when(run.getState()).thenReturn(RunState.PAUSED);
        when(director.getRun("EXE-1")).thenReturn(run);
        when(director.pause("EXE-1")).thenReturn(true);
        when(director.resume("EXE-1")).thenReturn(false);

        RunCommandResponse paused = service.pauseRun("EXE-1");
        RunCommandResponse resumed = service.resumeRun("EXE-1");

        assertThat(paused.isAccepted()).isTrue();
        assertThat(paused.getState()).isEqualTo("PAUSED");
        assertThat(paused.getCommand()).isEqualTo("pause");
        assertThat(resumed.isAccepted()).isFalse();
    }

    @Test
    public void shouldFilterJobsByState() {
        Job failed = TestJobs.pending("EXE-1", "B100", Clock.systemUTC());
        when(director.jobs("EXE-1", JobState.FAILED)).thenReturn(List.of(failed));

        JobListResponse response = service.listJobs("EXE-1", "failed");

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getStateFilter()).isEqualTo("FAILED");
        assertThat(response.getJobs()).extracting("externalKey").containsExactly("B100");
        assertThat(service.listJobs("EXE-1", "sleeping").getStatusCode()).isEqualTo(400);
    }

    @Test
    public void shouldLookUpStoredResult() {
        memorySink.write(JobResultRecord.from(TestJobs.completed("EXE-1", "B100", Clock.systemUTC(), 2, 0)));

        JobResultResponse found = service.findResult(" B100 ");
        JobResultResponse missing = service.findResult("B999");

        assertThat(found.getStatusCode()).isEqualTo(200);
        assertThat(found.getRecord().getFields()).hasSize(2);
        assertThat(missing.getStatusCode()).isEqualTo(404);
        assertThat(service.findResult("").getStatusCode()).isEqualTo(400);
    }

}
