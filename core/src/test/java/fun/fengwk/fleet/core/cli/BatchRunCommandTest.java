package fun.fengwk.fleet.core.cli;

import fun.fengwk.fleet.core.service.director.FleetDirector;
import fun.fengwk.fleet.core.service.director.JobSpecParser;
import fun.fengwk.fleet.core.service.director.RunRejectedException;
import fun.fengwk.fleet.core.service.director.RunState;
import fun.fengwk.fleet.core.service.metrics.RunMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class BatchRunCommandTest {

    @TempDir
    Path tempDir;

    @Mock
    private FleetDirector director;

    private AtomicInteger exitCode;
    private BatchRunCommand command;

    @BeforeEach
    void setUp() {
        exitCode = new AtomicInteger(-1);
        command = new BatchRunCommand(director, new JobSpecParser(), exitCode::set);
    }

    @Test
    public void shouldDoNothingWithoutOption() {
        command.run(new DefaultApplicationArguments("--spring.main.banner-mode=off"));

        verifyNoInteractions(director);
        assertThat(exitCode.get()).isEqualTo(-1);
    }

    @Test
    public void shouldRunBatchAndExitCleanlyWhenEveryJobCompleted() throws Exception {
        Path batch = batchFile("B100", "B200,high");
        when(director.submit(anyList())).thenReturn("EXE-1");
        when(director.run("EXE-1")).thenReturn(metrics(RunState.COMPLETED, 0));

        command.run(new DefaultApplicationArguments("--run-batch=" + batch));

        assertThat(exitCode.get()).isZero();
        verify(director).run("EXE-1");
    }

    @Test
    public void shouldSignalPartialFailure() throws Exception {
        Path batch = batchFile("B100", "B200");
        when(director.submit(anyList())).thenReturn("EXE-1");
        when(director.run("EXE-1")).thenReturn(metrics(RunState.COMPLETED, 1));

        command.run(new DefaultApplicationArguments("--run-batch=" + batch));

        assertThat(exitCode.get()).isEqualTo(2);
    }

    @Test
    public void shouldFailWhenBatchFileIsMissing() {
        command.run(new DefaultApplicationArguments("--run-batch=" + tempDir.resolve("absent.txt")));

        assertThat(exitCode.get()).isEqualTo(1);
        verify(director, never()).submit(anyList());
    }

    @Test
    public void shouldFailWhenBatchIsRejected() throws Exception {
        Path batch = batchFile("B100");
        when(director.submit(anyList())).thenThrow(new RunRejectedException("director is shut down"));

        command.run(new DefaultApplicationArguments("--run-batch=" + batch));

        assertThat(exitCode.get()).isEqualTo(1);
    }

    @Test
    public void shouldMapRunOutcomeToExitCode() {
        assertThat(BatchRunCommand.exitCode(metrics(RunState.COMPLETED, 0))).isZero();
        assertThat(BatchRunCommand.exitCode(metrics(RunState.COMPLETED, 3))).isEqualTo(2);
        assertThat(BatchRunCommand.exitCode(metrics(RunState.CANCELLED, 0))).isEqualTo(1);
        assertThat(BatchRunCommand.exitCode(metrics(RunState.FAILED, 0))).isEqualTo(1);
    }

    private Path batchFile(String... lines) throws Exception {
        Path file = tempDir.resolve("batch.txt");
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
        return file;
    }

    private static RunMetrics metrics(RunState state, int failed) {
        return RunMetrics.builder()
            .runId("EXE-1")
            .runState(state)
            .total(2)
            .processed(2)
            .succeeded(2 - Math.min(2, failed))
            .failed(failed)
            .build();
    }

}
