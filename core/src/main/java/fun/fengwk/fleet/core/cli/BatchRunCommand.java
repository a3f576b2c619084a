package fun.fengwk.fleet.core.cli;

import fun.fengwk.fleet.core.service.director.FleetDirector;
import fun.fengwk.fleet.core.service.director.JobSpecParser;
import fun.fengwk.fleet.core.service.director.RunRejectedException;
import fun.fengwk.fleet.core.service.director.RunState;
import fun.fengwk.fleet.core.service.job.model.JobSpec;
import fun.fengwk.fleet.core.service.metrics.RunMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Batch command runner: {@code --run-batch=<file>} runs one batch to completion and exits.
 *
 * <p>Exit code 0 when every job completed, 2 when some jobs failed, 1 when the run could not be
 * started or ended abnormally.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchRunCommand implements ApplicationRunner {

    static final String OPTION = "run-batch";

    private final FleetDirector fleetDirector;
    private final JobSpecParser jobSpecParser;
    private final ExitHandler exitHandler;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION)) {
            return;
        }
        List<String> values = args.getOptionValues(OPTION);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            log.warn("--{} requires a batch file path", OPTION);
            exitHandler.exit(1);
            return;
        }

        Path batchFile = Paths.get(values.get(0).trim());
        if (!Files.isRegularFile(batchFile)) {
            log.warn("batch file not found, path={}", batchFile.toAbsolutePath());
            exitHandler.exit(1);
            return;
        }

        RunMetrics metrics;
        try {
            List<JobSpec> specs = jobSpecParser.parse(batchFile);
            String runId = fleetDirector.submit(specs);
            log.info("batch loaded, runId={}, path={}, jobs={}", runId, batchFile, specs.size());
            metrics = fleetDirector.run(runId);
        } catch (IOException ex) {
            log.warn("read batch file failed, path={}, error={}", batchFile, ex.getMessage());
            exitHandler.exit(1);
            return;
        } catch (IllegalArgumentException | RunRejectedException ex) {
            log.warn("batch rejected, path={}, error={}", batchFile, ex.getMessage());
            exitHandler.exit(1);
            return;
        }

        exitHandler.exit(exitCode(metrics));
    }

    static int exitCode(RunMetrics metrics) {
        if (metrics.getRunState() != RunState.COMPLETED) {
            return 1;
        }
        return metrics.getFailed() == 0 ? 0 : 2;
    }

    /**
     * Ends the process. A seam so the command can run without exiting.
     */
    @FunctionalInterface
    public interface ExitHandler {

        void exit(int code);

    }

}
