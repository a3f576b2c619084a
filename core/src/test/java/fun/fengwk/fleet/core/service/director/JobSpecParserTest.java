package fun.fengwk.fleet.core.service.director;

import fun.fengwk.fleet.core.service.job.model.JobPriority;
import fun.fengwk.fleet.core.service.job.model.JobSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class JobSpecParserTest {

    private final JobSpecParser parser = new JobSpecParser();

    @TempDir
    Path tempDir;

    @Test
    public void shouldParseKeysPrioritiesAndNames() throws Exception {
        Path file = tempDir.resolve("batch.txt");
        Files.write(file, List.of(
            "# nightly batch",
            "B100",
            "",
            "B200, high",
            "B300,low,ACME Holdings, Inc."
        ), StandardCharsets.UTF_8);

        List<JobSpec> specs = parser.parse(file);

        assertThat(specs).extracting(JobSpec::getExternalKey).containsExactly("B100", "B200", "B300");
        assertThat(specs).extracting(JobSpec::getPriority)
            .containsExactly(JobPriority.MEDIUM, JobPriority.HIGH, JobPriority.LOW);
        assertThat(specs.get(2).getDisplayName()).isEqualTo("ACME Holdings, Inc.");
        assertThat(specs.get(0).getDisplayName()).isNull();
    }

    @Test
    public void shouldReportLineOfUnknownPriority() {
        assertThatThrownBy(() -> parser.parse(List.of("B100", "B200,urgent")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("line 2:");
    }

    @Test
    public void shouldRejectBlankKey() {
        assertThatThrownBy(() -> parser.parse(List.of(" ,high")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("line 1");
    }

}
