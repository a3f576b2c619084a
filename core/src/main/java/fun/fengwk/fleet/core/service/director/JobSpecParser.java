package fun.fengwk.fleet.core.service.director;

import fun.fengwk.fleet.core.service.job.model.JobPriority;
import fun.fengwk.fleet.core.service.job.model.JobSpec;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses batch files with one job per line: {@code KEY[,PRIORITY[,DISPLAY NAME]]}.
 *
 * <p>Blank lines and lines starting with {@code #} are skipped.
 *
 * @author fengwk
 */
@Component
public class JobSpecParser {

    public List<JobSpec> parse(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public List<JobSpec> parse(List<String> lines) {
        List<JobSpec> specs = new ArrayList<>();
        int lineNumber = 0;
        for (String rawLine : lines) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            specs.add(parseLine(line, lineNumber));
        }
        return specs;
    }

    private JobSpec parseLine(String line, int lineNumber) {
        String[] parts = line.split(",", 3);
        String key = parts[0].trim();
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException("line " + lineNumber + ": client key is blank");
        }
        JobPriority priority;
        try {
            priority = JobPriority.fromValue(parts.length > 1 ? parts[1] : null);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("line " + lineNumber + ": " + ex.getMessage(), ex);
        }
        String displayName = parts.length > 2 && StringUtils.hasText(parts[2]) ? parts[2].trim() : null;
        return JobSpec.builder()
            .externalKey(key)
            .priority(priority)
            .displayName(displayName)
            .build();
    }

}
