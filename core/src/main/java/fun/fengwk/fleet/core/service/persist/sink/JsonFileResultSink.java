package fun.fengwk.fleet.core.service.persist.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fun.fengwk.fleet.core.service.persist.JobResultRecord;
import fun.fengwk.fleet.core.service.persist.PersistenceProperties;
import fun.fengwk.fleet.core.service.persist.ResultSink;
import fun.fengwk.fleet.core.service.persist.SinkWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes one json document per job to {@code outputDir/runId/key.json}.
 *
 * <p>Documents are written to a temp file first and moved into place, so readers never see a
 * partial document.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class JsonFileResultSink implements ResultSink {

    public static final String NAME = "json-file";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileResultSink(PersistenceProperties persistenceProperties) {
        this(Paths.get(persistenceProperties.getOutputDir()));
    }

    public JsonFileResultSink(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void write(JobResultRecord record) {
        Path runDir = outputDir.resolve(safeFileName(record.getRunId()));
        Path target = runDir.resolve(safeFileName(record.getExternalKey()) + ".json");
        try {
            Files.createDirectories(runDir);
            Path temp = Files.createTempFile(runDir, ".result-", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), record);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new SinkWriteException("failed to write result file " + target + ": " + ex.getMessage(), ex);
        }
        log.debug("result file written, path={}", target);
    }

    @Override
    public boolean isHealthy() {
        try {
            Files.createDirectories(outputDir);
            return Files.isWritable(outputDir);
        } catch (IOException ex) {
            log.warn("result directory unavailable, path={}, error={}", outputDir, ex.getMessage());
            return false;
        }
    }

    public Path getOutputDir() {
        return outputDir;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String safeFileName(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }

}
