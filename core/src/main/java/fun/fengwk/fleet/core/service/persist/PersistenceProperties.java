package fun.fengwk.fleet.core.service.persist;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Result persistence configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "fleet.persist")
public class PersistenceProperties {

    /**
     * Enabled sinks by name: log, json-file, memory.
     */
    private List<String> sinks = List.of("log", "memory");

    /**
     * Write attempts per sink and job.
     */
    private int maxAttempts = 3;

    /**
     * Backoff before the second attempt, doubled after each failure.
     */
    private long initialBackoffMs = 200;

    private long maxBackoffMs = 5000;

    /**
     * Root directory of the json-file sink.
     */
    private String outputDir = System.getProperty("user.home") + "/.scrape-fleet/results";

}
