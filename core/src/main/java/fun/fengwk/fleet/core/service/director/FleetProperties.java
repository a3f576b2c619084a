package fun.fengwk.fleet.core.service.director;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Run orchestration configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "fleet.director")
public class FleetProperties {

    /**
     * Number of concurrent workers per run.
     */
    private int workerCount = 3;

    /**
     * Number of browser sessions per run.
     */
    private int poolCapacity = 3;

    /**
     * Attempts per job, the first one included.
     */
    private int maxAttempts = 3;

    /**
     * Progress steps of one job.
     */
    private int totalSteps = 50;

    /**
     * Time budget of one job attempt.
     */
    private long jobSoftTimeoutMs = 300000;

    private long queuePollIntervalMs = 1000;

    private long acquireTimeoutMs = 60000;

    /**
     * How long run teardown waits for workers and leases before forcing them.
     */
    private long shutdownGraceMs = 30000;

    /**
     * Interval of the progress log line.
     */
    private long monitorIntervalMs = 10000;

    /**
     * Window of the rolling throughput.
     */
    private long throughputWindowMs = 300000;

    /**
     * Runs kept for status queries, the latest one included. Older finished runs are dropped.
     */
    private int retainedRuns = 10;

}
