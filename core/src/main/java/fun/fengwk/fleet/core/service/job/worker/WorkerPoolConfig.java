package fun.fengwk.fleet.core.service.job.worker;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a job worker pool.
 *
 * @author fengwk
 */
@Data
@Builder
public class WorkerPoolConfig {

    /**
     * Number of worker threads.
     */
    @Builder.Default
    private int workerCount = 3;

    /**
     * Queue poll timeout, also the interval at which idle workers re-check for shutdown.
     */
    @Builder.Default
    private long queuePollIntervalMs = 1000;

    /**
     * Time budget of one job attempt, covering session acquisition and every phase.
     */
    @Builder.Default
    private long jobSoftTimeoutMs = 300000;

    /**
     * Timeout when waiting for an idle browser session.
     */
    @Builder.Default
    private long acquireTimeoutMs = 60000;

}
