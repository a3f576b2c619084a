package fun.fengwk.fleet.core.service.browser.pool;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a browser pool.
 *
 * @author fengwk
 */
@Data
@Builder
public class BrowserPoolConfig {

    /**
     * Number of sessions created on initialization.
     */
    @Builder.Default
    private int capacity = 3;

    /**
     * Timeout when waiting for an idle session.
     */
    @Builder.Default
    private long acquireTimeoutMs = 60000;

    /**
     * How long shutdown waits for outstanding leases before reclaiming them.
     */
    @Builder.Default
    private long shutdownGraceMs = 30000;

}
