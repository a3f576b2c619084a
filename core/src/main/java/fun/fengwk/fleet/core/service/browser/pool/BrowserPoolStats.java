package fun.fengwk.fleet.core.service.browser.pool;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of browser pool usage.
 *
 * @author fengwk
 */
@Value
@Builder
public class BrowserPoolStats {

    int capacity;
    int leased;
    int idle;
    int peakLeased;
    int replacedSessions;

}
