package fun.fengwk.fleet.core.service.browser.pool;

/**
 * Creates browser sessions for pool slots.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserSessionFactory {

    BrowserSession create(String sessionId);

}
