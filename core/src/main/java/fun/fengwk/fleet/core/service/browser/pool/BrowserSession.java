package fun.fengwk.fleet.core.service.browser.pool;

import com.microsoft.playwright.Page;

/**
 * One pre-warmed browser session owned by the pool.
 *
 * @author fengwk
 */
public interface BrowserSession extends AutoCloseable {

    String getSessionId();

    /**
     * Open a new page in this session's context.
     */
    Page newPage();

    /**
     * Whether the session can still serve pages.
     */
    boolean isUsable();

    /**
     * Close the session. Implementations are idempotent and throw when teardown fails.
     */
    @Override
    void close();

}
