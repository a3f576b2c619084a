package fun.fengwk.fleet.core.testing;

import com.microsoft.playwright.Page;
import fun.fengwk.fleet.core.service.browser.pool.BrowserSession;

import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.Mockito.mock;

/**
 * In-memory browser session handing out Mockito pages.
 *
 * @author fengwk
 */
public class FakeBrowserSession implements BrowserSession {

    private final String sessionId;
    private final boolean failOnClose;
    private final AtomicInteger closeCount = new AtomicInteger(0);
    private volatile boolean usable = true;

    public FakeBrowserSession(String sessionId, boolean failOnClose) {
        this.sessionId = sessionId;
        this.failOnClose = failOnClose;
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public Page newPage() {
        return mock(Page.class);
    }

    @Override
    public boolean isUsable() {
        return usable && closeCount.get() == 0;
    }

    public void setUsable(boolean usable) {
        this.usable = usable;
    }

    public boolean isClosed() {
        return closeCount.get() > 0;
    }

    public int getCloseCount() {
        return closeCount.get();
    }

    @Override
    public void close() {
        if (closeCount.incrementAndGet() == 1 && failOnClose) {
            throw new IllegalStateException("close failed: " + sessionId);
        }
    }

}
