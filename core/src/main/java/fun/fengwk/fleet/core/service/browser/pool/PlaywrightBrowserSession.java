package fun.fengwk.fleet.core.service.browser.pool;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Browser session backed by one Playwright driver, one browser and one context.
 *
 * <p>Close is idempotent and releases resources in strict order: context, browser, driver.
 * Failures other than "already closed" are collected and rethrown as one exception.
 *
 * @author fengwk
 */
public class PlaywrightBrowserSession implements BrowserSession {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final String sessionId;
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext browserContext;
    private volatile boolean closed = false;

    public PlaywrightBrowserSession(
        String sessionId,
        Playwright playwright,
        Browser browser,
        BrowserContext browserContext
    ) {
        this.sessionId = sessionId;
        this.playwright = playwright;
        this.browser = browser;
        this.browserContext = browserContext;
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public Page newPage() {
        if (closed) {
            throw new IllegalStateException("browser session is closed: " + sessionId);
        }
        return browserContext.newPage();
    }

    @Override
    public boolean isUsable() {
        if (closed) {
            return false;
        }
        try {
            return browser.isConnected();
        } catch (Exception ex) {
            log.debug("browser connectivity check failed, sessionId={}, error={}", sessionId, ex.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        List<Exception> failures = new ArrayList<>();
        closeStep("browser context", browserContext, failures);
        closeStep("browser", browser, failures);
        closeStep("playwright", playwright, failures);

        if (!failures.isEmpty()) {
            IllegalStateException ex = new IllegalStateException(
                "failed to close browser session " + sessionId + ": " + failures.get(0).getMessage(),
                failures.get(0)
            );
            for (int i = 1; i < failures.size(); i++) {
                ex.addSuppressed(failures.get(i));
            }
            throw ex;
        }
    }

    private void closeStep(String name, AutoCloseable closeable, List<Exception> failures) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("{} already closed for session {}, skip close", name, sessionId);
            } else {
                log.warn("failed to close {} for session {}", name, sessionId, ex);
                failures.add(ex);
            }
        }
    }

    public static boolean isExpectedCloseException(Throwable ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
