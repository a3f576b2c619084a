package fun.fengwk.fleet.core.testing;

import fun.fengwk.fleet.core.service.browser.pool.BrowserSession;
import fun.fengwk.fleet.core.service.browser.pool.BrowserSessionFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Session factory that records every session it creates.
 *
 * @author fengwk
 */
public class FakeBrowserSessionFactory implements BrowserSessionFactory {

    private final List<FakeBrowserSession> sessions = new CopyOnWriteArrayList<>();
    private final AtomicInteger remainingFailures = new AtomicInteger(0);
    private final AtomicInteger failAfter = new AtomicInteger(-1);
    private volatile boolean failOnClose;

    @Override
    public BrowserSession create(String sessionId) {
        if (failAfter.get() == 0) {
            throw new IllegalStateException("launch failed: " + sessionId);
        }
        if (failAfter.get() > 0) {
            failAfter.decrementAndGet();
        }
        if (remainingFailures.get() > 0 && remainingFailures.getAndDecrement() > 0) {
            throw new IllegalStateException("launch failed: " + sessionId);
        }
        FakeBrowserSession session = new FakeBrowserSession(sessionId, failOnClose);
        sessions.add(session);
        return session;
    }

    /**
     * Fail the next {@code count} creations.
     */
    public void failNext(int count) {
        remainingFailures.set(count);
    }

    /**
     * Succeed {@code count} more creations, then fail every later one.
     */
    public void failAfter(int count) {
        failAfter.set(count);
    }

    public void setFailOnClose(boolean failOnClose) {
        this.failOnClose = failOnClose;
    }

    public List<FakeBrowserSession> getSessions() {
        return sessions;
    }

    public long openSessions() {
        return sessions.stream().filter(session -> !session.isClosed()).count();
    }

}
