package fun.fengwk.fleet.core.service.browser.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive, temporary ownership of one pooled browser session.
 *
 * <p>Use with try-with-resources: {@link #close()} returns the session to the pool at most once,
 * so scoped acquisition cannot free a slot twice. The session is unreachable after release.
 *
 * @author fengwk
 */
public class BrowserLease implements AutoCloseable {

    private final long leaseId;
    private final BrowserPool.Slot slot;
    private final BrowserSession session;
    private final BrowserPool pool;
    private final AtomicBoolean closeRequested = new AtomicBoolean(false);
    private volatile boolean released = false;
    private volatile String brokenReason;

    BrowserLease(long leaseId, BrowserPool.Slot slot, BrowserSession session, BrowserPool pool) {
        this.leaseId = leaseId;
        this.slot = slot;
        this.session = session;
        this.pool = pool;
    }

    public long getLeaseId() {
        return leaseId;
    }

    public int getSlotId() {
        return slot.getSlotId();
    }

    public BrowserSession getSession() {
        if (released) {
            throw new IllegalStateException("lease " + leaseId + " was already released");
        }
        return session;
    }

    /**
     * Report the session as unusable so the pool replaces it instead of re-offering it.
     */
    public void markBroken(String reason) {
        this.brokenReason = reason == null ? "unspecified" : reason;
    }

    public boolean isBroken() {
        return brokenReason != null;
    }

    public String getBrokenReason() {
        return brokenReason;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        if (closeRequested.compareAndSet(false, true)) {
            pool.releaseIfOutstanding(this);
        }
    }

    BrowserPool.Slot slot() {
        return slot;
    }

    BrowserSession sessionUnchecked() {
        return session;
    }

    void markReleased() {
        released = true;
    }

    @Override
    public String toString() {
        return "BrowserLease{leaseId=" + leaseId + ", slotId=" + slot.getSlotId() + ", released=" + released + "}";
    }

}
