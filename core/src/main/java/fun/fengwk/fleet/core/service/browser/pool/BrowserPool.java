package fun.fengwk.fleet.core.service.browser.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-capacity pool of pre-warmed browser sessions.
 *
 * <p>Lifecycle model:
 * <ul>
 *     <li>{@link #initialize()} creates every session up front, one per slot.</li>
 *     <li>Acquire a slot from the fair idle queue -> use its session -> release the lease.</li>
 *     <li>A lease released as broken gets a fresh session before its slot is offered again.</li>
 *     <li>Track all slots in {@code allSlots} so shutdown can close idle and leased sessions alike.</li>
 * </ul>
 *
 * <p>Outstanding leases never exceed capacity because each lease holds exactly one slot.
 *
 * @author fengwk
 */
public class BrowserPool {

    private static final Logger log = LoggerFactory.getLogger(BrowserPool.class);

    private final String poolName;
    private final BrowserPoolConfig config;
    private final BrowserSessionFactory sessionFactory;

    /**
     * Idle slot queue, fair so blocked acquirers are served in arrival order.
     */
    private final BlockingQueue<Slot> idleSlots;

    /**
     * Global slot registry for deterministic shutdown.
     */
    private final List<Slot> allSlots = new CopyOnWriteArrayList<>();

    /**
     * Leases handed out and not yet returned, by lease id.
     */
    private final Map<Long, BrowserLease> outstandingLeases = new ConcurrentHashMap<>();

    private final AtomicLong leaseIdGen = new AtomicLong(1);
    private final AtomicInteger leasedCount = new AtomicInteger(0);
    private final AtomicInteger peakLeased = new AtomicInteger(0);
    private final AtomicInteger replacedSessions = new AtomicInteger(0);
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * Signalled on every release so shutdown can wait for outstanding leases.
     */
    private final Object leaseMonitor = new Object();

    public BrowserPool(String poolName, BrowserPoolConfig config, BrowserSessionFactory sessionFactory) {
        this.poolName = poolName;
        this.config = normalizeConfig(config);
        this.sessionFactory = sessionFactory;
        this.idleSlots = new ArrayBlockingQueue<>(this.config.getCapacity(), true);
    }

    /**
     * Create {@code capacity} ready sessions. Sessions created before a failure are closed again.
     */
    public void initialize() {
        if (shutdown.get()) {
            throw new BrowserPoolException(poolName + " browser pool is shutdown");
        }
        if (!initialized.compareAndSet(false, true)) {
            return;
        }

        int capacity = config.getCapacity();
        log.info("initializing {} browser pool, capacity={}", poolName, capacity);
        List<Slot> created = new ArrayList<>(capacity);
        try {
            for (int i = 1; i <= capacity; i++) {
                Slot slot = new Slot(i);
                slot.session = sessionFactory.create(nextSessionId(slot));
                created.add(slot);
                log.info("browser session {}/{} ready, pool={}", i, capacity, poolName);
            }
        } catch (RuntimeException ex) {
            log.error("browser pool initialization failed, pool={}, created={}, error={}",
                poolName, created.size(), ex.getMessage(), ex);
            for (Slot slot : created) {
                closeSessionQuietly(slot.session, slot.slotId);
            }
            initialized.set(false);
            throw new BrowserPoolException("failed to initialize " + poolName + " browser pool: " + ex.getMessage(), ex);
        }

        allSlots.addAll(created);
        idleSlots.addAll(created);
        log.info("{} browser pool ready with {} sessions", poolName, capacity);
    }

    public BrowserLease acquire() throws InterruptedException {
        return acquire(config.getAcquireTimeoutMs());
    }

    /**
     * Block until a session is free, then lease it.
     *
     * @throws BrowserPoolBusyException no session became free within the timeout
     * @throws BrowserPoolException the pool is shut down or a fresh session could not be created
     * @throws InterruptedException the caller was interrupted while waiting
     */
    public BrowserLease acquire(long timeoutMs) throws InterruptedException {
        ensureServing();

        Slot slot = idleSlots.poll(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS);
        if (slot == null) {
            log.info(
                "browser session acquire timeout, pool={}, timeoutMs={}, leased={}, idle={}",
                poolName,
                timeoutMs,
                leasedCount.get(),
                idleSlots.size()
            );
            throw new BrowserPoolBusyException(poolName + " browser pool is busy");
        }
        if (shutdown.get()) {
            idleSlots.offer(slot);
            throw new BrowserPoolException(poolName + " browser pool is shutdown");
        }

        try {
            // Slot may be empty when an earlier replacement failed.
            if (slot.session == null) {
                slot.session = sessionFactory.create(nextSessionId(slot));
            }
        } catch (RuntimeException ex) {
            idleSlots.offer(slot);
            throw new BrowserPoolException(
                "failed to create browser session for slot " + slot.slotId + ": " + ex.getMessage(), ex);
        }

        BrowserLease lease = new BrowserLease(leaseIdGen.getAndIncrement(), slot, slot.session, this);
        outstandingLeases.put(lease.getLeaseId(), lease);
        int leased = leasedCount.incrementAndGet();
        peakLeased.accumulateAndGet(leased, Math::max);
        if (shutdown.get()) {
            // Shutdown ran while this slot was leaving the idle queue and may have swept it already.
            abandonLease(lease, slot);
            throw new BrowserPoolException(poolName + " browser pool is shutdown");
        }
        log.debug("leased browser session, pool={}, leaseId={}, slotId={}", poolName, lease.getLeaseId(), slot.slotId);
        return lease;
    }

    /**
     * Return a lease to the pool.
     *
     * @throws IllegalStateException the lease was already released or does not belong to this pool
     */
    public void release(BrowserLease lease) {
        if (lease == null) {
            throw new IllegalArgumentException("lease is null");
        }
        if (!outstandingLeases.remove(lease.getLeaseId(), lease)) {
            log.warn("rejected release of a lease that is not outstanding, pool={}, lease={}", poolName, lease);
            throw new IllegalStateException("lease is not outstanding in " + poolName + " browser pool: " + lease);
        }
        doRelease(lease);
    }

    /**
     * Shut down with the configured grace period.
     */
    public void shutdown() {
        shutdown(config.getShutdownGraceMs());
    }

    /**
     * Refuse new leases, wait up to {@code graceMs} for outstanding ones, then close every session.
     *
     * @throws BrowserPoolException carrying each failed session teardown as a suppressed exception
     */
    public void shutdown(long graceMs) {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("shutting down {} browser pool, outstandingLeases={}", poolName, outstandingLeases.size());

        awaitOutstandingLeases(graceMs);
        if (!outstandingLeases.isEmpty()) {
            log.warn("reclaiming {} outstanding leases after grace period, pool={}, graceMs={}",
                outstandingLeases.size(), poolName, graceMs);
            for (BrowserLease lease : List.copyOf(outstandingLeases.values())) {
                if (outstandingLeases.remove(lease.getLeaseId(), lease)) {
                    lease.markReleased();
                    leasedCount.decrementAndGet();
                }
            }
        }

        idleSlots.clear();
        List<Exception> failures = new ArrayList<>();
        for (Slot slot : allSlots) {
            BrowserSession session = takeSession(slot);
            if (session == null) {
                continue;
            }
            try {
                session.close();
            } catch (Exception ex) {
                log.warn("failed to close browser session, pool={}, slotId={}", poolName, slot.slotId, ex);
                failures.add(ex);
            }
        }

        if (!failures.isEmpty()) {
            BrowserPoolException ex = new BrowserPoolException(
                "failed to close " + failures.size() + " browser session(s) in " + poolName + " browser pool");
            failures.forEach(ex::addSuppressed);
            throw ex;
        }
        log.info("{} browser pool shutdown completed", poolName);
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public int getCapacity() {
        return config.getCapacity();
    }

    public int getLeasedCount() {
        return leasedCount.get();
    }

    public BrowserPoolStats stats() {
        return BrowserPoolStats.builder()
            .capacity(config.getCapacity())
            .leased(leasedCount.get())
            .idle(idleSlots.size())
            .peakLeased(peakLeased.get())
            .replacedSessions(replacedSessions.get())
            .build();
    }

    boolean releaseIfOutstanding(BrowserLease lease) {
        if (!outstandingLeases.remove(lease.getLeaseId(), lease)) {
            return false;
        }
        doRelease(lease);
        return true;
    }

    private void doRelease(BrowserLease lease) {
        lease.markReleased();
        Slot slot = lease.slot();
        try {
            if (!shutdown.get()) {
                if (lease.isBroken()) {
                    replaceSession(slot, lease.getBrokenReason());
                } else if (!isUsable(slot)) {
                    replaceSession(slot, "session no longer usable");
                }
            }
        } finally {
            leasedCount.decrementAndGet();
            idleSlots.offer(slot);
            synchronized (leaseMonitor) {
                leaseMonitor.notifyAll();
            }
        }
        log.debug("released browser session, pool={}, leaseId={}, slotId={}", poolName, lease.getLeaseId(), slot.slotId);
    }

    private void abandonLease(BrowserLease lease, Slot slot) {
        if (outstandingLeases.remove(lease.getLeaseId(), lease)) {
            lease.markReleased();
            leasedCount.decrementAndGet();
        }
        closeSessionQuietly(takeSession(slot), slot.slotId);
        synchronized (leaseMonitor) {
            leaseMonitor.notifyAll();
        }
    }

    private BrowserSession takeSession(Slot slot) {
        synchronized (slot) {
            BrowserSession session = slot.session;
            slot.session = null;
            return session;
        }
    }

    private void replaceSession(Slot slot, String reason) {
        log.warn("replacing browser session, pool={}, slotId={}, reason={}", poolName, slot.slotId, reason);
        BrowserSession broken = slot.session;
        slot.session = null;
        closeSessionQuietly(broken, slot.slotId);
        replacedSessions.incrementAndGet();
        try {
            slot.session = sessionFactory.create(nextSessionId(slot));
        } catch (RuntimeException ex) {
            // Slot stays empty, the next acquire of this slot retries creation.
            log.warn("replacement browser session creation failed, pool={}, slotId={}, error={}",
                poolName, slot.slotId, ex.getMessage(), ex);
        }
    }

    private boolean isUsable(Slot slot) {
        BrowserSession session = slot.session;
        if (session == null) {
            return false;
        }
        try {
            return session.isUsable();
        } catch (RuntimeException ex) {
            log.debug("browser session usability check failed, pool={}, slotId={}", poolName, slot.slotId, ex);
            return false;
        }
    }

    private void awaitOutstandingLeases(long graceMs) {
        long deadline = System.currentTimeMillis() + Math.max(0L, graceMs);
        synchronized (leaseMonitor) {
            while (!outstandingLeases.isEmpty()) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return;
                }
                try {
                    leaseMonitor.wait(remaining);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    log.warn("interrupted while waiting for outstanding leases, pool={}", poolName);
                    return;
                }
            }
        }
    }

    private void ensureServing() {
        if (shutdown.get()) {
            throw new BrowserPoolException(poolName + " browser pool is shutdown");
        }
        if (!initialized.get()) {
            throw new IllegalStateException(poolName + " browser pool is not initialized");
        }
    }

    private String nextSessionId(Slot slot) {
        return poolName + "-slot" + slot.slotId + "-g" + (++slot.generation);
    }

    private BrowserPoolConfig normalizeConfig(BrowserPoolConfig rawConfig) {
        return BrowserPoolConfig.builder()
            .capacity(Math.max(1, rawConfig.getCapacity()))
            .acquireTimeoutMs(Math.max(1L, rawConfig.getAcquireTimeoutMs()))
            .shutdownGraceMs(Math.max(0L, rawConfig.getShutdownGraceMs()))
            .build();
    }

    private void closeSessionQuietly(BrowserSession session, int slotId) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (Exception ex) {
            log.warn("close browser session failed, pool={}, slotId={}, error={}", poolName, slotId, ex.getMessage());
        }
    }

    static final class Slot {

        private final int slotId;
        private int generation;
        private volatile BrowserSession session;

        private Slot(int slotId) {
            this.slotId = slotId;
        }

        int getSlotId() {
            return slotId;
        }

    }

}
