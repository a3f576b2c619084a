package fun.fengwk.fleet.core.service.browser.pool;

import fun.fengwk.fleet.core.testing.FakeBrowserSession;
import fun.fengwk.fleet.core.testing.FakeBrowserSessionFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class BrowserPoolTest {

    private FakeBrowserSessionFactory sessionFactory;
    private BrowserPool pool;

    @BeforeEach
    public void setUp() {
        sessionFactory = new FakeBrowserSessionFactory();
    }

    @AfterEach
    public void tearDown() {
        if (pool != null) {
            pool.shutdown(0);
        }
    }

    @Test
    public void shouldCreateEverySessionOnInitialize() {
        pool = createPool(3);

        assertThat(sessionFactory.getSessions()).hasSize(3);
        assertThat(pool.stats().getIdle()).isEqualTo(3);
        assertThat(pool.stats().getLeased()).isZero();
    }

    @Test
    public void shouldCloseCreatedSessionsWhenInitializationFails() {
        sessionFactory.failAfter(2);
        BrowserPool failing = new BrowserPool("test", BrowserPoolConfig.builder().capacity(3).build(), sessionFactory);

        assertThatThrownBy(failing::initialize)
            .isInstanceOf(BrowserPoolException.class)
            .hasMessageContaining("failed to initialize");
        assertThat(sessionFactory.getSessions()).hasSize(2);
        assertThat(sessionFactory.getSessions()).allMatch(FakeBrowserSession::isClosed);
    }

    @Test
    public void shouldTimeoutWhenEverySessionIsLeased() throws Exception {
        pool = createPool(2);
        BrowserLease first = pool.acquire();
        BrowserLease second = pool.acquire();

        assertThatThrownBy(() -> pool.acquire(50))
            .isInstanceOf(BrowserPoolBusyException.class);
        assertThat(first.getSlotId()).isNotEqualTo(second.getSlotId());

        first.close();
        second.close();
    }

    @Test
    public void shouldServeWaitingAcquirersInArrivalOrder() throws Exception {
        pool = createPool(1);
        BrowserLease held = pool.acquire();
        List<String> order = new CopyOnWriteArrayList<>();

        Thread first = startWaiter("first", order);
        awaitWaiting(first);
        Thread second = startWaiter("second", order);
        awaitWaiting(second);

        held.close();
        first.join(5000);
        second.join(5000);

        assertThat(order).containsExactly("first", "second");
    }

    @Test
    public void shouldRejectDoubleRelease() throws Exception {
        pool = createPool(2);
        BrowserLease lease = pool.acquire();

        pool.release(lease);

        assertThatThrownBy(() -> pool.release(lease))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not outstanding");
        assertThat(pool.stats().getLeased()).isZero();
        assertThat(pool.stats().getIdle()).isEqualTo(2);
    }

    @Test
    public void shouldReleaseOnceWhenLeaseIsClosedTwice() throws Exception {
        pool = createPool(2);
        BrowserLease lease;
        try (BrowserLease scoped = pool.acquire()) {
            lease = scoped;
            assertThat(pool.stats().getLeased()).isEqualTo(1);
        }
        lease.close();

        assertThat(lease.isReleased()).isTrue();
        assertThat(pool.stats().getIdle()).isEqualTo(2);
        assertThatThrownBy(lease::getSession).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldReplaceBrokenSessionBeforeReoffering() throws Exception {
        pool = createPool(1);
        BrowserLease lease = pool.acquire();
        FakeBrowserSession broken = (FakeBrowserSession) lease.getSession();

        lease.markBroken("page crashed");
        lease.close();

        assertThat(broken.isClosed()).isTrue();
        assertThat(pool.stats().getReplacedSessions()).isEqualTo(1);
        try (BrowserLease next = pool.acquire()) {
            assertThat(next.getSession()).isNotSameAs(broken);
            assertThat(next.getSession().isUsable()).isTrue();
        }
    }

    @Test
    public void shouldReplaceSessionThatIsNoLongerUsable() throws Exception {
        pool = createPool(1);
        BrowserLease lease = pool.acquire();
        FakeBrowserSession session = (FakeBrowserSession) lease.getSession();

        session.setUsable(false);
        lease.close();

        assertThat(session.isClosed()).isTrue();
        assertThat(pool.stats().getReplacedSessions()).isEqualTo(1);
    }

    @Test
    public void shouldRecreateSessionLazilyWhenReplacementFails() throws Exception {
        pool = createPool(1);
        BrowserLease lease = pool.acquire();
        lease.markBroken("disconnected");
        sessionFactory.failNext(1);

        lease.close();

        assertThat(pool.stats().getIdle()).isEqualTo(1);
        try (BrowserLease next = pool.acquire()) {
            assertThat(next.getSession().isUsable()).isTrue();
        }
        assertThat(sessionFactory.getSessions()).hasSize(2);
    }

    @Test
    public void shouldReclaimOutstandingLeasesAfterGracePeriod() throws Exception {
        pool = createPool(2);
        BrowserLease lease = pool.acquire();
        FakeBrowserSession session = (FakeBrowserSession) lease.getSession();

        pool.shutdown(50);

        assertThat(lease.isReleased()).isTrue();
        assertThat(session.isClosed()).isTrue();
        assertThat(sessionFactory.openSessions()).isZero();
        assertThat(pool.stats().getLeased()).isZero();
        lease.close();
        assertThat(session.getCloseCount()).isEqualTo(1);
    }

    @Test
    public void shouldWaitForLeaseReturnedDuringGracePeriod() throws Exception {
        pool = createPool(1);
        BrowserLease lease = pool.acquire();
        Thread returner = new Thread(() -> {
            sleepQuietly(100);
            lease.close();
        });
        returner.start();

        pool.shutdown(5000);
        returner.join(5000);

        assertThat(lease.isReleased()).isTrue();
        assertThat(sessionFactory.openSessions()).isZero();
    }

    @Test
    public void shouldAggregateTeardownFailures() {
        sessionFactory.setFailOnClose(true);
        BrowserPool failing = createPool(2);

        assertThatThrownBy(() -> failing.shutdown(0))
            .isInstanceOf(BrowserPoolException.class)
            .satisfies(ex -> assertThat(ex.getSuppressed()).hasSize(2));
        failing.shutdown(0);
    }

    @Test
    public void shouldRejectAcquireAfterShutdown() {
        BrowserPool closed = createPool(1);
        closed.shutdown(0);

        assertThatThrownBy(closed::acquire).isInstanceOf(BrowserPoolException.class);
        assertThat(closed.isShutdown()).isTrue();
    }

    @Test
    public void shouldCloseLazilyCreatedSessionWhenShutdownOverlapsAcquire() throws Exception {
        AtomicReference<BrowserPool> poolRef = new AtomicReference<>();
        AtomicBoolean shutdownOnCreate = new AtomicBoolean(false);
        BrowserSessionFactory overlapping = sessionId -> {
            BrowserSession session = sessionFactory.create(sessionId);
            if (shutdownOnCreate.getAndSet(false)) {
                poolRef.get().shutdown(0);
            }
            return session;
        };
        BrowserPool overlappingPool = new BrowserPool("test", BrowserPoolConfig.builder()
            .capacity(1)
            .acquireTimeoutMs(5000)
            .build(), overlapping);
        overlappingPool.initialize();
        poolRef.set(overlappingPool);

        BrowserLease lease = overlappingPool.acquire();
        lease.markBroken("disconnected");
        sessionFactory.failNext(1);
        lease.close();
        shutdownOnCreate.set(true);

        assertThatThrownBy(overlappingPool::acquire)
            .isInstanceOf(BrowserPoolException.class)
            .hasMessageContaining("shutdown");
        assertThat(sessionFactory.getSessions()).hasSize(2);
        assertThat(sessionFactory.openSessions()).isZero();
        assertThat(overlappingPool.stats().getLeased()).isZero();
    }

    @Test
    public void shouldNeverExceedCapacityUnderConcurrentUse() throws Exception {
        int capacity = 3;
        pool = createPool(capacity);
        AtomicInteger concurrent = new AtomicInteger(0);
        AtomicInteger maxObserved = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int round = 0; round < 40; round++) {
                    try (BrowserLease lease = pool.acquire(5000)) {
                        int now = concurrent.incrementAndGet();
                        maxObserved.accumulateAndGet(now, Math::max);
                        if (ThreadLocalRandom.current().nextInt(10) == 0) {
                            lease.markBroken("random failure");
                        }
                        Thread.sleep(ThreadLocalRandom.current().nextInt(3));
                        concurrent.decrementAndGet();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdownNow();

        assertThat(maxObserved.get()).isLessThanOrEqualTo(capacity);
        assertThat(pool.stats().getPeakLeased()).isLessThanOrEqualTo(capacity);
        assertThat(pool.stats().getLeased()).isZero();
        assertThat(pool.stats().getIdle()).isEqualTo(capacity);
    }

    private BrowserPool createPool(int capacity) {
        BrowserPool created = new BrowserPool("test", BrowserPoolConfig.builder()
            .capacity(capacity)
            .acquireTimeoutMs(5000)
            .shutdownGraceMs(1000)
            .build(), sessionFactory);
        created.initialize();
        return created;
    }

    private Thread startWaiter(String name, List<String> order) {
        Thread thread = new Thread(() -> {
            try (BrowserLease lease = pool.acquire(5000)) {
                order.add(name);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, name);
        thread.start();
        return thread;
    }

    private void awaitWaiting(Thread thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (thread.getState() != Thread.State.TIMED_WAITING && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(thread.getState()).isEqualTo(Thread.State.TIMED_WAITING);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

}
