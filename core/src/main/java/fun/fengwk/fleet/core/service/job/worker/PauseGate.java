package fun.fengwk.fleet.core.service.job.worker;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gate workers pass before taking the next job. Jobs already running are not affected.
 *
 * @author fengwk
 */
public class PauseGate {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition opened = lock.newCondition();
    private boolean paused;

    public void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            opened.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    public void awaitOpen() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (paused) {
                opened.await();
            }
        } finally {
            lock.unlock();
        }
    }

}
