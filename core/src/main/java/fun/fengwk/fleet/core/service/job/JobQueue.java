package fun.fengwk.fleet.core.service.job;

import fun.fengwk.fleet.core.service.job.model.JobPriority;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe queue of pending jobs with priority bands.
 *
 * <p>Higher bands are served first, FIFO within a band. Retries go to the tail of their band.
 * The queue also tracks unfinished jobs: a job counts from {@link #enqueue(Job)} until
 * {@link #markDone(Job)}, so {@link #awaitDrained()} returns once every job is terminal.
 *
 * @author fengwk
 */
public class JobQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition drained = lock.newCondition();
    private final Map<JobPriority, ArrayDeque<Job>> bands = new EnumMap<>(JobPriority.class);

    private int size;
    private int unfinished;
    private boolean closed;

    public JobQueue() {
        for (JobPriority priority : JobPriority.values()) {
            bands.put(priority, new ArrayDeque<>());
        }
    }

    /**
     * Add a new job.
     *
     * @throws IllegalStateException the queue is closed
     */
    public void enqueue(Job job) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("job queue is closed");
            }
            bands.get(job.getPriority()).addLast(job);
            size++;
            unfinished++;
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put a job back for another attempt, behind the jobs already waiting in its band.
     *
     * @return false if the queue is closed and the job was not queued
     */
    public boolean requeue(Job job) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            bands.get(job.getPriority()).addLast(job);
            size++;
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the next job, waiting up to the timeout.
     *
     * @return the job, or null on timeout or when the queue is closed and empty
     */
    public Job poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (size == 0) {
                if (closed || nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            for (ArrayDeque<Job> band : bands.values()) {
                Job job = band.pollFirst();
                if (job != null) {
                    size--;
                    return job;
                }
            }
            throw new IllegalStateException("job queue size is out of sync");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record that a job reached a terminal state.
     */
    public void markDone(Job job) {
        lock.lock();
        try {
            if (unfinished <= 0) {
                throw new IllegalStateException("markDone called more often than jobs were enqueued: " + job);
            }
            unfinished--;
            if (unfinished == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public void awaitDrained() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (unfinished > 0) {
                drained.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if every job finished within the timeout
     */
    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (unfinished > 0) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = drained.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refuse further jobs and wake idle pollers.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every queued job in dequeue order. The caller owns them and must mark each one done.
     */
    public List<Job> drainPending() {
        lock.lock();
        try {
            List<Job> pending = new ArrayList<>(size);
            for (ArrayDeque<Job> band : bands.values()) {
                pending.addAll(band);
                band.clear();
            }
            size = 0;
            return pending;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int unfinished() {
        lock.lock();
        try {
            return unfinished;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

}
