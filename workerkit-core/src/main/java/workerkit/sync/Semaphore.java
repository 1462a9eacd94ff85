package workerkit.sync;

import workerkit.ResultPromise;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting semaphore with a strict FIFO wait queue.
 *
 * <p>{@link #release()} either hands its permit directly to the oldest waiter or returns it
 * to the pool, never both, so {@code availablePermits() + holders == maxPermits()} holds at
 * all times and no waiter is overtaken by a later {@link #acquire()}.
 *
 * <p>Waiting can be blocking ({@link #acquire()}) or callback-driven ({@link #acquireAsync()}).
 * Waiter promises are settled outside the internal lock.
 *
 * <p>This class is thread-safe.
 */
public final class Semaphore {
    private final int maxPermits;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<ResultPromise<Void>> waiters = new ArrayDeque<>();
    private int permits;

    /**
     * @param maxPermits number of permits, all initially available
     * @throws IllegalArgumentException if {@code maxPermits <= 0}
     */
    public Semaphore(int maxPermits) {
        if (maxPermits <= 0) {
            throw new IllegalArgumentException("maxPermits must be > 0, got: " + maxPermits);
        }
        this.maxPermits = maxPermits;
        this.permits = maxPermits;
    }

    /**
     * Requests a permit. The returned promise is fulfilled once the permit is held: at once
     * when one is free, otherwise when a {@link #release()} reaches this request in FIFO order.
     *
     * @return promise fulfilled when the caller holds a permit
     */
    public ResultPromise<Void> acquireAsync() {
        lock.lock();
        try {
            if (permits > 0) {
                permits--;
                return ResultPromise.fulfilled(null);
            }
            ResultPromise<Void> waiter = new ResultPromise<>();
            waiters.addLast(waiter);
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a permit is held.
     *
     * <p>If interrupted, the request is withdrawn from the queue; a permit that was already
     * handed over is released again, so the caller never holds a permit after this throws.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws CancellationException if the request was dropped by {@link #cancelWaiters()}
     */
    public void acquire() throws InterruptedException {
        ResultPromise<Void> waiter = acquireAsync();
        try {
            waiter.await();
        } catch (InterruptedException e) {
            if (!withdraw(waiter)) {
                release();
            }
            throw e;
        }
    }

    /**
     * Takes a permit only if one is free right now.
     *
     * @return {@code true} if a permit was taken
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            if (permits > 0) {
                permits--;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a permit, waking the oldest waiter if there is one.
     *
     * @throws IllegalStateException if every permit is already available
     */
    public void release() {
        ResultPromise<Void> next;
        lock.lock();
        try {
            next = waiters.pollFirst();
            if (next == null) {
                if (permits >= maxPermits) {
                    throw new IllegalStateException("release() without matching acquire()");
                }
                permits++;
                return;
            }
        } finally {
            lock.unlock();
        }
        next.complete(null);
    }

    /**
     * Drops every queued request. Each dropped promise fails with
     * {@link CancellationException}; no permit changes hands. The promises are settled in a
     * loop on the calling thread.
     *
     * @return the number of requests dropped
     */
    public int cancelWaiters() {
        List<ResultPromise<Void>> dropped;
        lock.lock();
        try {
            dropped = new ArrayList<>(waiters);
            waiters.clear();
        } finally {
            lock.unlock();
        }
        for (ResultPromise<Void> waiter : dropped) {
            waiter.fail(new CancellationException("Permit request cancelled"));
        }
        return dropped.size();
    }

    private boolean withdraw(ResultPromise<Void> waiter) {
        lock.lock();
        try {
            return waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
    }

    public int availablePermits() {
        lock.lock();
        try {
            return permits;
        } finally {
            lock.unlock();
        }
    }

    public int queueLength() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxPermits() {
        return maxPermits;
    }
}
