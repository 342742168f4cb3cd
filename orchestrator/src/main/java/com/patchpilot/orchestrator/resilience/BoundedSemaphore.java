package com.patchpilot.orchestrator.resilience;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-capacity permit pool with FIFO waiters.
 *
 * Wraps a fair {@link Semaphore} and tracks how many permits are actually held,
 * so an unmatched {@link #release()} is rejected instead of silently growing the
 * pool past its capacity.
 */
public class BoundedSemaphore {

    private final int           capacity;
    private final Semaphore     permits;
    private final AtomicInteger held = new AtomicInteger();

    public BoundedSemaphore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.permits  = new Semaphore(capacity, true);
    }

    /** Blocks until a permit is free. Waiters are served in arrival order. */
    public void acquire() throws InterruptedException {
        permits.acquire();
        held.incrementAndGet();
    }

    public boolean tryAcquire() {
        if (permits.tryAcquire()) {
            held.incrementAndGet();
            return true;
        }
        return false;
    }

    /**
     * Returns a permit and wakes the oldest waiter.
     *
     * @throws IllegalStateException if no permit is currently held
     */
    public void release() {
        int before = held.getAndUpdate(n -> n > 0 ? n - 1 : n);
        if (before == 0) {
            throw new IllegalStateException("release() without a matching acquire()");
        }
        permits.release();
    }

    public int getCapacity()  { return capacity; }
    public int getAcquired()  { return held.get(); }
    public int getAvailable() { return permits.availablePermits(); }
    public int getWaiting()   { return permits.getQueueLength(); }
}
