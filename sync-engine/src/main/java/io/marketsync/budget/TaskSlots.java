package io.marketsync.budget;

import java.util.concurrent.Semaphore;

/**
 * Process-wide cap on running tasks. A counting semaphore whose size can change at runtime:
 * growing releases extra permits at once, shrinking withholds permits as running tasks finish,
 * so tasks already holding a slot are never disturbed.
 */
public class TaskSlots {
    private final ResizableSemaphore permits;
    private int limit;

    public TaskSlots(int limit) {
        this.limit = Math.max(1, limit);
        this.permits = new ResizableSemaphore(this.limit);
    }

    public void acquire() throws InterruptedException { permits.acquire(); }

    public boolean tryAcquire() { return permits.tryAcquire(); }

    public void release() { permits.release(); }

    public synchronized int limit() { return limit; }

    public synchronized void resize(int newLimit) {
        int target = Math.max(1, newLimit);
        int delta = target - limit;
        if (delta > 0) permits.release(delta);
        else if (delta < 0) permits.shrink(-delta);
        limit = target;
    }

    public int available() { return permits.availablePermits(); }

    private static final class ResizableSemaphore extends Semaphore {
        ResizableSemaphore(int permits) { super(permits, true); }

        void shrink(int reduction) { reducePermits(reduction); }
    }
}
