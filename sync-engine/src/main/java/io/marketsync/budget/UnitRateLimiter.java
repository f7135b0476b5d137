package io.marketsync.budget;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paces calls against one upstream to a calls-per-minute budget. Callers reserve the next free
 * slot with a CAS and then sleep until it arrives, so concurrent partition workers share the
 * budget without a lock.
 */
public class UnitRateLimiter {
    private final long intervalNanos;
    private final AtomicLong nextAvailableNanos = new AtomicLong(Long.MIN_VALUE);

    public UnitRateLimiter(int callsPerMinute) {
        if (callsPerMinute <= 0) {
            this.intervalNanos = 0;
        } else {
            this.intervalNanos = TimeUnit.MINUTES.toNanos(1) / callsPerMinute;
        }
    }

    /** Blocks until the caller may issue its next call. */
    public void acquire() throws InterruptedException {
        long delay = reserve();
        if (delay > 0) TimeUnit.NANOSECONDS.sleep(delay);
    }

    /** Reserves a slot and returns how long to wait for it, in nanos. */
    long reserve() {
        if (intervalNanos == 0) return 0;
        long now = System.nanoTime();
        while (true) {
            long current = nextAvailableNanos.get();
            long earliest = current == Long.MIN_VALUE ? now : Math.max(current, now);
            long next = earliest + intervalNanos;
            if (nextAvailableNanos.compareAndSet(current, next)) {
                return Math.max(0, earliest - now);
            }
        }
    }

    public boolean isUnlimited() { return intervalNanos == 0; }
}
