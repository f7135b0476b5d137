package io.marketsync;

import io.marketsync.schedule.Ticker;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/** A ticker whose clock only moves when the test moves it. */
public class FakeTicker implements Ticker {
    private final ZoneId zone;
    private volatile Instant now;

    public FakeTicker(ZonedDateTime start) {
        this.zone = start.getZone();
        this.now = start.toInstant();
    }

    @Override
    public Instant now() { return now; }

    @Override
    public ZoneId zone() { return zone; }

    public void set(ZonedDateTime t) { now = t.toInstant(); }

    public void advance(Duration d) { now = now.plus(d); }

    @Override
    public <T> T poll(BlockingQueue<T> queue, Instant deadline) throws InterruptedException {
        while (true) {
            T item = queue.poll(5, TimeUnit.MILLISECONDS);
            if (item != null) return item;
            if (!now.isBefore(deadline)) return null;
        }
    }
}
