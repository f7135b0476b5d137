package io.marketsync.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

public class SystemTicker implements Ticker {
    private final ZoneId zone;

    public SystemTicker(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public Instant now() { return Instant.now(); }

    @Override
    public ZoneId zone() { return zone; }

    @Override
    public <T> T poll(BlockingQueue<T> queue, Instant deadline) throws InterruptedException {
        long millis = Duration.between(Instant.now(), deadline).toMillis();
        if (millis <= 0) return queue.poll();
        return queue.poll(millis, TimeUnit.MILLISECONDS);
    }
}
