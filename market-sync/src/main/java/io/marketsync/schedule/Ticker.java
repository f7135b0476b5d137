package io.marketsync.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.BlockingQueue;

/**
 * Time source and wait primitive for the scheduling thread, so tests can drive the clock.
 */
public interface Ticker {
    Instant now();

    ZoneId zone();

    /**
     * Takes the next element of {@code queue}, waiting until it arrives or until {@code deadline}
     * has passed on this ticker's clock, whichever comes first. Returns null on deadline.
     */
    <T> T poll(BlockingQueue<T> queue, Instant deadline) throws InterruptedException;

    default LocalDate today() {
        return LocalDate.ofInstant(now(), zone());
    }
}
