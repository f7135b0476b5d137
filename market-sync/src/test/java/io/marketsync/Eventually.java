package io.marketsync;

import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public final class Eventually {
    private Eventually() {}

    public static void waitFor(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + 10_000_000_000L;
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(5);
        }
    }
}
