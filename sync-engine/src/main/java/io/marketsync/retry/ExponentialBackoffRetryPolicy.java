package io.marketsync.retry;

import io.marketsync.core.PartitionFetchException;

/**
 * Retries transient partition failures with exponentially growing delays. Anything else is final
 * on the first attempt.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    /** Up to {@code retries} retries after the first attempt. */
    public static ExponentialBackoffRetryPolicy withRetries(int retries, long baseMillis, long maxMillis) {
        return new ExponentialBackoffRetryPolicy(retries + 1, baseMillis, maxMillis);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        if (!(e instanceof PartitionFetchException pfe) || !pfe.isTransient()) return false;
        return attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, attempt - 1));
        return Math.min(delay, maxMillis);
    }

    public int maxAttempts() { return maxAttempts; }
}
