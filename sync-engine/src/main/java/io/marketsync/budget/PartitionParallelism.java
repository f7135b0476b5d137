package io.marketsync.budget;

/**
 * Sizes the per-task partition fan-out from a unit's rate limit.
 *
 * <p>One worker issuing back-to-back calls of {@code estimatedCallMillis} makes
 * {@code 60000 / estimatedCallMillis} calls a minute, so the rate limit is saturated with
 * {@code rateLimit * estimatedCallMillis / 60000} workers. The result is floored at 1 and capped.
 */
public final class PartitionParallelism {
    private PartitionParallelism() {}

    public static int of(int rateLimitPerMinute, long estimatedCallMillis, int cap) {
        int max = Math.max(1, cap);
        if (rateLimitPerMinute <= 0) return max; // unlimited upstream
        long callMillis = Math.max(1, estimatedCallMillis);
        long workers = (rateLimitPerMinute * callMillis) / 60_000L;
        return (int) Math.max(1, Math.min(max, workers));
    }
}
