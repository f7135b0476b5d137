package io.marketsync.retry;

import io.marketsync.core.Partition;
import io.marketsync.core.PartitionFetchException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {
    private final ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.withRetries(3, 100, 250);

    @Test
    void retries_transient_failures_three_times() {
        PartitionFetchException transientFailure = new PartitionFetchException(Partition.ALL_HISTORY, "429", true);
        assertTrue(policy.shouldRetry(1, transientFailure));
        assertTrue(policy.shouldRetry(3, transientFailure));
        assertFalse(policy.shouldRetry(4, transientFailure));
        assertEquals(4, policy.maxAttempts());
    }

    @Test
    void never_retries_permanent_or_unexpected_failures() {
        assertFalse(policy.shouldRetry(1, new PartitionFetchException(Partition.ALL_HISTORY, "404", false)));
        assertFalse(policy.shouldRetry(1, new IOException("reset")));
    }

    @Test
    void backoff_doubles_up_to_the_cap() {
        assertEquals(100, policy.backoffMillis(1));
        assertEquals(200, policy.backoffMillis(2));
        assertEquals(250, policy.backoffMillis(3));
        assertEquals(250, policy.backoffMillis(40));
    }

    @Test
    void cap_is_never_below_the_clamped_base_delay() {
        ExponentialBackoffRetryPolicy zero = ExponentialBackoffRetryPolicy.withRetries(2, 0, 0);
        assertEquals(1, zero.backoffMillis(1));
        assertEquals(1, zero.backoffMillis(5));
    }
}
