package io.griddedetl.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {
    @Test
    void doubles_backoff_up_to_ceiling() {
        var policy = new ExponentialBackoffRetryPolicy(5, 10, 35);
        assertEquals(10, policy.backoffMillis(1));
        assertEquals(20, policy.backoffMillis(2));
        assertEquals(35, policy.backoffMillis(3));
    }

    @Test
    void stops_after_max_attempts_and_on_interrupt() {
        var policy = new ExponentialBackoffRetryPolicy(2, 1, 1);
        assertTrue(policy.shouldRetry(1, new IOException("x")));
        assertFalse(policy.shouldRetry(2, new IOException("x")));
        assertFalse(policy.shouldRetry(1, new InterruptedException()));
    }

    @Test
    void none_makes_a_single_attempt() {
        assertFalse(RetryPolicy.none().shouldRetry(1, new IOException("x")));
    }
}
