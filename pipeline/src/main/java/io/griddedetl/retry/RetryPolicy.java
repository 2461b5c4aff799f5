package io.griddedetl.retry;

/**
 * Decides whether a failed task attempt is tried again and how long to wait first.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);

    /** Single attempt, never retried. */
    static RetryPolicy none() {
        return new ExponentialBackoffRetryPolicy(1, 1, 1);
    }
}
