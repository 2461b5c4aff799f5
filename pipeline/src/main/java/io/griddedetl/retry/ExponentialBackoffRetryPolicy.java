package io.griddedetl.retry;

/**
 * Retries up to {@code maxAttempts} total attempts, doubling the wait each time up to a ceiling.
 * Interruption is never retried.
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

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        if (e instanceof InterruptedException) return false;
        return attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMillis);
    }

    public int maxAttempts() { return maxAttempts; }
}
