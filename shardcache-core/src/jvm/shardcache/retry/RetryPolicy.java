package shardcache.retry;

import org.apache.log4j.Logger;
import shardcache.CacheResult;
import shardcache.error.CacheClosedException;
import shardcache.error.LockContentionException;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Retries shard calls that lost the race for a shard lock, backing off exponentially until a
 * wall-clock budget runs out. Every attempt is a complete transaction, so giving up leaves
 * nothing half done. A shard closed under a call turns into a CLOSED result.
 */
public class RetryPolicy {
    public static final Logger LOG = Logger.getLogger(RetryPolicy.class);

    public static final long INITIAL_BACKOFF_NANOS = TimeUnit.MILLISECONDS.toNanos(1);
    public static final long MAX_BACKOFF_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final long budgetNanos;

    /** @param timeoutBudget seconds; 0 makes every call a single attempt */
    public RetryPolicy(double timeoutBudget) {
        if (timeoutBudget < 0 || Double.isNaN(timeoutBudget)) {
            throw new IllegalArgumentException("timeoutBudget must be >= 0, got " + timeoutBudget);
        }
        this.budgetNanos = (long) (timeoutBudget * 1e9);
    }

    public long getBudgetNanos() {
        return budgetNanos;
    }

    public <T> CacheResult<T> call(ShardCall<T> op, boolean retryable) {
        long start = System.nanoTime();
        long backoff = INITIAL_BACKOFF_NANOS;
        int attempts = 0;
        while (true) {
            attempts++;
            LockContentionException contention;
            try {
                return CacheResult.success(op.call());
            } catch (LockContentionException e) {
                contention = e;
            } catch (CacheClosedException e) {
                return CacheResult.closed();
            }

            long elapsed = System.nanoTime() - start;
            if (!retryable || budgetNanos == 0 || elapsed >= budgetNanos) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Giving up on shard " + contention.getShardIndex() + " after " + attempts
                            + " attempt(s): " + contention.getMessage());
                }
                return CacheResult.timeout("Shard " + contention.getShardIndex() + " still locked after "
                        + attempts + " attempt(s) in " + TimeUnit.NANOSECONDS.toMillis(elapsed) + " ms");
            }

            long jittered = backoff / 2 + ThreadLocalRandom.current().nextLong(backoff / 2 + 1);
            long sleep = Math.min(jittered, budgetNanos - elapsed);
            try {
                TimeUnit.NANOSECONDS.sleep(sleep);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CacheResult.timeout("Interrupted while waiting for shard " + contention.getShardIndex());
            }
            backoff = Math.min(backoff * 2, MAX_BACKOFF_NANOS);
        }
    }
}
