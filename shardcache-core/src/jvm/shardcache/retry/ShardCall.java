package shardcache.retry;

import shardcache.error.LockContentionException;

/** One attempt at a shard operation. */
public interface ShardCall<T> {
    T call() throws LockContentionException;
}
