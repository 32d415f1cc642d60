package shardcache;

import org.apache.log4j.Logger;
import shardcache.error.CacheClosedException;
import shardcache.error.LockContentionException;
import shardcache.error.ShardStorageException;
import shardcache.partition.HashModScheme;
import shardcache.partition.ShardingScheme;
import shardcache.persistence.Coordinator;
import shardcache.persistence.ShardStore;
import shardcache.persistence.StagedValue;
import shardcache.retry.RetryPolicy;
import shardcache.retry.ShardCall;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A handle on a sharded cache directory. Each key lives in exactly one shard, chosen by hashing
 * the key; single-key operations only ever lock that shard. Operations over the whole cache visit
 * the shards one after the other, in batches, and are not atomic across shards.
 *
 * <p>Every operation returns a {@link CacheResult}: the value, or {@link CacheError#TIMEOUT} when
 * the shard stayed locked past the retry budget, {@link CacheError#KEY_NOT_FOUND} where a key has
 * to exist, or {@link CacheError#CLOSED} after {@link #close()}. Storage failures are thrown as
 * {@link ShardStorageException}.
 *
 * <p>TTLs are durations from now; null means never expire, zero or negative means already
 * expired.
 */
public class ShardRouter implements Closeable {
    public static final Logger LOG = Logger.getLogger(ShardRouter.class);

    private final String root;
    private final CacheConfig conf;
    private final CacheSpec spec;
    private final Clock clock;
    private final RetryPolicy retry;
    private final List<ShardStore> stores;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public static ShardRouter open(String root, CacheConfig conf, Coordinator coordinator) throws IOException {
        return new ShardRouter(root, conf, coordinator, new HashModScheme(), Clock.systemUTC());
    }

    public ShardRouter(String root, CacheConfig conf, Coordinator coordinator,
                       ShardingScheme scheme, Clock clock) throws IOException {
        this.root = new File(root).getAbsolutePath();
        this.conf = conf;
        this.clock = clock;
        this.retry = new RetryPolicy(conf.getTimeoutBudget());
        this.spec = CacheSpec.establish(this.root, new CacheSpec(coordinator, scheme, conf.getShardCount()));

        List<ShardStore> opened = new ArrayList<ShardStore>();
        try {
            for (int i = 0; i < spec.getNumShards(); i++) {
                opened.add(coordinator.openShard(i, Utils.shardPath(this.root, i), conf, clock));
            }
        } catch (IOException e) {
            closeAll(opened);
            throw e;
        } catch (RuntimeException e) {
            closeAll(opened);
            throw e;
        }
        this.stores = Collections.unmodifiableList(opened);
        LOG.info("Opened cache at " + this.root + " with " + conf);

        if (conf.isTagIndexEnabled()) {
            CacheResult<Void> indexed = createTagIndex();
            if (indexed.isFailure()) {
                closeAll(opened);
                indexed.get();
            }
        }
    }

    public String getRoot() {
        return root;
    }

    public CacheConfig getConfig() {
        return conf;
    }

    public int getShardCount() {
        return spec.getNumShards();
    }

    public int shardIndex(String key) {
        checkKey(key);
        return spec.getShardScheme().shardIndex(Utils.keyBytes(key), spec.getNumShards());
    }

    public boolean isClosed() {
        return closed.get();
    }

    public CacheResult<Boolean> add(String key, Object value, Duration ttl) {
        return add(key, value, ttl, false, null, true);
    }

    /** Stores the value only if the key is absent or expired; succeeds with whether it did. */
    public CacheResult<Boolean> add(final String key, Object value, Duration ttl, boolean asStream,
                                    final String tag, boolean retryable) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        final StagedValue staged;
        try {
            staged = stage(store, value, asStream);
        } catch (CacheClosedException e) {
            return CacheResult.closed();
        }
        final Long expireTime = expireTime(ttl);
        return write(staged, new ShardCall<Boolean>() {
            public Boolean call() throws LockContentionException {
                return store.add(key, staged, expireTime, tag);
            }
        }, retryable);
    }

    public CacheResult<Boolean> set(String key, Object value, Duration ttl) {
        return set(key, value, ttl, false, null, true);
    }

    /** Stores the value, replacing any existing entry with its expire time and tag. */
    public CacheResult<Boolean> set(final String key, Object value, Duration ttl, boolean asStream,
                                    final String tag, boolean retryable) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        final StagedValue staged;
        try {
            staged = stage(store, value, asStream);
        } catch (CacheClosedException e) {
            return CacheResult.closed();
        }
        final Long expireTime = expireTime(ttl);
        return write(staged, new ShardCall<Boolean>() {
            public Boolean call() throws LockContentionException {
                return store.set(key, staged, expireTime, tag);
            }
        }, retryable);
    }

    public CacheResult<Object> get(String key) {
        return get(key, null);
    }

    public CacheResult<Object> get(String key, Object defaultValue) {
        return get(key, defaultValue, false, false, false, false);
    }

    /**
     * Looks up a key. Missing or expired keys succeed with {@code defaultValue}. When
     * {@code withExpireTime} or {@code withTag} is set the value comes wrapped in a
     * {@link CacheItem} carrying the requested metadata. With {@code asStream}, values stored as
     * bytes are returned as an open {@link InputStream}.
     */
    public CacheResult<Object> get(final String key, Object defaultValue, final boolean asStream,
                                   boolean withExpireTime, boolean withTag, boolean retryable) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        CacheResult<CacheItem> ret = retry.call(new ShardCall<CacheItem>() {
            public CacheItem call() throws LockContentionException {
                return store.get(key, asStream);
            }
        }, retryable);
        if (ret.isFailure()) {
            return ret.castFailure();
        }
        CacheItem item = ret.get();
        if (item == null && LOG.isDebugEnabled()) {
            LOG.debug("Miss for key " + key + " in shard " + store.getShardIndex());
        }
        Object value = item == null ? defaultValue : item.getValue();
        if (!withExpireTime && !withTag) {
            return CacheResult.success(value);
        }
        return CacheResult.<Object>success(new CacheItem(value,
                withExpireTime && item != null ? item.getExpireTime() : null,
                withTag && item != null ? item.getTag() : null));
    }

    public CacheResult<Boolean> delete(String key) {
        return delete(key, true);
    }

    public CacheResult<Boolean> delete(final String key, boolean retryable) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        return retry.call(new ShardCall<Boolean>() {
            public Boolean call() throws LockContentionException {
                return store.delete(key);
            }
        }, retryable);
    }

    public CacheResult<Long> incr(String key) {
        return incr(key, 1, null, true);
    }

    public CacheResult<Long> incr(String key, long delta) {
        return incr(key, delta, null, true);
    }

    /**
     * Atomically adds {@code delta}. A missing key fails with {@link CacheError#KEY_NOT_FOUND}
     * unless {@code defaultValue} is given, in which case the counter starts from it.
     */
    public CacheResult<Long> incr(final String key, final long delta, final Long defaultValue, boolean retryable) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        CacheResult<Long> ret = retry.call(new ShardCall<Long>() {
            public Long call() throws LockContentionException {
                return store.incr(key, delta, defaultValue);
            }
        }, retryable);
        if (ret.isSuccess() && ret.get() == null) {
            return CacheResult.keyNotFound(key);
        }
        return ret;
    }

    public CacheResult<Long> decr(String key) {
        return decr(key, 1, null, true);
    }

    public CacheResult<Long> decr(String key, long delta, Long defaultValue, boolean retryable) {
        return incr(key, -delta, defaultValue, retryable);
    }

    public CacheResult<Boolean> contains(final String key) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        return retry.call(new ShardCall<Boolean>() {
            public Boolean call() throws LockContentionException {
                return store.contains(key);
            }
        }, true);
    }

    /** Gives a live entry a new TTL; succeeds with false when the key is missing. */
    public CacheResult<Boolean> touch(final String key, Duration ttl, boolean retryable) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        final Long expireTime = expireTime(ttl);
        return retry.call(new ShardCall<Boolean>() {
            public Boolean call() throws LockContentionException {
                return store.touch(key, expireTime);
            }
        }, retryable);
    }

    /** Removes a key and returns its value, or {@code defaultValue} when it is missing. */
    public CacheResult<Object> pop(final String key, Object defaultValue, boolean retryable) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        CacheResult<CacheItem> ret = retry.call(new ShardCall<CacheItem>() {
            public CacheItem call() throws LockContentionException {
                return store.pop(key);
            }
        }, retryable);
        if (ret.isFailure()) {
            return ret.castFailure();
        }
        return CacheResult.success(ret.get() == null ? defaultValue : ret.get().getValue());
    }

    /**
     * Opens the stored payload of a key for reading. Large values are streamed from their blob
     * file, which stays readable until the stream is closed even if the key is overwritten.
     */
    public CacheResult<InputStream> openStream(final String key) {
        if (closed.get()) return CacheResult.closed();
        final ShardStore store = storeFor(key);
        CacheResult<InputStream> ret = retry.call(new ShardCall<InputStream>() {
            public InputStream call() throws LockContentionException {
                return store.openStream(key);
            }
        }, true);
        if (ret.isSuccess() && ret.get() == null) {
            return CacheResult.keyNotFound(key);
        }
        return ret;
    }

    /** Physically removes every expired entry; succeeds with the number removed. */
    public CacheResult<Integer> expire() {
        return sweep("expire", new Sweep() {
            public int run(ShardStore store, int limit) throws LockContentionException {
                return store.expire(limit);
            }
        });
    }

    /**
     * Removes every entry tagged {@code tag}. Uses the tag index when one exists and scans every
     * entry otherwise.
     */
    public CacheResult<Integer> evict(final String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("tag is required");
        }
        return sweep("evict " + tag, new Sweep() {
            public int run(ShardStore store, int limit) throws LockContentionException {
                return store.evict(tag, limit);
            }
        });
    }

    /** Removes every entry; succeeds with the number removed. */
    public CacheResult<Integer> clear() {
        return sweep("clear", new Sweep() {
            public int run(ShardStore store, int limit) throws LockContentionException {
                return store.clear(limit);
            }
        });
    }

    public CacheResult<Void> createTagIndex() {
        return eachShard(new ShardTask() {
            public void run(ShardStore store) throws LockContentionException {
                store.createTagIndex();
            }
        });
    }

    public CacheResult<Void> dropTagIndex() {
        return eachShard(new ShardTask() {
            public void run(ShardStore store) throws LockContentionException {
                store.dropTagIndex();
            }
        });
    }

    /** Bytes on disk used by all shards. */
    public CacheResult<Long> volume() {
        if (closed.get()) return CacheResult.closed();
        long total = 0;
        for (ShardStore store : stores) {
            total += store.volume();
        }
        return CacheResult.success(total);
    }

    /**
     * Releases this handle's files and locks. Other handles and processes using the same
     * directory are unaffected. Streams already handed out stay readable.
     */
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        IOException first = closeAll(stores);
        LOG.info("Closed cache at " + root);
        if (first != null) {
            throw first;
        }
    }

    private interface Sweep {
        int run(ShardStore store, int limit) throws LockContentionException;
    }

    private interface ShardTask {
        void run(ShardStore store) throws LockContentionException;
    }

    private CacheResult<Integer> sweep(String what, final Sweep sweep) {
        if (closed.get()) return CacheResult.closed();
        final int limit = conf.getSweepBatchSize();
        int total = 0;
        for (final ShardStore store : stores) {
            while (true) {
                CacheResult<Integer> batch = retry.call(new ShardCall<Integer>() {
                    public Integer call() throws LockContentionException {
                        return sweep.run(store, limit);
                    }
                }, true);
                if (batch.isFailure()) {
                    LOG.warn(what + " stopped at shard " + store.getShardIndex() + " after removing "
                            + total + " entries: " + batch.detail());
                    return CacheResult.failure(batch.error(), batch.detail() + " (" + total
                            + " entries already removed)");
                }
                total += batch.get();
                if (batch.get() < limit) {
                    break;
                }
            }
        }
        LOG.info(what + " removed " + total + " entries from " + root);
        return CacheResult.success(total);
    }

    private CacheResult<Void> eachShard(final ShardTask task) {
        if (closed.get()) return CacheResult.closed();
        for (final ShardStore store : stores) {
            CacheResult<Void> ret = retry.call(new ShardCall<Void>() {
                public Void call() throws LockContentionException {
                    task.run(store);
                    return null;
                }
            }, true);
            if (ret.isFailure()) {
                return ret;
            }
        }
        return CacheResult.success(null);
    }

    private CacheResult<Boolean> write(StagedValue staged, ShardCall<Boolean> op, boolean retryable) {
        CacheResult<Boolean> ret = null;
        try {
            ret = retry.call(op, retryable);
            return ret;
        } finally {
            if (ret == null || ret.isFailure() || !ret.get()) {
                staged.discard();
            }
        }
    }

    private StagedValue stage(ShardStore store, Object value, boolean asStream) {
        try {
            return store.stage(value, asStream);
        } catch (IOException e) {
            LOG.error("Could not stage value in shard " + store.getShardIndex(), e);
            throw new ShardStorageException(store.getShardIndex(), "could not write value", e);
        }
    }

    private ShardStore storeFor(String key) {
        return stores.get(shardIndex(key));
    }

    /** Absolute expire time for a TTL, saturating at {@link Long#MAX_VALUE} for TTLs too long to add. */
    private Long expireTime(Duration ttl) {
        if (ttl == null) {
            return null;
        }
        long now = clock.millis();
        if (ttl.isZero() || ttl.isNegative()) {
            return now;
        }
        try {
            return Math.addExact(now, ttl.toMillis());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static void checkKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key is required");
        }
    }

    private static IOException closeAll(List<ShardStore> stores) {
        IOException first = null;
        for (ShardStore store : stores) {
            try {
                store.close();
            } catch (IOException e) {
                LOG.error("Failed to close shard " + store.getShardIndex(), e);
                if (first == null) {
                    first = e;
                }
            }
        }
        return first;
    }
}
