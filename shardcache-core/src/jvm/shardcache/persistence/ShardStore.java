package shardcache.persistence;

import shardcache.CacheItem;
import shardcache.error.LockContentionException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * One shard of the cache. Every method other than {@link #stage}, {@link #volume} and
 * {@link #close} runs as a single transaction: it either commits in full or throws
 * {@link LockContentionException} having changed nothing. Storage failures surface as
 * {@link shardcache.error.ShardStorageException}. Once {@link #close} has been called, every
 * other method throws {@link shardcache.error.CacheClosedException}; close waits for calls
 * already in flight.
 *
 * <p>Expire times are absolute epoch millis; null means the entry never expires.
 */
public interface ShardStore extends Closeable {

    int getShardIndex();

    /**
     * Serializes {@code value} and, for large payloads and streams, places it in the shard's
     * blob area. Called once per write, outside any transaction, so that retried attempts reuse
     * the placed file. A staged value that is never committed must be {@link StagedValue#discard
     * discarded}.
     */
    StagedValue stage(Object value, boolean asStream) throws IOException;

    /** Stores the value unless a live entry exists. */
    boolean add(String key, StagedValue value, Long expireTime, String tag) throws LockContentionException;

    boolean set(String key, StagedValue value, Long expireTime, String tag) throws LockContentionException;

    /**
     * Returns the live entry or null. With {@code asStream}, values stored as bytes come back as
     * an open {@link InputStream} the caller must close.
     */
    CacheItem get(String key, boolean asStream) throws LockContentionException;

    boolean delete(String key) throws LockContentionException;

    /**
     * Adds {@code delta} to the counter at {@code key}. A missing entry is seeded with
     * {@code defaultValue}; returns null when the entry is missing and there is no default.
     */
    Long incr(String key, long delta, Long defaultValue) throws LockContentionException;

    boolean contains(String key) throws LockContentionException;

    /** Replaces the expire time of a live entry. */
    boolean touch(String key, Long expireTime) throws LockContentionException;

    /** Removes a live entry and returns it, or null. */
    CacheItem pop(String key) throws LockContentionException;

    /** Opens the payload of a live entry for reading, or returns null. */
    InputStream openStream(String key) throws LockContentionException;

    /** Removes up to {@code limit} expired entries; returns how many were removed. */
    int expire(int limit) throws LockContentionException;

    /** Removes up to {@code limit} entries carrying {@code tag}. */
    int evict(String tag, int limit) throws LockContentionException;

    /** Removes up to {@code limit} entries. */
    int clear(int limit) throws LockContentionException;

    void createTagIndex() throws LockContentionException;

    void dropTagIndex() throws LockContentionException;

    boolean hasTagIndex() throws LockContentionException;

    /** Bytes on disk used by this shard. */
    long volume();

    void close() throws IOException;
}
