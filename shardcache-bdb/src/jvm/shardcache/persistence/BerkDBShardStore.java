package shardcache.persistence;

import com.sleepycat.bind.tuple.LongBinding;
import com.sleepycat.bind.tuple.StringBinding;
import com.sleepycat.je.Cursor;
import com.sleepycat.je.DatabaseEntry;
import com.sleepycat.je.DatabaseException;
import com.sleepycat.je.LockConflictException;
import com.sleepycat.je.LockMode;
import com.sleepycat.je.OperationStatus;
import com.sleepycat.je.SecondaryCursor;
import com.sleepycat.je.SecondaryDatabase;
import com.sleepycat.je.Transaction;
import com.sleepycat.je.TransactionConfig;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;
import shardcache.CacheConfig;
import shardcache.CacheItem;
import shardcache.ProcessMode;
import shardcache.Utils;
import shardcache.error.CacheClosedException;
import shardcache.error.LockContentionException;
import shardcache.error.ShardStorageException;
import shardcache.serialize.Serializer;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A shard kept in a transactional JE environment under {@code <root>/meta}, with large payloads
 * in {@code <root>/blobs}.
 *
 * <p>Each call runs in one JE transaction. Blob files freed by a transaction are released only
 * after it commits, so an aborted attempt never loses a file still referenced by a row.
 */
public class BerkDBShardStore implements ShardStore {
    public static final Logger LOG = Logger.getLogger(BerkDBShardStore.class);

    public static final String META_DIR = "meta";

    private final int shardIdx;
    private final String root;
    private final CacheConfig conf;
    private final Clock clock;
    private final BlobArea blobs;
    private final ValueCodec codec;
    private final EnvironmentLease lease;
    private final TransactionConfig txnConf;
    private volatile boolean closed = false;

    public BerkDBShardStore(int shardIdx, String root, CacheConfig conf, Clock clock,
                            Serializer serializer) throws IOException {
        this.shardIdx = shardIdx;
        this.root = root;
        this.conf = conf;
        this.clock = clock;
        new File(root).mkdirs();

        this.blobs = new BlobArea(root);
        int stale = blobs.clearStaleTemps();
        if (stale > 0) {
            LOG.info("Removed " + stale + " stale staging files from shard " + shardIdx);
        }
        this.codec = new ValueCodec(serializer, conf.getInlineSizeThreshold());

        this.txnConf = new TransactionConfig();
        txnConf.setDurability(JavaBerkDB.durability(conf));

        File home = new File(root, META_DIR);
        ShardLock lock = new ShardLock(root);
        try {
            if (conf.getProcessMode() == ProcessMode.EXCLUSIVE) {
                this.lease = new EnvironmentLease.Exclusive(shardIdx, home, JavaBerkDB.environmentConfig(conf), lock);
            } else {
                this.lease = new EnvironmentLease.Shared(shardIdx, home, JavaBerkDB.environmentConfig(conf), lock);
            }
        } catch (DatabaseException e) {
            throw new ShardStorageException(shardIdx, "could not open environment at " + home, e);
        }
        LOG.info("Opened shard " + shardIdx + " at " + root + " (" + conf.getProcessMode() + ")");
    }

    public int getShardIndex() {
        return shardIdx;
    }

    public StagedValue stage(Object value, boolean asStream) throws IOException {
        checkOpen();
        return codec.stage(value, asStream, blobs);
    }

    public boolean add(final String key, final StagedValue value, final Long expireTime, final String tag)
            throws LockContentionException {
        return transact(new Work<Boolean>() {
            public Boolean run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                DatabaseEntry k = keyEntry(key);
                EntryRecord old = read(dbs, txn, k, LockMode.RMW);
                if (old != null && !old.isExpired(now)) {
                    return false;
                }
                free(old, freed);
                write(dbs, txn, k, EntryRecord.of(value, expireTime, tag, now));
                return true;
            }
        });
    }

    public boolean set(final String key, final StagedValue value, final Long expireTime, final String tag)
            throws LockContentionException {
        return transact(new Work<Boolean>() {
            public Boolean run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                DatabaseEntry k = keyEntry(key);
                free(read(dbs, txn, k, LockMode.RMW), freed);
                write(dbs, txn, k, EntryRecord.of(value, expireTime, tag, now));
                return true;
            }
        });
    }

    public CacheItem get(final String key, final boolean asStream) throws LockContentionException {
        return transact(new Work<CacheItem>() {
            public CacheItem run(ShardDatabases dbs, Transaction txn, long now, List<String> freed)
                    throws IOException {
                DatabaseEntry k = keyEntry(key);
                EntryRecord rec = read(dbs, txn, k, LockMode.RMW);
                if (rec == null) {
                    return null;
                }
                if (rec.isExpired(now)) {
                    dbs.getEntries().delete(txn, k);
                    free(rec, freed);
                    return null;
                }
                return new CacheItem(materialize(rec, asStream), rec.getExpireTime(), rec.getTag());
            }
        });
    }

    public boolean delete(final String key) throws LockContentionException {
        return transact(new Work<Boolean>() {
            public Boolean run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                DatabaseEntry k = keyEntry(key);
                EntryRecord rec = read(dbs, txn, k, LockMode.RMW);
                if (rec == null) {
                    return false;
                }
                dbs.getEntries().delete(txn, k);
                free(rec, freed);
                return !rec.isExpired(now);
            }
        });
    }

    public Long incr(final String key, final long delta, final Long defaultValue) throws LockContentionException {
        return transact(new Work<Long>() {
            public Long run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                DatabaseEntry k = keyEntry(key);
                EntryRecord rec = read(dbs, txn, k, LockMode.RMW);
                if (rec == null || rec.isExpired(now)) {
                    if (defaultValue == null) {
                        return null;
                    }
                    free(rec, freed);
                    long value = Math.addExact(defaultValue, delta);
                    write(dbs, txn, k, EntryRecord.counter(value, now));
                    return value;
                }
                if (!rec.getMode().isIntegral()) {
                    throw new IllegalStateException("Value of key '" + key + "' is not an integer ("
                            + rec.getMode() + ")");
                }
                long value = Math.addExact(ValueCodec.decodeLong(rec.getInline()), delta);
                rec.mode = ValueCodec.counterMode(rec.getMode(), value);
                rec.inline = ValueCodec.encodeLong(value);
                write(dbs, txn, k, rec);
                return value;
            }
        });
    }

    public boolean contains(final String key) throws LockContentionException {
        return transact(new Work<Boolean>() {
            public Boolean run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                EntryRecord rec = read(dbs, txn, keyEntry(key), LockMode.DEFAULT);
                return rec != null && !rec.isExpired(now);
            }
        });
    }

    public boolean touch(final String key, final Long expireTime) throws LockContentionException {
        return transact(new Work<Boolean>() {
            public Boolean run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                DatabaseEntry k = keyEntry(key);
                EntryRecord rec = read(dbs, txn, k, LockMode.RMW);
                if (rec == null || rec.isExpired(now)) {
                    return false;
                }
                rec.setExpireTime(expireTime);
                write(dbs, txn, k, rec);
                return true;
            }
        });
    }

    public CacheItem pop(final String key) throws LockContentionException {
        return transact(new Work<CacheItem>() {
            public CacheItem run(ShardDatabases dbs, Transaction txn, long now, List<String> freed)
                    throws IOException {
                DatabaseEntry k = keyEntry(key);
                EntryRecord rec = read(dbs, txn, k, LockMode.RMW);
                if (rec == null) {
                    return null;
                }
                dbs.getEntries().delete(txn, k);
                free(rec, freed);
                if (rec.isExpired(now)) {
                    return null;
                }
                return new CacheItem(materialize(rec, false), rec.getExpireTime(), rec.getTag());
            }
        });
    }

    public InputStream openStream(final String key) throws LockContentionException {
        return transact(new Work<InputStream>() {
            public InputStream run(ShardDatabases dbs, Transaction txn, long now, List<String> freed)
                    throws IOException {
                EntryRecord rec = read(dbs, txn, keyEntry(key), LockMode.DEFAULT);
                if (rec == null || rec.isExpired(now)) {
                    return null;
                }
                return rec.isBlob() ? blobs.open(rec.getBlobName()) : new ByteArrayInputStream(rec.getInline());
            }
        });
    }

    public int expire(final int limit) throws LockContentionException {
        return transact(new Work<Integer>() {
            public Integer run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                DatabaseEntry expireKey = new DatabaseEntry();
                DatabaseEntry pKey = new DatabaseEntry();
                DatabaseEntry data = new DatabaseEntry();
                int removed = 0;
                SecondaryCursor cursor = dbs.getExpiryIndex().openCursor(txn, null);
                try {
                    OperationStatus stat = cursor.getFirst(expireKey, pKey, data, LockMode.RMW);
                    while (stat == OperationStatus.SUCCESS && removed < limit
                            && LongBinding.entryToLong(expireKey) <= now) {
                        free(ShardDatabases.BINDING.entryToObject(data), freed);
                        cursor.delete();
                        removed++;
                        stat = cursor.getNext(expireKey, pKey, data, LockMode.RMW);
                    }
                } finally {
                    cursor.close();
                }
                return removed;
            }
        });
    }

    public int evict(final String tag, final int limit) throws LockContentionException {
        return transact(new Work<Integer>() {
            public Integer run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                SecondaryDatabase tags = dbs.getTagIndex();
                if (tags != null) {
                    return evictIndexed(tags, txn, tag, limit, freed);
                }
                return evictScan(dbs, txn, tag, limit, freed);
            }
        });
    }

    private int evictIndexed(SecondaryDatabase tags, Transaction txn, String tag, int limit, List<String> freed) {
        DatabaseEntry tagKey = new DatabaseEntry();
        StringBinding.stringToEntry(tag, tagKey);
        DatabaseEntry pKey = new DatabaseEntry();
        DatabaseEntry data = new DatabaseEntry();
        int removed = 0;
        SecondaryCursor cursor = tags.openCursor(txn, null);
        try {
            OperationStatus stat = cursor.getSearchKey(tagKey, pKey, data, LockMode.RMW);
            while (stat == OperationStatus.SUCCESS && removed < limit) {
                free(ShardDatabases.BINDING.entryToObject(data), freed);
                cursor.delete();
                removed++;
                stat = cursor.getNextDup(tagKey, pKey, data, LockMode.RMW);
            }
        } finally {
            cursor.close();
        }
        return removed;
    }

    // no tag index: every row of the shard is read
    private int evictScan(ShardDatabases dbs, Transaction txn, String tag, int limit, List<String> freed) {
        DatabaseEntry key = new DatabaseEntry();
        DatabaseEntry data = new DatabaseEntry();
        int removed = 0;
        Cursor cursor = dbs.getEntries().openCursor(txn, null);
        try {
            while (removed < limit && cursor.getNext(key, data, LockMode.RMW) == OperationStatus.SUCCESS) {
                EntryRecord rec = ShardDatabases.BINDING.entryToObject(data);
                if (tag.equals(rec.getTag())) {
                    free(rec, freed);
                    cursor.delete();
                    removed++;
                }
            }
        } finally {
            cursor.close();
        }
        return removed;
    }

    public int clear(final int limit) throws LockContentionException {
        return transact(new Work<Integer>() {
            public Integer run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                DatabaseEntry key = new DatabaseEntry();
                DatabaseEntry data = new DatabaseEntry();
                int removed = 0;
                Cursor cursor = dbs.getEntries().openCursor(txn, null);
                try {
                    while (removed < limit && cursor.getNext(key, data, LockMode.RMW) == OperationStatus.SUCCESS) {
                        free(ShardDatabases.BINDING.entryToObject(data), freed);
                        cursor.delete();
                        removed++;
                    }
                } finally {
                    cursor.close();
                }
                return removed;
            }
        });
    }

    public void createTagIndex() throws LockContentionException {
        alterDatabases(true);
    }

    public void dropTagIndex() throws LockContentionException {
        alterDatabases(false);
    }

    public boolean hasTagIndex() throws LockContentionException {
        return transact(new Work<Boolean>() {
            public Boolean run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) {
                return dbs.getTagIndex() != null;
            }
        });
    }

    public long volume() {
        try {
            return FileUtils.sizeOfDirectory(new File(root));
        } catch (UncheckedIOException e) {
            throw new ShardStorageException(shardIdx, "could not measure " + root, e);
        }
    }

    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            lease.close();
        } catch (DatabaseException e) {
            throw new IOException("Failed to close shard " + shardIdx + " at " + root, e);
        }
        LOG.info("Closed shard " + shardIdx + " at " + root);
    }

    private interface Work<T> {
        T run(ShardDatabases dbs, Transaction txn, long now, List<String> freed) throws IOException;
    }

    private <T> T transact(Work<T> work) throws LockContentionException {
        checkOpen();
        ShardDatabases dbs = acquire(false);
        List<String> freed = new ArrayList<String>();
        T ret = null;
        boolean committed = false;
        try {
            Transaction txn = dbs.getEnvironment().beginTransaction(null, txnConf);
            try {
                txn.setLockTimeout(conf.getLockTimeoutMillis(), TimeUnit.MILLISECONDS);
                ret = work.run(dbs, txn, clock.millis(), freed);
                txn.commit();
                committed = true;
            } finally {
                if (!committed) {
                    abort(txn);
                    discard(ret);
                }
            }
        } catch (LockConflictException e) {
            throw new LockContentionException(shardIdx, "Lock conflict in shard " + shardIdx + ": "
                    + e.getClass().getSimpleName(), e);
        } catch (DatabaseException e) {
            LOG.error("Database failure in shard " + shardIdx + " at " + root, e);
            throw new ShardStorageException(shardIdx, "database failure", e);
        } catch (IOException e) {
            LOG.error("Blob failure in shard " + shardIdx + " at " + root, e);
            throw new ShardStorageException(shardIdx, "blob failure", e);
        } finally {
            release(dbs, false);
        }
        for (String name : freed) {
            blobs.release(name);
        }
        return ret;
    }

    private void alterDatabases(boolean createTagIndex) throws LockContentionException {
        checkOpen();
        ShardDatabases dbs = acquire(true);
        try {
            if (createTagIndex) {
                dbs.createTagIndex();
            } else {
                dbs.dropTagIndex();
            }
        } catch (LockConflictException e) {
            throw new LockContentionException(shardIdx, "Lock conflict in shard " + shardIdx, e);
        } catch (DatabaseException e) {
            LOG.error("Could not change tag index of shard " + shardIdx + " at " + root, e);
            throw new ShardStorageException(shardIdx, "could not change tag index", e);
        } finally {
            release(dbs, true);
        }
    }

    private ShardDatabases acquire(boolean exclusive) throws LockContentionException {
        try {
            return lease.acquire(exclusive);
        } catch (LockConflictException e) {
            throw new LockContentionException(shardIdx, "Lock conflict opening shard " + shardIdx, e);
        } catch (DatabaseException e) {
            LOG.error("Could not open environment of shard " + shardIdx + " at " + root, e);
            throw new ShardStorageException(shardIdx, "could not open environment", e);
        } catch (IOException e) {
            throw new ShardStorageException(shardIdx, "could not lock shard", e);
        }
    }

    private void release(ShardDatabases dbs, boolean exclusive) {
        try {
            lease.release(dbs, exclusive);
        } catch (DatabaseException e) {
            LOG.error("Could not close environment of shard " + shardIdx + " at " + root, e);
            throw new ShardStorageException(shardIdx, "could not close environment", e);
        } catch (IOException e) {
            throw new ShardStorageException(shardIdx, "could not unlock shard", e);
        }
    }

    private void abort(Transaction txn) {
        try {
            txn.abort();
        } catch (DatabaseException e) {
            // the environment is already failing; the original error is what propagates
            LOG.warn("Abort failed in shard " + shardIdx, e);
        }
    }

    // a stream opened by a transaction that did not commit must not leak its blob reference
    private static void discard(Object ret) {
        Object value = ret instanceof CacheItem ? ((CacheItem) ret).getValue() : ret;
        if (value instanceof Closeable) {
            IOUtils.closeQuietly((Closeable) value);
        }
    }

    private Object materialize(EntryRecord rec, boolean asStream) throws IOException {
        if (asStream && rec.getMode() == ValueMode.BYTES) {
            return rec.isBlob() ? blobs.open(rec.getBlobName()) : new ByteArrayInputStream(rec.getInline());
        }
        byte[] payload = rec.isBlob() ? blobs.read(rec.getBlobName()) : rec.getInline();
        return codec.decode(rec.getMode(), payload);
    }

    private static DatabaseEntry keyEntry(String key) {
        return new DatabaseEntry(Utils.keyBytes(key));
    }

    private static EntryRecord read(ShardDatabases dbs, Transaction txn, DatabaseEntry key, LockMode mode) {
        DatabaseEntry data = new DatabaseEntry();
        OperationStatus stat = dbs.getEntries().get(txn, key, data, mode);
        if (stat != OperationStatus.SUCCESS) {
            return null;
        }
        return ShardDatabases.BINDING.entryToObject(data);
    }

    private static void write(ShardDatabases dbs, Transaction txn, DatabaseEntry key, EntryRecord rec) {
        DatabaseEntry data = new DatabaseEntry();
        ShardDatabases.BINDING.objectToEntry(rec, data);
        dbs.getEntries().put(txn, key, data);
    }

    private static void free(EntryRecord rec, List<String> freed) {
        if (rec != null && rec.isBlob()) {
            freed.add(rec.getBlobName());
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new CacheClosedException("Shard " + shardIdx + " is closed");
        }
    }
}
