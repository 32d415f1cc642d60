package shardcache.persistence;

import com.sleepycat.je.CheckpointConfig;
import com.sleepycat.je.Environment;
import com.sleepycat.je.EnvironmentConfig;
import org.apache.log4j.Logger;
import shardcache.error.CacheClosedException;
import shardcache.error.LockContentionException;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Hands out a shard's open databases for the length of one operation. How long the environment
 * stays open, and who else may use it meanwhile, depends on the process mode.
 */
public abstract class EnvironmentLease {
    public static final Logger LOG = Logger.getLogger(EnvironmentLease.class);

    final int shardIdx;
    final File home;
    final EnvironmentConfig envConf;
    final ShardLock lock;

    /** Held for reading by every operation in flight; {@link #close()} takes it for writing. */
    final ReentrantReadWriteLock handles = new ReentrantReadWriteLock();
    private volatile boolean closing = false;
    private boolean closed = false;

    EnvironmentLease(int shardIdx, File home, EnvironmentConfig envConf, ShardLock lock) {
        this.shardIdx = shardIdx;
        this.home = home;
        this.envConf = envConf;
        this.lock = lock;
    }

    /**
     * Databases for one operation. With {@code exclusive}, the operation may change which
     * databases exist. Throws {@link CacheClosedException} once {@link #close()} has begun.
     */
    public ShardDatabases acquire(boolean exclusive) throws LockContentionException, IOException {
        Lock guard = guard(exclusive);
        if (closing) {
            throw closedShard();
        }
        if (!guard.tryLock()) {
            if (closing) {
                throw closedShard();
            }
            throw locked();
        }
        boolean opened = false;
        try {
            if (closing) {
                throw closedShard();
            }
            ShardDatabases dbs = open();
            opened = true;
            return dbs;
        } finally {
            if (!opened) {
                guard.unlock();
            }
        }
    }

    public void release(ShardDatabases dbs, boolean exclusive) throws IOException {
        try {
            close(dbs);
        } finally {
            guard(exclusive).unlock();
        }
    }

    /** Waits for operations in flight, then gives up the environment and the shard lock. */
    public void close() throws IOException {
        closing = true;
        handles.writeLock().lock();
        try {
            if (!closed) {
                closed = true;
                shutdown();
            }
        } finally {
            handles.writeLock().unlock();
        }
    }

    Lock guard(boolean exclusive) {
        return exclusive ? handles.writeLock() : handles.readLock();
    }

    abstract ShardDatabases open() throws LockContentionException, IOException;

    abstract void close(ShardDatabases dbs) throws IOException;

    abstract void shutdown() throws IOException;

    CacheClosedException closedShard() {
        return new CacheClosedException("Shard " + shardIdx + " is closed");
    }

    LockContentionException locked() {
        return new LockContentionException(shardIdx, "Shard " + shardIdx + " is locked by another handle or process");
    }

    /** Flushes the environment and reclaims obsolete log files. */
    static void compact(Environment env) {
        LOG.info("Syncing environment at " + env.getHome().getPath());
        env.sync();

        boolean anyCleaned = false;
        while (env.cleanLog() > 0) {
            anyCleaned = true;
        }
        if (anyCleaned) {
            LOG.info("Checkpointing environment at " + env.getHome().getPath());
            CheckpointConfig checkpoint = new CheckpointConfig();
            checkpoint.setForce(true);
            env.checkpoint(checkpoint);
        }
    }

    /**
     * Opens the environment for every operation, under the shard lock, and closes it afterwards.
     * The lock file is what other processes contend on.
     */
    public static class Shared extends EnvironmentLease {
        static final int COMPACT_INTERVAL = 1000;

        private int releases = 0;

        public Shared(int shardIdx, File home, EnvironmentConfig envConf, ShardLock lock) {
            super(shardIdx, home, envConf, lock);
        }

        /** Shared handles in one JVM contend on the shard lock, not on {@link #handles}. */
        Lock guard(boolean exclusive) {
            return handles.readLock();
        }

        ShardDatabases open() throws LockContentionException, IOException {
            if (!lock.tryAcquire()) {
                throw locked();
            }
            try {
                return ShardDatabases.open(home, envConf);
            } catch (RuntimeException e) {
                lock.release();
                throw e;
            }
        }

        void close(ShardDatabases dbs) throws IOException {
            try {
                // the shard lock is held, so this counter is never updated concurrently
                if (++releases % COMPACT_INTERVAL == 0) {
                    compact(dbs.getEnvironment());
                }
                dbs.close();
            } finally {
                lock.release();
            }
        }

        void shutdown() throws IOException {
            lock.close();
        }
    }

    /**
     * Keeps the environment open and the shard lock held until {@link #close()}. Threads share
     * the handles and are kept apart by JE's record locks; the write side of {@link #handles}
     * also keeps the tag index from being opened or dropped under a running operation.
     */
    public static class Exclusive extends EnvironmentLease {
        private final ShardDatabases dbs;

        public Exclusive(int shardIdx, File home, EnvironmentConfig envConf, ShardLock lock) throws IOException {
            super(shardIdx, home, envConf, lock);
            if (!lock.tryAcquire()) {
                lock.close();
                throw new IOException("Shard " + shardIdx + " at " + home.getParent()
                        + " is in use by another handle or process");
            }
            try {
                this.dbs = ShardDatabases.open(home, envConf);
            } catch (RuntimeException e) {
                lock.release();
                lock.close();
                throw e;
            }
        }

        ShardDatabases open() {
            return dbs;
        }

        void close(ShardDatabases dbs) {
        }

        void shutdown() throws IOException {
            try {
                try {
                    compact(dbs.getEnvironment());
                } finally {
                    dbs.close();
                }
            } finally {
                try {
                    lock.release();
                } finally {
                    lock.close();
                }
            }
        }
    }
}
