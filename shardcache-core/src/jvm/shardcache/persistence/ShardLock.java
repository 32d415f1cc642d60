package shardcache.persistence;

import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;

/**
 * Exclusive lock on one shard, across threads and processes. An OS file lock keeps other
 * processes out; since file locks are held per JVM, a JVM-wide permit per lock file keeps the
 * other handles of this JVM out. Acquisition never blocks.
 */
public class ShardLock {
    public static final Logger LOG = Logger.getLogger(ShardLock.class);
    public static final String LOCK_FILENAME = "shard.lock";

    private static final ConcurrentMap<String, Semaphore> PERMITS = new ConcurrentHashMap<String, Semaphore>();

    private final File lockFile;
    private final Semaphore permit;
    private RandomAccessFile raf;
    private FileChannel channel;
    private FileLock held;

    public ShardLock(String shardRoot) throws IOException {
        File dir = new File(shardRoot);
        dir.mkdirs();
        this.lockFile = new File(dir, LOCK_FILENAME).getCanonicalFile();
        Semaphore fresh = new Semaphore(1);
        Semaphore existing = PERMITS.putIfAbsent(lockFile.getPath(), fresh);
        this.permit = existing == null ? fresh : existing;
    }

    /** Returns false if another thread, handle or process holds the shard. */
    public boolean tryAcquire() throws IOException {
        if (!permit.tryAcquire()) {
            return false;
        }
        try {
            synchronized (this) {
                if (channel == null) {
                    raf = new RandomAccessFile(lockFile, "rw");
                    channel = raf.getChannel();
                }
            }
            FileLock lock = channel.tryLock();
            if (lock == null) {
                permit.release();
                return false;
            }
            held = lock;
            return true;
        } catch (IOException e) {
            permit.release();
            throw e;
        } catch (RuntimeException e) {
            permit.release();
            throw e;
        }
    }

    public void release() throws IOException {
        FileLock lock = held;
        held = null;
        try {
            if (lock != null && lock.isValid()) {
                lock.release();
            }
        } finally {
            permit.release();
        }
    }

    public File getLockFile() {
        return lockFile;
    }

    /** Closes the lock file. Any lock still held through it is dropped. */
    public synchronized void close() throws IOException {
        if (raf != null) {
            raf.close();
            raf = null;
            channel = null;
        }
    }
}
