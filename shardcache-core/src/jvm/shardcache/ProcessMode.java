package shardcache;

/** How a cache handle shares its shard directories with other handles and processes. */
public enum ProcessMode {
    /**
     * Each operation takes the shard's lock file, opens the metadata store, runs one transaction
     * and closes it again. Any number of processes may share the cache directory.
     */
    SHARED,
    /**
     * Shards stay open for the lifetime of the handle and the lock files are held throughout.
     * Threads of this handle run concurrently under record locking; no other handle may open
     * the same shards.
     */
    EXCLUSIVE
}
