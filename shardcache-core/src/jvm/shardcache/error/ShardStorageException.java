package shardcache.error;

/**
 * The persistent state of one shard could not be read or written. The shard may need to be
 * rebuilt; nothing in the cache tries to repair it.
 */
public class ShardStorageException extends RuntimeException {
    private final int shardIdx;

    public ShardStorageException(int shardIdx, String message, Throwable cause) {
        super("Shard " + shardIdx + ": " + message, cause);
        this.shardIdx = shardIdx;
    }

    public int getShardIndex() {
        return shardIdx;
    }
}
