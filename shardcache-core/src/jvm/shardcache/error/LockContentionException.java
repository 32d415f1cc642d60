package shardcache.error;

/**
 * Raised by a shard store when an attempt could not get the shard's lock. The attempt has been
 * rolled back in full; the retry policy decides whether to try again.
 */
public class LockContentionException extends Exception {
    private final int shardIdx;

    public LockContentionException(int shardIdx, String message) {
        super(message);
        this.shardIdx = shardIdx;
    }

    public LockContentionException(int shardIdx, String message, Throwable cause) {
        super(message, cause);
        this.shardIdx = shardIdx;
    }

    public int getShardIndex() {
        return shardIdx;
    }
}
