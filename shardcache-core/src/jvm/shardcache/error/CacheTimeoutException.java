package shardcache.error;

/** The shard lock could not be acquired within the retry budget. */
public class CacheTimeoutException extends CacheException {
    public CacheTimeoutException(String message) {
        super(message);
    }
}
