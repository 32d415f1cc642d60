package shardcache.error;

/** Base of the unchecked exceptions raised when a {@link shardcache.CacheResult} is unwrapped. */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
