package shardcache.error;

public class CacheClosedException extends CacheException {
    public CacheClosedException(String message) {
        super(message);
    }
}
