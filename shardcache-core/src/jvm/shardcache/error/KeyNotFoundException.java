package shardcache.error;

public class KeyNotFoundException extends CacheException {
    public KeyNotFoundException(String message) {
        super(message);
    }
}
