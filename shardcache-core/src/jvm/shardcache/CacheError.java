package shardcache;

import shardcache.error.CacheClosedException;
import shardcache.error.CacheException;
import shardcache.error.CacheTimeoutException;
import shardcache.error.KeyNotFoundException;

/** The failures a caller of the cache is expected to handle. */
public enum CacheError {
    TIMEOUT {
        public CacheException toException(String detail) {
            return new CacheTimeoutException(detail);
        }
    },
    KEY_NOT_FOUND {
        public CacheException toException(String detail) {
            return new KeyNotFoundException(detail);
        }
    },
    CLOSED {
        public CacheException toException(String detail) {
            return new CacheClosedException(detail);
        }
    };

    public abstract CacheException toException(String detail);
}
