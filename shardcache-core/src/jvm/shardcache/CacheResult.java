package shardcache;

import shardcache.error.CacheException;

/**
 * Outcome of a cache operation: either a value or one {@link CacheError}. Callers either
 * inspect the error kind and recover, or call {@link #get()} to propagate it as an exception.
 */
public final class CacheResult<T> {
    private final T value;
    private final CacheError error;
    private final String detail;

    private CacheResult(T value, CacheError error, String detail) {
        this.value = value;
        this.error = error;
        this.detail = detail;
    }

    public static <T> CacheResult<T> success(T value) {
        return new CacheResult<T>(value, null, null);
    }

    public static <T> CacheResult<T> failure(CacheError error, String detail) {
        if (error == null) {
            throw new IllegalArgumentException("error kind is required");
        }
        return new CacheResult<T>(null, error, detail);
    }

    public static <T> CacheResult<T> timeout(String detail) {
        return failure(CacheError.TIMEOUT, detail);
    }

    public static <T> CacheResult<T> keyNotFound(String key) {
        return failure(CacheError.KEY_NOT_FOUND, "Key '" + key + "' not found");
    }

    public static <T> CacheResult<T> closed() {
        return failure(CacheError.CLOSED, "Cache is closed");
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /** The error kind, or null on success. */
    public CacheError error() {
        return error;
    }

    public String detail() {
        return detail;
    }

    /**
     * Returns the value, or throws the exception matching the error kind.
     */
    public T get() throws CacheException {
        if (error != null) {
            throw error.toException(detail);
        }
        return value;
    }

    public T orElse(T other) {
        return error == null ? value : other;
    }

    /** Re-types a failure. Only valid on failures. */
    @SuppressWarnings("unchecked")
    public <U> CacheResult<U> castFailure() {
        if (error == null) {
            throw new IllegalStateException("Not a failure: " + this);
        }
        return (CacheResult<U>) this;
    }

    @Override public String toString() {
        return error == null ? "Success(" + value + ")" : "Failure(" + error + ": " + detail + ")";
    }
}
