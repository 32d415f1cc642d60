package shardcache;

/**
 * A value together with its metadata. Returned by {@code get} when the caller asks for the
 * expire time or tag; fields that were not asked for are null.
 */
public class CacheItem {
    private final Object value;
    private final Long expireTime;
    private final String tag;

    public CacheItem(Object value, Long expireTime, String tag) {
        this.value = value;
        this.expireTime = expireTime;
        this.tag = tag;
    }

    public Object getValue() {
        return value;
    }

    /** Absolute expire time in epoch millis, or null when the entry never expires. */
    public Long getExpireTime() {
        return expireTime;
    }

    public String getTag() {
        return tag;
    }

    @Override public String toString() {
        return "CacheItem{value=" + value + ", expireTime=" + expireTime + ", tag=" + tag + "}";
    }
}
