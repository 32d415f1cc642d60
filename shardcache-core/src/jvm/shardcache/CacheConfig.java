package shardcache;

import java.util.Properties;

/**
 * Construction-time settings of a cache handle. Every field has a default; setters chain.
 */
public class CacheConfig {
    public static final String PREFIX = "shardcache.";

    public static final int DEFAULT_SHARD_COUNT = 8;
    public static final double DEFAULT_TIMEOUT_BUDGET = 0.025;
    public static final int DEFAULT_INLINE_SIZE_THRESHOLD = 1024;
    public static final long DEFAULT_LOCK_TIMEOUT_MILLIS = 10;
    public static final int DEFAULT_SWEEP_BATCH_SIZE = 100;
    public static final int DEFAULT_CACHE_PERCENT = 10;

    private int shardCount = DEFAULT_SHARD_COUNT;
    private double timeoutBudget = DEFAULT_TIMEOUT_BUDGET;
    private boolean tagIndexEnabled = false;
    private int inlineSizeThreshold = DEFAULT_INLINE_SIZE_THRESHOLD;
    private ProcessMode processMode = ProcessMode.SHARED;
    private long lockTimeoutMillis = DEFAULT_LOCK_TIMEOUT_MILLIS;
    private int sweepBatchSize = DEFAULT_SWEEP_BATCH_SIZE;
    private boolean syncCommits = true;
    private int cachePercent = DEFAULT_CACHE_PERCENT;

    public CacheConfig() {
    }

    public static CacheConfig defaults() {
        return new CacheConfig();
    }

    /**
     * Reads {@code shardcache.*} keys, e.g. {@code shardcache.shardCount=16}. Missing keys keep
     * their defaults.
     */
    public static CacheConfig fromProperties(Properties props) {
        CacheConfig conf = new CacheConfig();
        String v;
        if ((v = props.getProperty(PREFIX + "shardCount")) != null)
            conf.setShardCount(Integer.parseInt(v.trim()));
        if ((v = props.getProperty(PREFIX + "timeoutBudget")) != null)
            conf.setTimeoutBudget(Double.parseDouble(v.trim()));
        if ((v = props.getProperty(PREFIX + "tagIndexEnabled")) != null)
            conf.setTagIndexEnabled(Boolean.parseBoolean(v.trim()));
        if ((v = props.getProperty(PREFIX + "inlineSizeThreshold")) != null)
            conf.setInlineSizeThreshold(Integer.parseInt(v.trim()));
        if ((v = props.getProperty(PREFIX + "processMode")) != null)
            conf.setProcessMode(ProcessMode.valueOf(v.trim().toUpperCase()));
        if ((v = props.getProperty(PREFIX + "lockTimeoutMillis")) != null)
            conf.setLockTimeoutMillis(Long.parseLong(v.trim()));
        if ((v = props.getProperty(PREFIX + "sweepBatchSize")) != null)
            conf.setSweepBatchSize(Integer.parseInt(v.trim()));
        if ((v = props.getProperty(PREFIX + "syncCommits")) != null)
            conf.setSyncCommits(Boolean.parseBoolean(v.trim()));
        if ((v = props.getProperty(PREFIX + "cachePercent")) != null)
            conf.setCachePercent(Integer.parseInt(v.trim()));
        return conf;
    }

    public int getShardCount() {
        return shardCount;
    }

    public CacheConfig setShardCount(int shardCount) {
        if (shardCount < 1)
            throw new IllegalArgumentException("shardCount must be >= 1, got " + shardCount);
        this.shardCount = shardCount;
        return this;
    }

    /** Retry budget in seconds. 0 means a single attempt. */
    public double getTimeoutBudget() {
        return timeoutBudget;
    }

    public CacheConfig setTimeoutBudget(double timeoutBudget) {
        if (timeoutBudget < 0 || Double.isNaN(timeoutBudget))
            throw new IllegalArgumentException("timeoutBudget must be >= 0, got " + timeoutBudget);
        this.timeoutBudget = timeoutBudget;
        return this;
    }

    public boolean isTagIndexEnabled() {
        return tagIndexEnabled;
    }

    public CacheConfig setTagIndexEnabled(boolean tagIndexEnabled) {
        this.tagIndexEnabled = tagIndexEnabled;
        return this;
    }

    public int getInlineSizeThreshold() {
        return inlineSizeThreshold;
    }

    public CacheConfig setInlineSizeThreshold(int inlineSizeThreshold) {
        if (inlineSizeThreshold < 0)
            throw new IllegalArgumentException("inlineSizeThreshold must be >= 0, got " + inlineSizeThreshold);
        this.inlineSizeThreshold = inlineSizeThreshold;
        return this;
    }

    public ProcessMode getProcessMode() {
        return processMode;
    }

    public CacheConfig setProcessMode(ProcessMode processMode) {
        if (processMode == null)
            throw new IllegalArgumentException("processMode is required");
        this.processMode = processMode;
        return this;
    }

    public long getLockTimeoutMillis() {
        return lockTimeoutMillis;
    }

    public CacheConfig setLockTimeoutMillis(long lockTimeoutMillis) {
        if (lockTimeoutMillis < 1)
            throw new IllegalArgumentException("lockTimeoutMillis must be >= 1, got " + lockTimeoutMillis);
        this.lockTimeoutMillis = lockTimeoutMillis;
        return this;
    }

    public int getSweepBatchSize() {
        return sweepBatchSize;
    }

    public CacheConfig setSweepBatchSize(int sweepBatchSize) {
        if (sweepBatchSize < 1)
            throw new IllegalArgumentException("sweepBatchSize must be >= 1, got " + sweepBatchSize);
        this.sweepBatchSize = sweepBatchSize;
        return this;
    }

    public boolean isSyncCommits() {
        return syncCommits;
    }

    public CacheConfig setSyncCommits(boolean syncCommits) {
        this.syncCommits = syncCommits;
        return this;
    }

    public int getCachePercent() {
        return cachePercent;
    }

    public CacheConfig setCachePercent(int cachePercent) {
        if (cachePercent < 1 || cachePercent > 90)
            throw new IllegalArgumentException("cachePercent must be between 1 and 90, got " + cachePercent);
        this.cachePercent = cachePercent;
        return this;
    }

    @Override public String toString() {
        return "CacheConfig{shardCount=" + shardCount
                + ", timeoutBudget=" + timeoutBudget
                + ", tagIndexEnabled=" + tagIndexEnabled
                + ", inlineSizeThreshold=" + inlineSizeThreshold
                + ", processMode=" + processMode
                + ", lockTimeoutMillis=" + lockTimeoutMillis
                + ", sweepBatchSize=" + sweepBatchSize
                + ", syncCommits=" + syncCommits
                + ", cachePercent=" + cachePercent + "}";
    }
}
