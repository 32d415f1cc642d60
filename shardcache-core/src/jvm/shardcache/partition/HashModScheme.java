package shardcache.partition;

import org.apache.log4j.Logger;
import shardcache.Utils;

/** md5 of the key bytes, read as a signed big integer, mod the shard count. */
public class HashModScheme implements ShardingScheme {
    public static final Logger LOG = Logger.getLogger(HashModScheme.class);

    public int shardIndex(byte[] shardKey, int shardCount) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be positive, got " + shardCount);
        }
        int idx = Utils.keyShard(shardKey, shardCount);
        if (LOG.isDebugEnabled()) {
            LOG.debug("shardIndex for " + shardKey.length + " key bytes returned " + idx);
        }
        return idx;
    }
}
