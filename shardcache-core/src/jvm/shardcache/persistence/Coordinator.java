package shardcache.persistence;

import shardcache.CacheConfig;

import java.io.IOException;
import java.io.Serializable;
import java.time.Clock;

/**
 * Opens the store backing one shard. The coordinator's class name is recorded in the cache
 * spec, so implementations need a public no-arg constructor.
 */
public interface Coordinator extends Serializable {
    /**
     * Opens (creating if missing) the shard rooted at {@code root}.
     *
     * @param shardIdx index of the shard, used in errors and logs
     * @param root     directory owned exclusively by this shard
     * @param conf     cache settings
     * @param clock    clock used for every expiry decision of this shard
     */
    ShardStore openShard(int shardIdx, String root, CacheConfig conf, Clock clock) throws IOException;
}
