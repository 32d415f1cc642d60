package shardcache.partition;

import java.io.Serializable;

/**
 * Maps a serialized key onto one of {@code shardCount} shards. Implementations must be pure:
 * every process sharing a cache directory has to route a key to the same shard.
 */
public interface ShardingScheme extends Serializable {
    int shardIndex(byte[] shardKey, int shardCount);
}
