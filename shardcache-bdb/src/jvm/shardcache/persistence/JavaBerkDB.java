package shardcache.persistence;

import com.sleepycat.je.Durability;
import com.sleepycat.je.EnvironmentConfig;
import org.apache.log4j.Logger;
import shardcache.CacheConfig;
import shardcache.ProcessMode;
import shardcache.ShardRouter;
import shardcache.serialize.KryoSerializer;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Backs each shard with a transactional BerkeleyDB Java Edition environment.
 */
public class JavaBerkDB implements Coordinator {
    public static Logger LOG = Logger.getLogger(JavaBerkDB.class);

    public JavaBerkDB() {
        super();
    }

    /** Opens, creating if needed, a cache at {@code root} backed by BerkeleyDB. */
    public static ShardRouter openCache(String root, CacheConfig conf) throws IOException {
        return ShardRouter.open(root, conf, new JavaBerkDB());
    }

    public ShardStore openShard(int shardIdx, String root, CacheConfig conf, Clock clock) throws IOException {
        return new BerkDBShardStore(shardIdx, root, conf, clock, new KryoSerializer());
    }

    static EnvironmentConfig environmentConfig(CacheConfig conf) {
        EnvironmentConfig envConf = new EnvironmentConfig();
        envConf.setAllowCreate(true);
        envConf.setTransactional(true);
        envConf.setLocking(true);
        envConf.setSharedCache(true);
        envConf.setCachePercent(conf.getCachePercent());
        envConf.setLockTimeout(conf.getLockTimeoutMillis(), TimeUnit.MILLISECONDS);
        envConf.setDurability(durability(conf));

        envConf.setConfigParam(EnvironmentConfig.CLEANER_MIN_UTILIZATION, "50");
        envConf.setConfigParam(EnvironmentConfig.LOG_FILE_MAX, "10485760"); // 10 MB
        if (conf.getProcessMode() == ProcessMode.SHARED) {
            // environments live for one operation; background threads would only slow down close
            envConf.setConfigParam(EnvironmentConfig.ENV_RUN_CLEANER, "false");
            envConf.setConfigParam(EnvironmentConfig.ENV_RUN_CHECKPOINTER, "false");
        }

        envConf.setConfigParam(EnvironmentConfig.FILE_LOGGING_LEVEL, "INFO");
        envConf.setConfigParam(EnvironmentConfig.CONSOLE_LOGGING_LEVEL, "OFF");
        return envConf;
    }

    static Durability durability(CacheConfig conf) {
        return conf.isSyncCommits() ? Durability.COMMIT_SYNC : Durability.COMMIT_WRITE_NO_SYNC;
    }
}
