package shardcache;

import org.apache.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import shardcache.partition.ShardingScheme;
import shardcache.persistence.Coordinator;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * The identity of a cache directory: how many shards it has, how keys are routed to them and
 * which coordinator reads the shards. Written once to {@code cache-spec.yaml} at the root and
 * never replaced; every later handle must agree with it, since changing any of these would
 * strand existing entries.
 */
public class CacheSpec {
    public static final Logger LOG = Logger.getLogger(CacheSpec.class);
    public static final String CACHE_SPEC_FILENAME = "cache-spec.yaml";

    private static final String COORDINATOR_CONF = "coordinator";
    private static final String SHARD_SCHEME_CONF = "shard_scheme";
    private static final String SHARD_COUNT_CONF = "shard_count";

    private final int numShards;
    private final Coordinator coordinator;
    private final ShardingScheme shardingScheme;

    public CacheSpec(String coordinatorClass, String shardSchemeClass, int numShards) {
        this((Coordinator) Utils.newInstance(coordinatorClass),
                (ShardingScheme) Utils.newInstance(shardSchemeClass),
                numShards);
    }

    public CacheSpec(Coordinator coordinator, ShardingScheme shardingScheme, int numShards) {
        if (numShards <= 0) {
            throw new IllegalArgumentException("numShards must be positive, got " + numShards);
        }
        this.numShards = numShards;
        this.coordinator = coordinator;
        this.shardingScheme = shardingScheme;
    }

    public int getNumShards() {
        return numShards;
    }

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public ShardingScheme getShardScheme() {
        return shardingScheme;
    }

    @Override public String toString() {
        return mapify().toString();
    }

    @Override public boolean equals(Object obj) {
        if (obj == null)
            return false;
        if (obj == this)
            return true;
        if (obj.getClass() != getClass())
            return false;

        CacheSpec o = (CacheSpec) obj;
        return mapify().equals(o.mapify());
    }

    @Override public int hashCode() {
        return mapify().hashCode();
    }

    public static boolean exists(String dirpath) {
        return new File(dirpath, CACHE_SPEC_FILENAME).exists();
    }

    public static CacheSpec readFromFileSystem(String dirpath) throws IOException {
        File file = new File(dirpath, CACHE_SPEC_FILENAME);
        if (!file.exists()) {
            return null;
        }
        InputStream is = new FileInputStream(file);
        try {
            return parseFromStream(is);
        } finally {
            is.close();
        }
    }

    @SuppressWarnings("unchecked")
    public static CacheSpec parseFromStream(InputStream is) {
        Object loaded = new Yaml().load(new InputStreamReader(is, StandardCharsets.UTF_8));
        if (!(loaded instanceof Map)) {
            throw new IllegalArgumentException("Malformed " + CACHE_SPEC_FILENAME + ": " + loaded);
        }
        return parseFromMap((Map<String, Object>) loaded);
    }

    protected static CacheSpec parseFromMap(Map<String, Object> specmap) {
        String coordinatorConf = (String) specmap.get(COORDINATOR_CONF);
        String shardSchemeConf = (String) specmap.get(SHARD_SCHEME_CONF);
        Object count = specmap.get(SHARD_COUNT_CONF);
        if (coordinatorConf == null || shardSchemeConf == null || !(count instanceof Number)) {
            throw new IllegalArgumentException("Incomplete " + CACHE_SPEC_FILENAME + ": " + specmap);
        }
        return new CacheSpec(coordinatorConf, shardSchemeConf, ((Number) count).intValue());
    }

    public void writeToStream(OutputStream os) throws IOException {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Writer w = new OutputStreamWriter(os, StandardCharsets.UTF_8);
        new Yaml(options).dump(mapify(), w);
        w.flush();
    }

    private Map<String, Object> mapify() {
        Map<String, Object> spec = new LinkedHashMap<String, Object>();
        spec.put(COORDINATOR_CONF, coordinator.getClass().getName());
        spec.put(SHARD_SCHEME_CONF, shardingScheme.getClass().getName());
        spec.put(SHARD_COUNT_CONF, numShards);
        return spec;
    }

    /**
     * Publishes the spec by hard-linking a fully written temp file into place, so readers never
     * see a partial spec and an existing spec is never replaced.
     *
     * @return false if a spec file was already there, in which case it is left untouched
     */
    public boolean writeToFileSystem(String dirpath) throws IOException {
        File dir = new File(dirpath);
        dir.mkdirs();
        File tmp = new File(dir, CACHE_SPEC_FILENAME + "." + UUID.randomUUID() + ".tmp");
        try {
            OutputStream os = new FileOutputStream(tmp);
            try {
                writeToStream(os);
            } finally {
                os.close();
            }
            try {
                Files.createLink(new File(dir, CACHE_SPEC_FILENAME).toPath(), tmp.toPath());
                return true;
            } catch (FileAlreadyExistsException e) {
                return false;
            }
        } finally {
            Files.deleteIfExists(tmp.toPath());
        }
    }

    /**
     * Returns the spec recorded at {@code dirpath}, recording {@code spec} first if the directory
     * has none. Throws if the directory was created with a different spec.
     */
    public static CacheSpec establish(String dirpath, CacheSpec spec) throws IOException {
        if (spec == null) {
            throw new IllegalArgumentException("You must supply a CacheSpec when opening a cache.");
        }
        if (!exists(dirpath)) {
            if (spec.writeToFileSystem(dirpath)) {
                LOG.info("Created cache at " + dirpath + " with " + spec);
            } else {
                LOG.info("Cache at " + dirpath + " was created concurrently; checking its spec");
            }
        }
        CacheSpec existing = readFromFileSystem(dirpath);
        if (!spec.equals(existing)) {
            throw new IllegalArgumentException(spec + " does not match existing " + existing);
        }
        return existing;
    }
}
