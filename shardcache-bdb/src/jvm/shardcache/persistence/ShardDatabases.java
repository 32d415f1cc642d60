package shardcache.persistence;

import com.sleepycat.bind.tuple.LongBinding;
import com.sleepycat.bind.tuple.StringBinding;
import com.sleepycat.je.Database;
import com.sleepycat.je.DatabaseConfig;
import com.sleepycat.je.DatabaseEntry;
import com.sleepycat.je.DatabaseException;
import com.sleepycat.je.Environment;
import com.sleepycat.je.EnvironmentConfig;
import com.sleepycat.je.SecondaryConfig;
import com.sleepycat.je.SecondaryDatabase;
import com.sleepycat.je.SecondaryKeyCreator;
import org.apache.log4j.Logger;

import java.io.File;

/**
 * The open handles of one shard's JE environment: the entry database, the expiry index and,
 * when it has been created, the tag index. JE keeps the indexes in step with the entry database
 * inside each transaction.
 */
public class ShardDatabases {
    public static final Logger LOG = Logger.getLogger(ShardDatabases.class);

    public static final String ENTRIES = "entries";
    public static final String EXPIRY_INDEX = "entries-by-expiry";
    public static final String TAG_INDEX = "entries-by-tag";

    static final EntryRecord.Binding BINDING = new EntryRecord.Binding();

    private final Environment env;
    private final Database entries;
    private final SecondaryDatabase expiry;
    private SecondaryDatabase tags;

    private ShardDatabases(Environment env, Database entries, SecondaryDatabase expiry, SecondaryDatabase tags) {
        this.env = env;
        this.entries = entries;
        this.expiry = expiry;
        this.tags = tags;
    }

    /** Opens the environment at {@code home} and every database in it. */
    public static ShardDatabases open(File home, EnvironmentConfig envConf) {
        home.mkdirs();
        Environment env = new Environment(home, envConf);
        Database entries = null;
        SecondaryDatabase expiry = null;
        try {
            DatabaseConfig dbConf = new DatabaseConfig();
            dbConf.setAllowCreate(true);
            dbConf.setTransactional(true);
            dbConf.setNodeMaxEntries(512);
            entries = env.openDatabase(null, ENTRIES, dbConf);

            expiry = env.openSecondaryDatabase(null, EXPIRY_INDEX, entries, indexConfig(new ExpiryKeyCreator()));
            SecondaryDatabase tags = null;
            if (env.getDatabaseNames().contains(TAG_INDEX)) {
                tags = env.openSecondaryDatabase(null, TAG_INDEX, entries, indexConfig(new TagKeyCreator()));
            }
            return new ShardDatabases(env, entries, expiry, tags);
        } catch (DatabaseException e) {
            closeQuietly(expiry, entries, env);
            throw e;
        } catch (RuntimeException e) {
            closeQuietly(expiry, entries, env);
            throw e;
        }
    }

    private static SecondaryConfig indexConfig(SecondaryKeyCreator keyCreator) {
        SecondaryConfig conf = new SecondaryConfig();
        conf.setAllowCreate(true);
        conf.setTransactional(true);
        conf.setSortedDuplicates(true);
        conf.setAllowPopulate(true);
        conf.setKeyCreator(keyCreator);
        return conf;
    }

    public Environment getEnvironment() {
        return env;
    }

    public Database getEntries() {
        return entries;
    }

    public SecondaryDatabase getExpiryIndex() {
        return expiry;
    }

    /** The tag index, or null when none has been created. */
    public SecondaryDatabase getTagIndex() {
        return tags;
    }

    /** Creates and populates the tag index. Callers must have exclusive use of these handles. */
    public void createTagIndex() {
        if (tags == null) {
            tags = env.openSecondaryDatabase(null, TAG_INDEX, entries, indexConfig(new TagKeyCreator()));
            LOG.info("Created tag index in " + env.getHome());
        }
    }

    /** Closes and removes the tag index. Callers must have exclusive use of these handles. */
    public void dropTagIndex() {
        if (tags != null) {
            tags.close();
            tags = null;
        }
        if (env.getDatabaseNames().contains(TAG_INDEX)) {
            env.removeDatabase(null, TAG_INDEX);
            LOG.info("Dropped tag index in " + env.getHome());
        }
    }

    public void close() {
        if (tags != null) {
            tags.close();
            tags = null;
        }
        expiry.close();
        entries.close();
        env.close();
    }

    private static void closeQuietly(SecondaryDatabase expiry, Database entries, Environment env) {
        try {
            if (expiry != null) expiry.close();
            if (entries != null) entries.close();
            env.close();
        } catch (DatabaseException e) {
            LOG.warn("Failed to close " + env.getHome() + " after a failed open", e);
        }
    }

    static class ExpiryKeyCreator implements SecondaryKeyCreator {
        public boolean createSecondaryKey(SecondaryDatabase secondary, DatabaseEntry key,
                                          DatabaseEntry data, DatabaseEntry result) {
            EntryRecord rec = BINDING.entryToObject(data);
            if (!rec.hasExpiry()) {
                return false;
            }
            LongBinding.longToEntry(rec.expireTime, result);
            return true;
        }
    }

    static class TagKeyCreator implements SecondaryKeyCreator {
        public boolean createSecondaryKey(SecondaryDatabase secondary, DatabaseEntry key,
                                          DatabaseEntry data, DatabaseEntry result) {
            EntryRecord rec = BINDING.entryToObject(data);
            if (rec.tag == null) {
                return false;
            }
            StringBinding.stringToEntry(rec.tag, result);
            return true;
        }
    }
}
