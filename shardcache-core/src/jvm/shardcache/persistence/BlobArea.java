package shardcache.persistence;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Files holding the payloads that are too large to live in a metadata row.
 *
 * <p>Files are written under {@code tmp/}, synced, then renamed into {@code blobs/xx/yy/}, so a
 * blob name is only ever handed out for a complete file. Open streams count as references: a
 * blob released while streams are open is unlinked when the last of them closes. Reference counts
 * are shared by every handle in this JVM.
 */
public class BlobArea {
    public static final Logger LOG = Logger.getLogger(BlobArea.class);

    public static final String BLOB_DIR = "blobs";
    public static final String TMP_DIR = "tmp";
    public static final String BLOB_SUFFIX = ".val";
    public static final long STALE_TMP_MILLIS = 1000L * 60 * 60;

    private static final Map<String, Integer> OPEN_REFS = new HashMap<String, Integer>();
    private static final Set<String> PENDING_DELETES = new HashSet<String>();

    private final File blobRoot;
    private final File tmpRoot;

    public BlobArea(String shardRoot) {
        this.blobRoot = new File(shardRoot, BLOB_DIR);
        this.tmpRoot = new File(shardRoot, TMP_DIR);
        blobRoot.mkdirs();
        tmpRoot.mkdirs();
    }

    public File getBlobRoot() {
        return blobRoot;
    }

    public File file(String name) {
        return new File(blobRoot, name);
    }

    public String write(byte[] payload) throws IOException {
        return write(new ByteArrayInputStream(payload));
    }

    /** Copies {@code in} into a new blob file and returns its name. Does not close {@code in}. */
    public String write(InputStream in) throws IOException {
        String hex = UUID.randomUUID().toString().replace("-", "");
        String name = hex.substring(0, 2) + "/" + hex.substring(2, 4) + "/" + hex.substring(4) + BLOB_SUFFIX;

        File tmp = new File(tmpRoot, hex + ".tmp");
        boolean placed = false;
        try {
            FileOutputStream out = new FileOutputStream(tmp);
            try {
                IOUtils.copyLarge(in, out);
                out.flush();
                out.getFD().sync();
            } finally {
                out.close();
            }
            File target = file(name);
            target.getParentFile().mkdirs();
            Files.move(tmp.toPath(), target.toPath(), StandardCopyOption.ATOMIC_MOVE);
            placed = true;
            return name;
        } finally {
            if (!placed && tmp.exists() && !tmp.delete()) {
                LOG.warn("Could not remove staging file " + tmp);
            }
        }
    }

    public long size(String name) {
        return file(name).length();
    }

    public byte[] read(String name) throws IOException {
        return FileUtils.readFileToByteArray(file(name));
    }

    /**
     * Opens a blob for streaming. The returned stream holds a reference until it is closed.
     */
    public InputStream open(String name) throws IOException {
        final String path = file(name).getAbsolutePath();
        acquire(path);
        try {
            return new BlobInputStream(new FileInputStream(path), path);
        } catch (IOException e) {
            unref(path);
            throw e;
        }
    }

    /**
     * Gives up the store's claim on a blob. The file is deleted now, or when the last open stream
     * on it closes.
     */
    public void release(String name) {
        String path = file(name).getAbsolutePath();
        synchronized (OPEN_REFS) {
            if (OPEN_REFS.containsKey(path)) {
                PENDING_DELETES.add(path);
                LOG.debug("Deferring delete of " + path + " until its streams close");
                return;
            }
        }
        unlink(path);
    }

    /** Deletes staging files left behind by writers that died more than an hour ago. */
    public int clearStaleTemps() {
        int removed = 0;
        File[] stale = tmpRoot.listFiles();
        if (stale == null) {
            return 0;
        }
        for (File tmp : stale) {
            if (tmp.lastModified() < System.currentTimeMillis() - STALE_TMP_MILLIS) {
                if (tmp.delete()) {
                    removed++;
                } else {
                    LOG.warn("Could not remove stale staging file " + tmp);
                }
            }
        }
        return removed;
    }

    static int openReferences(String path) {
        synchronized (OPEN_REFS) {
            Integer refs = OPEN_REFS.get(path);
            return refs == null ? 0 : refs;
        }
    }

    private static void acquire(String path) {
        synchronized (OPEN_REFS) {
            Integer refs = OPEN_REFS.get(path);
            OPEN_REFS.put(path, refs == null ? 1 : refs + 1);
        }
    }

    private static void unref(String path) {
        boolean delete = false;
        synchronized (OPEN_REFS) {
            Integer refs = OPEN_REFS.get(path);
            if (refs == null) {
                return;
            }
            if (refs > 1) {
                OPEN_REFS.put(path, refs - 1);
            } else {
                OPEN_REFS.remove(path);
                delete = PENDING_DELETES.remove(path);
            }
        }
        if (delete) {
            unlink(path);
        }
    }

    private static void unlink(String path) {
        try {
            Files.deleteIfExists(new File(path).toPath());
        } catch (IOException e) {
            // the row is already gone; an orphaned file only costs disk space
            LOG.warn("Could not delete blob " + path, e);
        }
    }

    private static class BlobInputStream extends FilterInputStream {
        private final String path;
        private boolean closed = false;

        BlobInputStream(InputStream in, String path) {
            super(in);
            this.path = path;
        }

        @Override public void close() throws IOException {
            if (closed) {
                return;
            }
            closed = true;
            try {
                super.close();
            } finally {
                unref(path);
            }
        }
    }
}
