package shardcache.persistence;

/**
 * A value ready to be written to a shard: its mode and either the inline payload or the name of
 * an already placed blob file.
 */
public class StagedValue {
    private final ValueMode mode;
    private final byte[] inline;
    private final String blobName;
    private final long size;
    private final BlobArea blobs;

    private StagedValue(ValueMode mode, byte[] inline, String blobName, long size, BlobArea blobs) {
        this.mode = mode;
        this.inline = inline;
        this.blobName = blobName;
        this.size = size;
        this.blobs = blobs;
    }

    public static StagedValue inline(ValueMode mode, byte[] payload) {
        return new StagedValue(mode, payload, null, payload.length, null);
    }

    public static StagedValue blob(ValueMode mode, String blobName, long size, BlobArea blobs) {
        return new StagedValue(mode, null, blobName, size, blobs);
    }

    public ValueMode getMode() {
        return mode;
    }

    /** The payload for inline values, null for blobs. */
    public byte[] getInline() {
        return inline;
    }

    /** Blob file name relative to the blob area, null for inline values. */
    public String getBlobName() {
        return blobName;
    }

    public boolean isBlob() {
        return blobName != null;
    }

    public long getSize() {
        return size;
    }

    /** Deletes the placed blob file of a value that was never committed. */
    public void discard() {
        if (blobName != null) {
            blobs.release(blobName);
        }
    }
}
