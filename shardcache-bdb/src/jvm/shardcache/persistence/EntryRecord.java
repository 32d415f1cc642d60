package shardcache.persistence;

import com.sleepycat.bind.tuple.TupleBinding;
import com.sleepycat.bind.tuple.TupleInput;
import com.sleepycat.bind.tuple.TupleOutput;

/**
 * The metadata row of one cache entry, keyed by the UTF-8 bytes of the cache key. The payload is
 * either inline or the name of a blob file.
 */
public class EntryRecord {
    private static final byte FORMAT = 2;
    private static final byte FLAG_EXPIRES = 0x01;

    ValueMode mode;
    byte[] inline;
    String blobName;
    boolean expires = false;
    long expireTime;
    String tag;
    long size;
    long storeTime;

    public EntryRecord() {
    }

    public static EntryRecord of(StagedValue value, Long expireTime, String tag, long now) {
        EntryRecord rec = new EntryRecord();
        rec.mode = value.getMode();
        rec.inline = value.getInline();
        rec.blobName = value.getBlobName();
        rec.size = value.getSize();
        rec.setExpireTime(expireTime);
        rec.tag = tag;
        rec.storeTime = now;
        return rec;
    }

    public static EntryRecord counter(long value, long now) {
        return of(StagedValue.inline(ValueMode.LONG, ValueCodec.encodeLong(value)), null, null, now);
    }

    public boolean isExpired(long now) {
        return expires && expireTime <= now;
    }

    public boolean hasExpiry() {
        return expires;
    }

    /** Sets the absolute expire time; null means the entry never expires. */
    public void setExpireTime(Long expireTime) {
        this.expires = expireTime != null;
        this.expireTime = expireTime == null ? 0L : expireTime;
    }

    /** Expire time for callers, null when the entry never expires. */
    public Long getExpireTime() {
        return hasExpiry() ? expireTime : null;
    }

    public ValueMode getMode() {
        return mode;
    }

    public byte[] getInline() {
        return inline;
    }

    public String getBlobName() {
        return blobName;
    }

    public boolean isBlob() {
        return blobName != null;
    }

    public String getTag() {
        return tag;
    }

    public long getSize() {
        return size;
    }

    public long getStoreTime() {
        return storeTime;
    }

    public static class Binding extends TupleBinding<EntryRecord> {
        @Override public EntryRecord entryToObject(TupleInput in) {
            byte format = in.readByte();
            if (format != FORMAT) {
                throw new IllegalStateException("Unknown entry format " + format);
            }
            EntryRecord rec = new EntryRecord();
            rec.mode = ValueMode.fromCode(in.readByte());
            rec.expires = (in.readByte() & FLAG_EXPIRES) != 0;
            rec.expireTime = in.readLong();
            rec.storeTime = in.readLong();
            rec.size = in.readLong();
            rec.tag = in.readString();
            rec.blobName = in.readString();
            int len = in.readInt();
            if (len >= 0) {
                rec.inline = new byte[len];
                in.readFast(rec.inline);
            }
            return rec;
        }

        @Override public void objectToEntry(EntryRecord rec, TupleOutput out) {
            out.writeByte(FORMAT);
            out.writeByte(rec.mode.getCode());
            out.writeByte(rec.expires ? FLAG_EXPIRES : 0);
            out.writeLong(rec.expireTime);
            out.writeLong(rec.storeTime);
            out.writeLong(rec.size);
            out.writeString(rec.tag);
            out.writeString(rec.blobName);
            if (rec.inline == null) {
                out.writeInt(-1);
            } else {
                out.writeInt(rec.inline.length);
                out.writeFast(rec.inline);
            }
        }
    }
}
