package shardcache.persistence;

import shardcache.serialize.Serializer;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Turns values into payloads and back. Integral numbers become 8-byte longs tagged with their
 * original width (so counters work on values set directly and each reads back as its own type),
 * byte arrays and strings are stored raw, and everything else goes through the serializer.
 */
public class ValueCodec {
    private final Serializer serializer;
    private final int inlineSizeThreshold;

    public ValueCodec(Serializer serializer, int inlineSizeThreshold) {
        this.serializer = serializer;
        this.inlineSizeThreshold = inlineSizeThreshold;
    }

    public StagedValue stage(Object value, boolean asStream, BlobArea blobs) throws IOException {
        if (asStream) {
            InputStream in;
            if (value instanceof InputStream) {
                in = (InputStream) value;
            } else if (value instanceof byte[]) {
                in = new ByteArrayInputStream((byte[]) value);
            } else {
                throw new IllegalArgumentException("Stream writes take an InputStream or byte[], got "
                        + (value == null ? "null" : value.getClass().getName()));
            }
            String name = blobs.write(in);
            return StagedValue.blob(ValueMode.BYTES, name, blobs.size(name), blobs);
        }

        ValueMode mode = modeOf(value);
        byte[] payload = encode(mode, value);
        if (!mode.isIntegral() && payload.length > inlineSizeThreshold) {
            String name = blobs.write(payload);
            return StagedValue.blob(mode, name, payload.length, blobs);
        }
        return StagedValue.inline(mode, payload);
    }

    public static ValueMode modeOf(Object value) {
        if (value instanceof Long) {
            return ValueMode.LONG;
        } else if (value instanceof Integer) {
            return ValueMode.INT;
        } else if (value instanceof Short) {
            return ValueMode.SHORT;
        } else if (value instanceof Byte) {
            return ValueMode.BYTE;
        } else if (value instanceof byte[]) {
            return ValueMode.BYTES;
        } else if (value instanceof String) {
            return ValueMode.STRING;
        } else {
            return ValueMode.OBJECT;
        }
    }

    public byte[] encode(ValueMode mode, Object value) {
        switch (mode) {
            case LONG:
            case INT:
            case SHORT:
            case BYTE:
                return encodeLong(((Number) value).longValue());
            case BYTES:
                return (byte[]) value;
            case STRING:
                return ((String) value).getBytes(StandardCharsets.UTF_8);
            default:
                return serializer.serialize(value);
        }
    }

    public Object decode(ValueMode mode, byte[] payload) {
        switch (mode) {
            case LONG:
                return decodeLong(payload);
            case INT:
                return (int) decodeLong(payload);
            case SHORT:
                return (short) decodeLong(payload);
            case BYTE:
                return (byte) decodeLong(payload);
            case BYTES:
                return payload;
            case STRING:
                return new String(payload, StandardCharsets.UTF_8);
            default:
                return serializer.deserialize(payload);
        }
    }

    /**
     * The mode a counter of {@code mode} is written back in after reaching {@code value}: its own
     * width while the value fits, LONG once it no longer does.
     */
    public static ValueMode counterMode(ValueMode mode, long value) {
        return mode.holds(value) ? mode : ValueMode.LONG;
    }

    public static byte[] encodeLong(long value) {
        return ByteBuffer.allocate(8).putLong(value).array();
    }

    public static long decodeLong(byte[] payload) {
        if (payload.length != 8) {
            throw new IllegalStateException("Counter payload must be 8 bytes, got " + payload.length);
        }
        return ByteBuffer.wrap(payload).getLong();
    }
}
