package shardcache.persistence;

/** How a value's payload is encoded. The byte is persisted in entry rows; never renumber. */
public enum ValueMode {
    LONG((byte) 1),
    BYTES((byte) 2),
    STRING((byte) 3),
    OBJECT((byte) 4),
    INT((byte) 5),
    SHORT((byte) 6),
    BYTE((byte) 7);

    private final byte code;

    ValueMode(byte code) {
        this.code = code;
    }

    public byte getCode() {
        return code;
    }

    /** Integral modes share the 8-byte counter payload and differ only in how they read back. */
    public boolean isIntegral() {
        return this == LONG || this == INT || this == SHORT || this == BYTE;
    }

    /** Whether {@code value} can be read back in this mode without losing bits. */
    public boolean holds(long value) {
        switch (this) {
            case INT:
                return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            case SHORT:
                return value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
            case BYTE:
                return value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE;
            default:
                return this == LONG;
        }
    }

    public static ValueMode fromCode(byte code) {
        for (ValueMode m : values()) {
            if (m.code == code)
                return m;
        }
        throw new IllegalArgumentException("Unknown value mode " + code);
    }
}
