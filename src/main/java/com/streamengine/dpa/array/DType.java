package com.streamengine.dpa.array;

/**
 * Element type of an {@link NdArray}.
 *
 * Tags follow the numpy array-protocol notation so that encoded results can be
 * rebuilt by clients without a lookup table ({@code <f8}, {@code <i4}, ...).
 * Text arrays carry their maximum element length in the tag ({@code <U12}).
 */
public enum DType {
    INT8("|i1", Storage.LONG),
    INT16("<i2", Storage.LONG),
    INT32("<i4", Storage.LONG),
    INT64("<i8", Storage.LONG),
    UINT8("|u1", Storage.LONG),
    UINT16("<u2", Storage.LONG),
    UINT32("<u4", Storage.LONG),
    UINT64("<u8", Storage.LONG),
    FLOAT32("<f4", Storage.DOUBLE),
    FLOAT64("<f8", Storage.DOUBLE),
    STRING("<U", Storage.TEXT),
    OPAQUE("|O", Storage.TEXT);

    /** Backing array kind used by {@link NdArray}. */
    public enum Storage {
        LONG, DOUBLE, TEXT
    }

    private final String tag;
    private final Storage storage;

    DType(String tag, Storage storage) {
        this.tag = tag;
        this.storage = storage;
    }

    public String tag() {
        return tag;
    }

    public Storage storage() {
        return storage;
    }

    public boolean isNumeric() {
        return storage != Storage.TEXT;
    }

    public boolean isInteger() {
        return storage == Storage.LONG;
    }

    public static DType fromTag(String tag) {
        if (tag == null || tag.isEmpty())
            throw new IllegalArgumentException("Empty dtype tag");
        if (tag.startsWith("<U") || tag.startsWith("|S") || tag.startsWith("|U"))
            return STRING;
        for (DType t : values()) {
            if (t.tag.equals(tag))
                return t;
        }
        // numpy reports single-byte types with either byte-order marker
        String swapped = tag.charAt(0) == '|' ? "<" + tag.substring(1) : "|" + tag.substring(1);
        for (DType t : values()) {
            if (t.tag.equals(swapped))
                return t;
        }
        throw new IllegalArgumentException("Unknown dtype tag: " + tag);
    }
}
