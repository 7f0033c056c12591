package com.streamengine.dpa.catalog;

import com.streamengine.dpa.array.DType;

/**
 * Nominal element encoding declared by the catalog for a parameter.
 *
 * This is what the catalog promises, not necessarily what a computed array
 * holds; serialized results always report the array's own {@link DType}.
 */
public enum ValueEncoding {
    INT8("int8", DType.INT8),
    INT16("int16", DType.INT16),
    INT32("int32", DType.INT32),
    INT64("int64", DType.INT64),
    UINT8("uint8", DType.UINT8),
    UINT16("uint16", DType.UINT16),
    UINT32("uint32", DType.UINT32),
    UINT64("uint64", DType.UINT64),
    FLOAT32("float32", DType.FLOAT32),
    FLOAT64("float64", DType.FLOAT64),
    STRING("str", DType.STRING),
    OPAQUE("opaque", DType.OPAQUE);

    private final String catalogName;
    private final DType dtype;

    ValueEncoding(String catalogName, DType dtype) {
        this.catalogName = catalogName;
        this.dtype = dtype;
    }

    public String catalogName() {
        return catalogName;
    }

    public DType dtype() {
        return dtype;
    }

    public boolean isNumeric() {
        return dtype.isNumeric();
    }

    public static ValueEncoding fromString(String text) {
        if (text == null)
            return OPAQUE;
        for (ValueEncoding e : values()) {
            if (e.catalogName.equalsIgnoreCase(text) || e.name().equalsIgnoreCase(text))
                return e;
        }
        if ("string".equalsIgnoreCase(text) || "text".equalsIgnoreCase(text))
            return STRING;
        throw new IllegalArgumentException("Unknown ValueEncoding: " + text);
    }
}
