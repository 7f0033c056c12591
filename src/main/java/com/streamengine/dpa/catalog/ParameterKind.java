package com.streamengine.dpa.catalog;

/**
 * Whether a parameter is observed directly (read from the raw store) or
 * derived by a transformation function.
 */
public enum ParameterKind {
    DATA("quantity"),
    FUNCTION("function");

    private final String catalogName;

    ParameterKind(String catalogName) {
        this.catalogName = catalogName;
    }

    /** The name used for this kind in catalog definitions. */
    public String catalogName() {
        return catalogName;
    }

    public static ParameterKind fromString(String text) {
        for (ParameterKind k : values()) {
            if (k.catalogName.equalsIgnoreCase(text) || k.name().equalsIgnoreCase(text))
                return k;
        }
        throw new IllegalArgumentException("Unknown ParameterKind: " + text);
    }
}
