package com.apisurface.signature.format;

/**
 * How overloads sharing a name are ordered relative to each other.
 */
public enum OverloadedMethodOrder {
    /**
     * Parameter count, then parameter type strings pairwise, then declaration order.
     */
    SIGNATURE,

    /**
     * Declaration order as read from source or the input file.
     */
    SOURCE;

    public String propertyValue() {
        return name().toLowerCase();
    }
}
