package com.rastertopo.server.contour;

import java.util.Locale;

public enum ContourRetrieval {
    /** Full outer/hole hierarchy. */
    TREE,
    /** Every contour directly under the root, no nesting. */
    LIST,
    /** Only the outermost outer borders. */
    EXTERNAL;

    public static ContourRetrieval parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return TREE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown contour retrieval '" + value + "', expected tree, list or external", e);
        }
    }
}
