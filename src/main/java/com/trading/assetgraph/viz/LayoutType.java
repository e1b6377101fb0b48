package com.trading.assetgraph.viz;

import java.util.Locale;

public enum LayoutType {
    SPRING,
    CIRCULAR,
    GRID;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LayoutType fromValue(String value) {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException("Layout type is required");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown layout type: " + value + ", expected spring, circular or grid",
                    e);
        }
    }
}
