package com.trading.assetgraph.api;

/**
 * Closed set of asset classes. The wire value is what the cache snapshot and
 * the metrics distribution use as keys.
 */
public enum AssetClass {
    EQUITY("equity"),
    FIXED_INCOME("fixed_income"),
    COMMODITY("commodity"),
    CURRENCY("currency");

    private final String value;

    AssetClass(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AssetClass fromValue(String value) {
        for (AssetClass c : values()) {
            if (c.value.equals(value) || c.name().equals(value))
                return c;
        }
        throw new IllegalArgumentException("Unknown asset class: " + value);
    }
}
