package com.trading.assetgraph.model;

import com.trading.assetgraph.api.AssetClass;
import com.trading.assetgraph.api.ModelValidationException;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A financial instrument record.
 *
 * Instances are immutable and validated at construction: a record that
 * exists always has a non-blank id, symbol and name and a strictly positive
 * price. Class-specific attributes live on the subclasses.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Asset {
    /** Sector sentinel that never produces a same-sector link. */
    public static final String UNKNOWN_SECTOR = "Unknown";
    public static final String DEFAULT_CURRENCY = "USD";

    private final String id;
    private final String symbol;
    private final String name;
    private final AssetClass assetClass;
    private final String sector;
    private final double price;
    private final Double marketCap;
    private final String currency;

    public Asset(String id, String symbol, String name, AssetClass assetClass, String sector, double price,
            Double marketCap, String currency) {
        this.id = requireNonBlank(id, "id");
        this.symbol = requireNonBlank(symbol, "symbol");
        this.name = requireNonBlank(name, "name");
        if (assetClass == null)
            throw new ModelValidationException("asset_class is required for asset " + id);
        this.assetClass = assetClass;
        this.sector = sector == null || sector.isBlank() ? UNKNOWN_SECTOR : sector;
        if (!Double.isFinite(price) || price <= 0.0)
            throw new ModelValidationException("price must be a positive number for asset " + id + ", got " + price);
        this.price = price;
        this.marketCap = requireNonNegative(marketCap, "market_cap");
        this.currency = currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency;
    }

    /** Type tag used by the cache snapshot, e.g. {@code "Equity"}. */
    public String typeName() {
        return "Asset";
    }

    static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank())
            throw new ModelValidationException(field + " must be a non-empty string");
        return value;
    }

    static Double requireNonNegative(Double value, String field) {
        if (value == null)
            return null;
        if (!Double.isFinite(value) || value < 0.0)
            throw new ModelValidationException(field + " must be a non-negative number, got " + value);
        return value;
    }

    static Double requireFinite(Double value, String field) {
        if (value != null && !Double.isFinite(value))
            throw new ModelValidationException(field + " must be finite, got " + value);
        return value;
    }
}
