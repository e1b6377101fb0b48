package com.trading.assetgraph.model;

import com.trading.assetgraph.api.AssetClass;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Fixed-income instrument. When {@code issuerId} names another asset in the
 * graph, inference links the bond to its issuer.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Bond extends Asset {
    private final Double yieldToMaturity;
    private final Double couponRate;
    private final String maturityDate;
    private final String creditRating;
    private final String issuerId;

    public Bond(String id, String symbol, String name, String sector, double price, String issuerId) {
        this(id, symbol, name, sector, price, null, null, null, null, null, null, issuerId);
    }

    public Bond(String id, String symbol, String name, String sector, double price, Double marketCap,
            String currency, Double yieldToMaturity, Double couponRate, String maturityDate, String creditRating,
            String issuerId) {
        super(id, symbol, name, AssetClass.FIXED_INCOME, sector, price, marketCap, currency);
        this.yieldToMaturity = requireFinite(yieldToMaturity, "yield_to_maturity");
        this.couponRate = requireNonNegative(couponRate, "coupon_rate");
        this.maturityDate = maturityDate;
        this.creditRating = creditRating;
        this.issuerId = issuerId == null || issuerId.isBlank() ? null : issuerId;
    }

    @Override
    public String typeName() {
        return "Bond";
    }
}
