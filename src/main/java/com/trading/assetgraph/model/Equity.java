package com.trading.assetgraph.model;

import com.trading.assetgraph.api.AssetClass;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Equity extends Asset {
    private final Double peRatio;
    private final Double dividendYield;
    private final Double earningsPerShare;
    private final Double bookValue;

    public Equity(String id, String symbol, String name, String sector, double price) {
        this(id, symbol, name, sector, price, null, null, null, null, null, null);
    }

    public Equity(String id, String symbol, String name, String sector, double price, Double marketCap,
            String currency, Double peRatio, Double dividendYield, Double earningsPerShare, Double bookValue) {
        super(id, symbol, name, AssetClass.EQUITY, sector, price, marketCap, currency);
        this.peRatio = requireFinite(peRatio, "pe_ratio");
        this.dividendYield = requireNonNegative(dividendYield, "dividend_yield");
        this.earningsPerShare = requireFinite(earningsPerShare, "earnings_per_share");
        this.bookValue = requireFinite(bookValue, "book_value");
    }

    @Override
    public String typeName() {
        return "Equity";
    }
}
