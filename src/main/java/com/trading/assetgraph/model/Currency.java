package com.trading.assetgraph.model;

import com.trading.assetgraph.api.AssetClass;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Currency extends Asset {
    private final Double exchangeRate;
    private final String country;
    private final Double centralBankRate;

    public Currency(String id, String symbol, String name, String sector, double price) {
        this(id, symbol, name, sector, price, null, null, null, null, null);
    }

    public Currency(String id, String symbol, String name, String sector, double price, Double marketCap,
            String currency, Double exchangeRate, String country, Double centralBankRate) {
        super(id, symbol, name, AssetClass.CURRENCY, sector, price, marketCap, currency);
        this.exchangeRate = requireNonNegative(exchangeRate, "exchange_rate");
        this.country = country;
        this.centralBankRate = requireFinite(centralBankRate, "central_bank_rate");
    }

    @Override
    public String typeName() {
        return "Currency";
    }
}
