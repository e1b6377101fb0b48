package com.trading.assetgraph.model;

import com.trading.assetgraph.api.AssetClass;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Commodity extends Asset {
    private final Double contractSize;
    private final String deliveryDate;
    private final Double volatility;

    public Commodity(String id, String symbol, String name, String sector, double price) {
        this(id, symbol, name, sector, price, null, null, null, null, null);
    }

    public Commodity(String id, String symbol, String name, String sector, double price, Double marketCap,
            String currency, Double contractSize, String deliveryDate, Double volatility) {
        super(id, symbol, name, AssetClass.COMMODITY, sector, price, marketCap, currency);
        this.contractSize = requireNonNegative(contractSize, "contract_size");
        this.deliveryDate = deliveryDate;
        this.volatility = requireNonNegative(volatility, "volatility");
    }

    @Override
    public String typeName() {
        return "Commodity";
    }
}
