package com.trading.assetgraph.io;

import com.trading.assetgraph.api.GraphAccess;
import com.trading.assetgraph.api.RegulatoryActivity;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.Bond;
import com.trading.assetgraph.model.Commodity;
import com.trading.assetgraph.model.Currency;
import com.trading.assetgraph.model.Equity;
import com.trading.assetgraph.model.RegulatoryEvent;

import java.util.List;

/**
 * Built-in dataset used when no cache is available: major equities, treasury
 * and corporate bond proxies, energy and metal futures, FX pairs and a few
 * recent corporate events.
 */
public final class SampleDataset {
    private SampleDataset() {
        // Utility class
    }

    public static List<Asset> assets() {
        return List.of(
                new Equity("AAPL", "AAPL", "Apple Inc.", "Technology", 227.52, 3.45e12, "USD",
                        34.6, 0.0044, 6.57, 3.77),
                new Equity("MSFT", "MSFT", "Microsoft Corporation", "Technology", 415.10, 3.09e12, "USD",
                        35.1, 0.0072, 11.80, 36.12),
                new Equity("XOM", "XOM", "Exxon Mobil Corporation", "Energy", 118.04, 5.19e11, "USD",
                        14.2, 0.0322, 8.31, 61.15),
                new Equity("JPM", "JPM", "JPMorgan Chase & Co.", "Financial Services", 221.49, 6.24e11, "USD",
                        12.3, 0.0225, 18.01, 111.29),
                new Bond("TLT", "TLT", "iShares 20+ Year Treasury Bond ETF", "Government", 92.73, null, "USD",
                        0.03, 0.025, "2035-01-01", "AAA", null),
                new Bond("LQD", "LQD", "iShares iBoxx $ Investment Grade Corporate Bond ETF", "Corporate", 108.19,
                        null, "USD", 0.03, 0.025, "2035-01-01", null, null),
                new Bond("AAPL_BOND_2030", "AAPL30", "Apple Inc. 2.2% 2030 Notes", "Technology", 91.40, null, "USD",
                        0.041, 0.022, "2030-09-11", "AA+", "AAPL"),
                new Commodity("GC_FUTURE", "GC=F", "Gold Futures", "Metals", 2652.30, null, "USD",
                        100.0, "2025-03-31", 0.20),
                new Commodity("CL_FUTURE", "CL=F", "Crude Oil Futures", "Energy", 71.24, null, "USD",
                        1000.0, "2025-03-31", 0.35),
                new Currency("EURUSD", "EUR", "Euro", "Forex", 1.0842, null, "USD", 1.0842, "EU", 0.02),
                new Currency("GBPUSD", "GBP", "British Pound", "Forex", 1.2987, null, "USD", 1.2987, "UK", 0.02),
                new Currency("JPYUSD", "JPY", "Japanese Yen", "Forex", 0.0067, null, "USD", 0.0067, "Japan", 0.02));
    }

    public static List<RegulatoryEvent> events() {
        return List.of(
                new RegulatoryEvent("AAPL_Q4_2024_REAL", "AAPL", RegulatoryActivity.EARNINGS_REPORT, "2024-11-01",
                        "Q4 2024 Earnings Report - Record iPhone sales", 0.12, List.of("TLT", "MSFT")),
                new RegulatoryEvent("MSFT_DIV_2024_REAL", "MSFT", RegulatoryActivity.DIVIDEND_ANNOUNCEMENT,
                        "2024-09-15", "Quarterly dividend increase - Cloud growth continues", 0.08,
                        List.of("AAPL", "LQD")),
                new RegulatoryEvent("XOM_SEC_2024_REAL", "XOM", RegulatoryActivity.SEC_FILING, "2024-10-01",
                        "10-K Filing - Increased oil reserves and sustainability initiatives", 0.05,
                        List.of("CL_FUTURE")));
    }

    /** Adds the sample assets and events to {@code graph} and rebuilds it. */
    public static void populate(GraphAccess graph) {
        assets().forEach(graph::addAsset);
        events().forEach(graph::addRegulatoryEvent);
        graph.buildRelationships();
    }
}
