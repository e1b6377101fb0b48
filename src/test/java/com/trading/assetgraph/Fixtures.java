package com.trading.assetgraph;

import com.trading.assetgraph.api.RegulatoryActivity;
import com.trading.assetgraph.model.Bond;
import com.trading.assetgraph.model.Equity;
import com.trading.assetgraph.model.RegulatoryEvent;

import java.util.List;

/** Small graphs shared by tests. */
public final class Fixtures {
    private Fixtures() {
    }

    public static Equity equity(String id, String sector) {
        return new Equity(id, id, id + " Corp", sector, 100.0);
    }

    public static Bond bond(String id, String issuerId) {
        return new Bond(id, id, id + " Notes", null, 98.5, issuerId);
    }

    public static RegulatoryEvent event(String id, String assetId, double impact, String... related) {
        return new RegulatoryEvent(id, assetId, RegulatoryActivity.EARNINGS_REPORT, "2024-11-01", "test event",
                impact, List.of(related));
    }

    /**
     * A and B share Technology, C is Energy, D is a bond issued by A.
     * Rebuilt, the store holds A→B and B→A (same_sector) and D→A
     * (corporate_link).
     */
    public static AssetGraph smallGraph() {
        AssetGraph g = new AssetGraph();
        g.addAsset(equity("A", "Technology"));
        g.addAsset(equity("B", "Technology"));
        g.addAsset(equity("C", "Energy"));
        g.addAsset(bond("D", "A"));
        return g;
    }
}
