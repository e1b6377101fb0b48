package com.trading.assetgraph.engine;

import com.trading.assetgraph.api.RelationshipRule;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.RelationshipTypes;

/** Links two assets that share a known sector, in both directions. */
public final class SameSectorRule implements RelationshipRule {

    @Override
    public String type() {
        return RelationshipTypes.SAME_SECTOR;
    }

    @Override
    public void evaluate(Asset first, Asset second, Sink sink) {
        String sector = first.getSector();
        if (Asset.UNKNOWN_SECTOR.equals(sector) || !sector.equals(second.getSector()))
            return;
        sink.link(first.getId(), second.getId(), RelationshipTypes.SAME_SECTOR_STRENGTH, true);
    }
}
