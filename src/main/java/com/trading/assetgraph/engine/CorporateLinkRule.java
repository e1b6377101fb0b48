package com.trading.assetgraph.engine;

import com.trading.assetgraph.api.RelationshipRule;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.Bond;
import com.trading.assetgraph.model.RelationshipTypes;

/**
 * Links a bond to the asset named by its issuer id. Directed from the bond
 * to the issuer. Evaluated for both orderings of a pair.
 */
public final class CorporateLinkRule implements RelationshipRule {

    @Override
    public String type() {
        return RelationshipTypes.CORPORATE_LINK;
    }

    @Override
    public void evaluate(Asset first, Asset second, Sink sink) {
        linkIfIssuer(first, second, sink);
        linkIfIssuer(second, first, sink);
    }

    private static void linkIfIssuer(Asset bond, Asset issuer, Sink sink) {
        if (bond instanceof Bond b && issuer.getId().equals(b.getIssuerId())) {
            sink.link(b.getId(), issuer.getId(), RelationshipTypes.CORPORATE_LINK_STRENGTH, false);
        }
    }
}
