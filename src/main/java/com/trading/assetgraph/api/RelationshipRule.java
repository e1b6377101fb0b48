package com.trading.assetgraph.api;

import com.trading.assetgraph.model.Asset;

/**
 * A pairwise business rule that may link two assets.
 *
 * Rules are evaluated once for every unordered pair of distinct assets, in
 * ascending id order of the pair. A rule reports links through the supplied
 * {@link Sink}; the engine tags them with {@link #type()}.
 */
public interface RelationshipRule {

    /** Relationship type tag written for links produced by this rule. */
    String type();

    /**
     * Evaluates one pair.
     *
     * @param first  Asset with the lower id.
     * @param second Asset with the higher id.
     * @param sink   Receiver for any links the rule infers.
     */
    void evaluate(Asset first, Asset second, Sink sink);

    /** Receiver of inferred links. */
    @FunctionalInterface
    interface Sink {
        /**
         * @param sourceId      Source asset id.
         * @param targetId      Target asset id.
         * @param strength      Relationship strength.
         * @param bidirectional When true the reverse tuple is written as well.
         */
        void link(String sourceId, String targetId, double strength, boolean bidirectional);
    }
}
