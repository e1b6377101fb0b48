package com.trading.assetgraph.engine;

/** One entry of the strongest-relationships list. */
public record TopRelationship(String source, String target, String relationshipType, double strength) {
}
