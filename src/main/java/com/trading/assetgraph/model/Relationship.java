package com.trading.assetgraph.model;

/**
 * One directed edge as stored under its source id: (target, type, strength).
 * A bidirectional link is two of these, one under each endpoint.
 */
public record Relationship(String target, String type, double strength) {
}
