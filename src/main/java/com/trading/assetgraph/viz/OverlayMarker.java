package com.trading.assetgraph.viz;

/** Direction marker placed along a one-way edge. */
public record OverlayMarker(String source, String target, String type, Position position, String hover) {
}
