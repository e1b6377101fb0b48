package com.trading.assetgraph.viz;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Emits a marker at 70% of the way from source to target for every indexed
 * edge whose same-typed reverse is absent.
 */
public final class DirectionalOverlayEngine {
    public static final double MARKER_FRACTION = 0.7;

    public List<OverlayMarker> overlay(VisualizationIndex index, Map<String, Position> positions) {
        List<OverlayMarker> markers = new ArrayList<>();
        for (EdgeKey key : index.edges().keySet()) {
            if (index.isBidirectional(key))
                continue;
            Position src = positions.get(key.source());
            Position tgt = positions.get(key.target());
            if (src == null || tgt == null)
                throw new IllegalArgumentException("No position for edge " + key);
            markers.add(new OverlayMarker(key.source(), key.target(), key.type(),
                    src.towards(tgt, MARKER_FRACTION),
                    VisualizationPalette.directionHover(key.source(), key.target(), key.type())));
        }
        return markers;
    }
}
