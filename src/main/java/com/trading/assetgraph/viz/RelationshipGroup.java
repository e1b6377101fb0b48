package com.trading.assetgraph.viz;

import java.util.List;

/**
 * Indexed edges sharing one (type, bidirectional) key, in index order.
 * A bidirectional pair appears once.
 */
public record RelationshipGroup(String type, boolean bidirectional, List<GroupedEdge> edges) {

    public record GroupedEdge(String source, String target, double strength) {
    }

    public RelationshipGroup {
        edges = List.copyOf(edges);
    }

    public String color() {
        return VisualizationPalette.colorFor(type);
    }

    public int lineWidth() {
        return bidirectional ? VisualizationPalette.BIDIRECTIONAL_WIDTH : VisualizationPalette.DIRECTED_WIDTH;
    }

    public String lineDash() {
        return bidirectional ? VisualizationPalette.SOLID : VisualizationPalette.DASH;
    }

    public String traceName() {
        return VisualizationPalette.traceName(type, bidirectional);
    }

    public List<String> hoverTexts() {
        return edges.stream()
                .map(e -> VisualizationPalette.edgeHover(e.source(), e.target(), type, bidirectional, e.strength()))
                .toList();
    }
}
