package com.trading.assetgraph.viz;

import java.util.List;

/**
 * Everything a renderer needs for one view. Node lists are parallel:
 * {@code positions.get(i)}, {@code colors.get(i)} and {@code hover.get(i)}
 * describe {@code assetIds.get(i)}.
 *
 * @param placeholder true when the graph was empty and a single stand-in
 *                    node was emitted
 */
public record VisualizationData(
        String title,
        LayoutType layout,
        List<String> assetIds,
        List<Position> positions,
        List<String> colors,
        List<String> hover,
        List<RelationshipGroup> relationshipGroups,
        List<OverlayMarker> directionMarkers,
        boolean placeholder) {

    public static final String PLACEHOLDER_ID = "A";
    public static final String PLACEHOLDER_HOVER = "Asset A";

    public VisualizationData {
        assetIds = List.copyOf(assetIds);
        positions = List.copyOf(positions);
        colors = List.copyOf(colors);
        hover = List.copyOf(hover);
        relationshipGroups = List.copyOf(relationshipGroups);
        directionMarkers = List.copyOf(directionMarkers);
        if (positions.size() != assetIds.size() || colors.size() != assetIds.size()
                || hover.size() != assetIds.size())
            throw new IllegalArgumentException("Node lists must have equal length, ids=" + assetIds.size()
                    + ", positions=" + positions.size() + ", colors=" + colors.size() + ", hover=" + hover.size());
    }

    static VisualizationData placeholder(LayoutType layout) {
        return new VisualizationData(VisualizationPalette.title(0, 0), layout,
                List.of(PLACEHOLDER_ID), List.of(Position.ORIGIN),
                List.of(VisualizationPalette.DEFAULT_COLOR), List.of(PLACEHOLDER_HOVER),
                List.of(), List.of(), true);
    }

    /** Number of drawn relationship lines, one per bidirectional pair. */
    public int visibleRelationshipCount() {
        int n = 0;
        for (RelationshipGroup g : relationshipGroups)
            n += g.edges().size();
        return n;
    }
}
