package com.trading.assetgraph.viz;

import com.trading.assetgraph.model.Relationship;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Composes index, grouping, layout and direction overlay into one
 * {@link VisualizationData}.
 */
public final class VisualizationPipeline {
    private final LayoutEngine layoutEngine = new LayoutEngine();
    private final RelationshipGrouper grouper = new RelationshipGrouper();
    private final DirectionalOverlayEngine overlayEngine = new DirectionalOverlayEngine();

    /**
     * The graph's own 3D view: sorted effective ids on a circle. An empty
     * graph yields the placeholder node.
     */
    public VisualizationData render3d(Collection<String> effectiveIds, Map<String, List<Relationship>> relationships) {
        List<String> ids = LayoutEngine.sorted(effectiveIds);
        if (ids.isEmpty())
            return VisualizationData.placeholder(null);
        return assemble(null, ids, layoutEngine.circular3d(ids), relationships, Map.of());
    }

    /**
     * A 2D view of {@code idOrder} (all effective ids, sorted, when null).
     * For {@link LayoutType#SPRING} ids missing from the graph are not drawn.
     */
    public VisualizationData render(Collection<String> effectiveIds, Map<String, List<Relationship>> relationships,
            List<String> idOrder, LayoutType layout, Map<String, Boolean> filters) {
        List<String> requested = idOrder == null ? LayoutEngine.sorted(effectiveIds) : idOrder;
        VisualizationIndex.requireValidIds(requested);

        LayoutType type = layout == null ? LayoutType.SPRING : layout;
        Map<String, Position> reference = layoutEngine.circular3d(LayoutEngine.sorted(effectiveIds));
        Map<String, Position> positions = layoutEngine.layout(type, requested, reference);

        List<String> drawn = new ArrayList<>(positions.keySet());
        if (drawn.isEmpty()) {
            return new VisualizationData(VisualizationPalette.title(0, 0), type, List.of(), List.of(), List.of(),
                    List.of(), List.of(), List.of(), false);
        }
        return assemble(type, drawn, positions, relationships, filters);
    }

    private VisualizationData assemble(LayoutType type, List<String> ids, Map<String, Position> positions,
            Map<String, List<Relationship>> relationships, Map<String, Boolean> filters) {
        VisualizationIndex index = VisualizationIndex.build(ids, relationships);
        List<RelationshipGroup> groups = grouper.group(index, filters);
        List<OverlayMarker> markers = new ArrayList<>();
        for (OverlayMarker m : overlayEngine.overlay(index, positions)) {
            if (filters == null || !Boolean.FALSE.equals(filters.get(m.type())))
                markers.add(m);
        }

        List<Position> nodePositions = new ArrayList<>(ids.size());
        List<String> colors = new ArrayList<>(ids.size());
        List<String> hover = new ArrayList<>(ids.size());
        for (String id : ids) {
            nodePositions.add(positions.get(id));
            colors.add(VisualizationPalette.NODE_COLOR);
            hover.add(VisualizationPalette.nodeHover(id));
        }

        int visible = 0;
        for (RelationshipGroup g : groups)
            visible += g.edges().size();
        return new VisualizationData(VisualizationPalette.title(ids.size(), visible), type, ids, nodePositions,
                colors, hover, groups, markers, false);
    }
}
