package com.trading.assetgraph.viz;

import com.trading.assetgraph.AssetGraph;
import com.trading.assetgraph.Fixtures;
import com.trading.assetgraph.api.StructuralValidationException;

import java.util.List;
import java.util.Map;

import org.junit.Test;
import static org.junit.Assert.*;

public class VisualizationPipelineTest {
    private static final double EPS = 1e-9;

    private static AssetGraph built() {
        AssetGraph g = Fixtures.smallGraph();
        g.buildRelationships();
        return g;
    }

    @Test
    public void testEmptyGraphPlaceholder() {
        VisualizationData data = new AssetGraph().getVisualizationData();
        assertTrue(data.placeholder());
        assertEquals(List.of("A"), data.assetIds());
        assertEquals(List.of(Position.ORIGIN), data.positions());
        assertEquals(List.of("Asset A"), data.hover());
        assertTrue(data.relationshipGroups().isEmpty());
        assertEquals("Financial Asset Network - 0 Assets, 0 Relationships", data.title());
    }

    @Test
    public void testDefaultView() {
        VisualizationData data = built().getVisualizationData();
        assertFalse(data.placeholder());
        assertNull(data.layout());
        assertEquals(List.of("A", "B", "C", "D"), data.assetIds());
        assertEquals("Financial Asset Network - 4 Assets, 2 Relationships", data.title());
        assertEquals(2, data.visibleRelationshipCount());
        assertEquals("Asset C", data.hover().get(2));
        assertEquals(VisualizationPalette.NODE_COLOR, data.colors().get(0));
        assertEquals(2, data.relationshipGroups().size());
        assertEquals(1, data.directionMarkers().size());

        // D sits at 3π/2 on the unit circle, A at angle 0.
        Position marker = data.directionMarkers().get(0).position();
        assertEquals(0.7, marker.x(), EPS);
        assertEquals(-0.3, marker.y(), EPS);
    }

    @Test
    public void testFilteredSubsetOnGrid() {
        VisualizationData data = built().getVisualizationData(List.of("B", "A"), LayoutType.GRID,
                Map.of("same_sector", false));
        assertEquals(LayoutType.GRID, data.layout());
        assertEquals(List.of("B", "A"), data.assetIds());
        assertEquals(Position.of(0, 0), data.positions().get(0));
        assertEquals(Position.of(1, 0), data.positions().get(1));
        assertTrue(data.relationshipGroups().isEmpty());
        assertTrue(data.directionMarkers().isEmpty());
        assertEquals("Financial Asset Network - 2 Assets, 0 Relationships", data.title());
    }

    @Test
    public void testFilterRemovesDirectionMarkers() {
        VisualizationData data = built().getVisualizationData(null, LayoutType.CIRCULAR,
                Map.of("corporate_link", false));
        assertEquals(1, data.relationshipGroups().size());
        assertTrue(data.directionMarkers().isEmpty());
    }

    @Test
    public void testSpringDropsUnknownIds() {
        VisualizationData data = built().getVisualizationData(List.of("A", "X"), LayoutType.SPRING, null);
        assertEquals(List.of("A"), data.assetIds());
    }

    @Test
    public void testSpringMatchesReferenceProjection() {
        AssetGraph g = built();
        VisualizationData full = g.getVisualizationData();
        VisualizationData spring = g.getVisualizationData(List.of("C"), LayoutType.SPRING, null);
        assertEquals(full.positions().get(2).x(), spring.positions().get(0).x(), EPS);
        assertEquals(full.positions().get(2).y(), spring.positions().get(0).y(), EPS);
    }

    @Test(expected = StructuralValidationException.class)
    public void testDuplicateRequestedIds() {
        built().getVisualizationData(List.of("A", "A"), LayoutType.GRID, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParallelListsEnforced() {
        new VisualizationData("t", null, List.of("A"), List.of(), List.of(), List.of(), List.of(), List.of(),
                false);
    }
}
