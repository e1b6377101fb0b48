package com.trading.assetgraph.viz;

import com.trading.assetgraph.model.Relationship;

import java.util.List;
import java.util.Map;

import org.junit.Test;
import static org.junit.Assert.*;

public class DirectionalOverlayEngineTest {
    private final DirectionalOverlayEngine overlay = new DirectionalOverlayEngine();

    @Test
    public void testMarkerAtSeventyPercent() {
        VisualizationIndex idx = VisualizationIndex.build(List.of("S", "T"),
                Map.of("S", List.of(new Relationship("T", "x", 0.5))));
        Map<String, Position> pos = Map.of("S", new Position(0, 0, 0), "T", new Position(10, 0, 0));
        List<OverlayMarker> markers = overlay.overlay(idx, pos);
        assertEquals(1, markers.size());
        Position p = markers.get(0).position();
        assertEquals(7.0, p.x(), 1e-12);
        assertEquals(0.0, p.y(), 0.0);
        assertEquals(0.0, p.z(), 0.0);
        assertEquals("Direction: S → T<br>Type: x", markers.get(0).hover());
    }

    @Test
    public void testBidirectionalEdgesHaveNoMarker() {
        VisualizationIndex idx = VisualizationIndex.build(List.of("S", "T"),
                Map.of("S", List.of(new Relationship("T", "x", 0.5)),
                        "T", List.of(new Relationship("S", "x", 0.5))));
        Map<String, Position> pos = Map.of("S", Position.ORIGIN, "T", new Position(1, 1, 1));
        assertTrue(overlay.overlay(idx, pos).isEmpty());
    }

    @Test
    public void testReverseOfOtherTypeStillMarked() {
        VisualizationIndex idx = VisualizationIndex.build(List.of("S", "T"),
                Map.of("S", List.of(new Relationship("T", "x", 0.5)),
                        "T", List.of(new Relationship("S", "y", 0.5))));
        Map<String, Position> pos = Map.of("S", Position.ORIGIN, "T", new Position(1, 1, 1));
        assertEquals(2, overlay.overlay(idx, pos).size());
    }
}
