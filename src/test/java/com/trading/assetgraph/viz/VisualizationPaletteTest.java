package com.trading.assetgraph.viz;

import org.junit.Test;
import static org.junit.Assert.*;

public class VisualizationPaletteTest {

    @Test
    public void testColors() {
        assertEquals("#FF6B6B", VisualizationPalette.colorFor("same_sector"));
        assertEquals("#FFA07A", VisualizationPalette.colorFor("regulatory_impact"));
        assertEquals(VisualizationPalette.DEFAULT_COLOR, VisualizationPalette.colorFor("event_impact"));
    }

    @Test
    public void testTraceNames() {
        assertEquals("Same Sector (↔)", VisualizationPalette.traceName("same_sector", true));
        assertEquals("Corporate Bond To Equity (→)",
                VisualizationPalette.traceName("corporate_bond_to_equity", false));
        assertEquals("Abc2Def", VisualizationPalette.titleCase("aBC2def"));
    }

    @Test
    public void testHoverText() {
        assertEquals("A → B<br>Type: x<br>Strength: 0.33",
                VisualizationPalette.edgeHover("A", "B", "x", false, 1.0 / 3));
        assertEquals("Asset: AAPL", VisualizationPalette.nodeHover("AAPL"));
    }
}
