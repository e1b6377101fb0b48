package com.trading.assetgraph.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.trading.assetgraph.AssetGraph;
import com.trading.assetgraph.Fixtures;
import com.trading.assetgraph.api.GraphAccess;
import com.trading.assetgraph.api.StructuralValidationException;
import com.trading.assetgraph.concurrent.SynchronizedAssetGraph;
import com.trading.assetgraph.viz.LayoutType;

import java.util.List;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class GraphApiTest {
    private GraphAccess graph;
    private GraphApi api;

    @Before
    public void setUp() {
        AssetGraph g = Fixtures.smallGraph();
        g.buildRelationships();
        graph = new SynchronizedAssetGraph(g);
        api = new GraphApi(() -> graph, LayoutType.CIRCULAR);
    }

    private static JsonNode parse(String json) throws Exception {
        return JsonSupport.MAPPER.readTree(json);
    }

    @Test
    public void testMetricsUseSnakeCase() throws Exception {
        JsonNode m = parse(api.metrics());
        assertEquals(4, m.get("total_assets").asInt());
        assertEquals(3, m.get("total_relationships").asInt());
        assertEquals(2, m.get("relationship_distribution").get("same_sector").asInt());
        assertEquals("corporate_link", m.get("top_relationships").get(0).get("relationship_type").asText());
        assertTrue(m.has("quality_score"));
    }

    @Test
    public void testAssetsAndRelationships() throws Exception {
        JsonNode assets = parse(api.assets());
        assertEquals(4, assets.size());
        assertEquals("A", assets.get(0).get("id").asText());
        JsonNode rels = parse(api.relationships());
        assertEquals("A", rels.get("D").get(0).get("target").asText());
        assertEquals(0, parse(api.events()).size());
    }

    @Test
    public void testDefaultVisualization() throws Exception {
        JsonNode v = parse(api.visualization(null, null, null));
        assertEquals("3d", v.get("layout").asText());
        assertFalse(v.get("placeholder").asBoolean());
        assertEquals(4, v.get("nodes").get("asset_ids").size());
        assertEquals(3, v.get("nodes").get("positions").get(0).size());
        assertEquals(2, v.get("relationship_groups").size());
        assertEquals("Same Sector (↔)", v.get("relationship_groups").get(0).get("name").asText());
        assertEquals(1, v.get("direction_markers").size());
    }

    @Test
    public void testVisualizationParameters() throws Exception {
        JsonNode v = parse(api.visualization(null, "A, B", "same_sector"));
        assertEquals("circular", v.get("layout").asText());
        assertEquals(2, v.get("nodes").get("asset_ids").size());
        assertEquals(0, v.get("relationship_groups").size());

        JsonNode grid = parse(api.visualization("grid", null, null));
        assertEquals("grid", grid.get("layout").asText());
        assertEquals(4, grid.get("nodes").get("asset_ids").size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownLayout() {
        api.visualization("force", null, null);
    }

    @Test(expected = StructuralValidationException.class)
    public void testDuplicateIds() {
        api.visualization(null, "A,A", null);
    }

    @Test
    public void testLayout3d() throws Exception {
        JsonNode l = parse(api.layout3d());
        assertEquals(List.of("A", "B", "C", "D"),
                List.of(l.get("asset_ids").get(0).asText(), l.get("asset_ids").get(1).asText(),
                        l.get("asset_ids").get(2).asText(), l.get("asset_ids").get(3).asText()));
        assertEquals(1.0, l.get("positions").get(0).get(0).asDouble(), 1e-12);
        assertEquals("Asset: A", l.get("hover").get(0).asText());
    }

    @Test
    public void testAddEquityNode() {
        assertEquals("Successfully added: Nvidia (NVDA)",
                api.addEquityNode("NVDA", "NVDA", "Nvidia", "Technology", 120.0));
        assertTrue(graph.getAssets().containsKey("NVDA"));

        String bad = api.addEquityNode("BAD", "BAD", "Bad", "Technology", -1.0);
        assertTrue(bad.startsWith("Validation Error: "));
        assertFalse(graph.getAssets().containsKey("BAD"));

        assertEquals("Validation Error: price is required", api.addEquityNode("X", "X", "X", null, null));
    }

    @Test
    public void testAddEquityNodeFromBody() throws Exception {
        JsonNode r = parse(api.addEquityNode(
                "{\"asset_id\":\"NVDA\",\"symbol\":\"NVDA\",\"name\":\"Nvidia\",\"sector\":\"Technology\",\"price\":120}"));
        assertEquals("Successfully added: Nvidia (NVDA)", r.get("result").asText());

        JsonNode rebuilt = parse(api.rebuild());
        // A, B and NVDA share Technology: 6 same-sector edges plus D→A.
        assertEquals(7, rebuilt.get("total_relationships").asInt());
    }

    @Test(expected = StructuralValidationException.class)
    public void testAddEquityNodeMalformedBody() {
        api.addEquityNode("[1,2");
    }

    @Test
    public void testTextEndpoints() {
        assertTrue(api.mermaid().startsWith("graph LR;"));
        assertTrue(api.explainAsset("A").startsWith("Asset: A"));
    }

    @Test
    public void testSplitCsv() {
        assertEquals(List.of("A", "B"), GraphApi.splitCsv(" A,,B , "));
        assertTrue(GraphApi.splitCsv(null).isEmpty());
    }

    @Test
    public void testErrorBody() throws Exception {
        assertEquals("nope", parse(JsonSupport.error("nope")).get("error").asText());
    }
}
