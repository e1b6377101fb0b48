package com.trading.assetgraph.io;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trading.assetgraph.AssetGraph;
import com.trading.assetgraph.Fixtures;
import com.trading.assetgraph.api.StructuralValidationException;
import com.trading.assetgraph.model.Relationship;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class GraphSnapshotCodecTest {
    private final GraphSnapshotCodec codec = new GraphSnapshotCodec();

    private static AssetGraph sample() {
        AssetGraph g = new AssetGraph();
        SampleDataset.populate(g);
        return g;
    }

    @Test
    public void testRoundTripPreservesModel() {
        GraphSnapshot original = sample().snapshot();
        GraphSnapshot read = codec.read(codec.write(original));
        assertEquals(original.assets(), read.assets());
        assertEquals(original.regulatoryEvents(), read.regulatoryEvents());
        assertEquals(original.relationships(), read.relationships());
    }

    @Test
    public void testTypeTagsAndIncoming() {
        AssetGraph g = Fixtures.smallGraph();
        g.buildRelationships();
        ObjectNode tree = codec.toTree(g.snapshot());
        assertEquals("Equity", tree.get("assets").get(0).get("__type__").asText());
        assertEquals("Bond", tree.get("assets").get(3).get("__type__").asText());
        assertEquals("equity", tree.get("assets").get(0).get("asset_class").asText());
        assertEquals("A", tree.get("assets").get(3).get("issuer_id").asText());
        // A receives B→A and D→A
        assertEquals(2, tree.get("incoming_relationships").get("A").size());
        assertEquals("D", tree.get("incoming_relationships").get("A").get(1).get("source").asText());
    }

    @Test
    public void testPopulateRestoresStoreWithoutRebuild() {
        AssetGraph source = Fixtures.smallGraph();
        source.addRelationship("C", "A", "manual", 0.3, false);
        GraphSnapshot snap = codec.read(codec.write(source.snapshot()));

        AssetGraph target = new AssetGraph();
        GraphSnapshotCodec.populate(snap, target);
        assertEquals(List.of(new Relationship("A", "manual", 0.3)), target.getRelationships().get("C"));
        assertEquals(0, target.rebuildCount());
    }

    @Test
    public void testMissingSectionsAreEmpty() {
        GraphSnapshot snap = codec.read("{}");
        assertTrue(snap.assets().isEmpty());
        assertTrue(snap.regulatoryEvents().isEmpty());
        assertTrue(snap.relationships().isEmpty());
    }

    @Test(expected = StructuralValidationException.class)
    public void testMalformedJson() {
        codec.read("{\"assets\": [");
    }

    @Test(expected = StructuralValidationException.class)
    public void testUnknownTypeTag() {
        codec.read("{\"assets\":[{\"id\":\"X\",\"symbol\":\"X\",\"name\":\"X\",\"price\":1.0,"
                + "\"__type__\":\"Option\"}]}");
    }

    @Test(expected = StructuralValidationException.class)
    public void testNonNumericStrength() {
        codec.read("{\"relationships\":{\"A\":[{\"target\":\"B\",\"relationship_type\":\"x\",\"strength\":\"hi\"}]}}");
    }

    @Test(expected = StructuralValidationException.class)
    public void testRelationshipsNotAList() {
        codec.read("{\"relationships\":{\"A\":{}}}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidAssetValues() {
        codec.read("{\"assets\":[{\"id\":\"X\",\"symbol\":\"X\",\"name\":\"X\",\"price\":-1.0,"
                + "\"__type__\":\"Equity\"}]}");
    }
}
