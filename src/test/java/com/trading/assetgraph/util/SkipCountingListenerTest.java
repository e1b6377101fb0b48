package com.trading.assetgraph.util;

import com.trading.assetgraph.AssetGraph;
import com.trading.assetgraph.Fixtures;
import com.trading.assetgraph.api.SkipReason;

import org.junit.Test;
import static org.junit.Assert.*;

public class SkipCountingListenerTest {

    @Test
    public void testCountsResetEachRun() {
        AssetGraph g = Fixtures.smallGraph();
        g.addRegulatoryEvent(Fixtures.event("E1", "A", 0.4, "NOPE", "B"));
        SkipCountingListener skips = g.enableSkipCounting(true);

        g.buildRelationships();
        g.buildRelationships();
        assertEquals(2, skips.totalRuns());
        assertEquals(1, skips.count(SkipReason.UNKNOWN_EVENT_TARGET));
        assertEquals(0, skips.count(SkipReason.DUPLICATE));
        assertEquals(1, skips.totalSkipped());
    }

    @Test
    public void testDumpListsEveryReason() {
        SkipCountingListener skips = new SkipCountingListener();
        skips.onInferenceStart(1);
        skips.onRelationshipSkipped(1, "A", "A", "x", SkipReason.SELF_REFERENCE);
        skips.onInferenceEnd(1, 0);
        String dump = skips.dump();
        for (SkipReason r : SkipReason.values())
            assertTrue(dump.contains(r.name()));
        assertEquals(1, skips.count(SkipReason.SELF_REFERENCE));
    }
}
