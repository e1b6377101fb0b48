package com.trading.assetgraph.engine;

import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.RegulatoryEvent;
import com.trading.assetgraph.model.Relationship;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Computes {@link NetworkMetrics} in one pass over the model and store. */
public final class MetricsEngine {
    public static final int TOP_N = 10;
    public static final double STRENGTH_WEIGHT = 0.7;
    public static final double EVENT_WEIGHT = 0.3;
    public static final double EVENT_SATURATION = 10.0;

    public NetworkMetrics calculate(Map<String, Asset> assets, Map<String, List<Relationship>> relationships,
            List<RegulatoryEvent> events) {
        int effectiveCount = effectiveCount(assets, relationships);

        int total = 0;
        double strengthSum = 0.0;
        Map<String, Integer> byType = new LinkedHashMap<>();
        List<TopRelationship> all = new ArrayList<>();
        for (Map.Entry<String, List<Relationship>> e : relationships.entrySet()) {
            for (Relationship r : e.getValue()) {
                total++;
                strengthSum += r.strength();
                byType.merge(r.type(), 1, Integer::sum);
                all.add(new TopRelationship(e.getKey(), r.target(), r.type(), r.strength()));
            }
        }
        double avg = total > 0 ? strengthSum / total : 0.0;
        double density = effectiveCount > 1 ? total * 100.0 / ((double) effectiveCount * (effectiveCount - 1)) : 0.0;

        Map<String, Integer> byClass = new LinkedHashMap<>();
        for (Asset a : assets.values())
            byClass.merge(a.getAssetClass().value(), 1, Integer::sum);

        // List.sort is stable, so ties keep traversal order
        all.sort(Comparator.comparingDouble(TopRelationship::strength).reversed());
        List<TopRelationship> top = all.size() > TOP_N ? all.subList(0, TOP_N) : all;

        int eventCount = events.size();
        double eventNorm = eventNorm(eventCount);
        double quality = clamp01(STRENGTH_WEIGHT * clamp01(avg) + EVENT_WEIGHT * eventNorm);

        return new NetworkMetrics(effectiveCount, total, avg, density, byType, byClass, top, eventCount, eventNorm,
                quality);
    }

    static double eventNorm(int eventCount) {
        return eventCount > 0 ? eventCount / (eventCount + EVENT_SATURATION) : 0.0;
    }

    static double clamp01(double v) {
        return v < 0.0 ? 0.0 : (v > 1.0 ? 1.0 : v);
    }

    private static int effectiveCount(Map<String, Asset> assets, Map<String, List<Relationship>> relationships) {
        Set<String> ids = new HashSet<>(assets.keySet());
        for (List<Relationship> list : relationships.values()) {
            for (Relationship r : list)
                ids.add(r.target());
        }
        return ids.size();
    }
}
