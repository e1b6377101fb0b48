package com.trading.assetgraph.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate figures over one graph state. Serialized with snake_case keys,
 * e.g. {@code total_assets}, {@code quality_score}.
 *
 * @param totalAssets                 size of the effective asset set
 * @param relationshipDensity         percentage of possible directed edges
 *                                    present
 * @param assetClassDistribution      counts of explicit assets only, keyed by
 *                                    asset-class wire value
 * @param topRelationships            at most ten, strongest first
 */
public record NetworkMetrics(
        int totalAssets,
        int totalRelationships,
        double averageRelationshipStrength,
        double relationshipDensity,
        Map<String, Integer> relationshipDistribution,
        Map<String, Integer> assetClassDistribution,
        List<TopRelationship> topRelationships,
        int regulatoryEventCount,
        double regulatoryEventNorm,
        double qualityScore) {

    public NetworkMetrics {
        relationshipDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(relationshipDistribution));
        assetClassDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(assetClassDistribution));
        topRelationships = List.copyOf(topRelationships);
    }

    public static NetworkMetrics empty() {
        return new NetworkMetrics(0, 0, 0.0, 0.0, Map.of(), Map.of(), List.of(), 0, 0.0, 0.0);
    }
}
