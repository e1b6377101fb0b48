package com.trading.assetgraph.io;

import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.RegulatoryEvent;
import com.trading.assetgraph.model.Relationship;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Point-in-time copy of a graph's model and relationship store. */
public record GraphSnapshot(
        Map<String, Asset> assets,
        List<RegulatoryEvent> regulatoryEvents,
        Map<String, List<Relationship>> relationships) {

    public GraphSnapshot {
        assets = Collections.unmodifiableMap(new LinkedHashMap<>(assets));
        regulatoryEvents = List.copyOf(regulatoryEvents);
        Map<String, List<Relationship>> rels = new LinkedHashMap<>();
        relationships.forEach((k, v) -> rels.put(k, List.copyOf(v)));
        relationships = Collections.unmodifiableMap(rels);
    }

    /** Inverted relationships: target id to (source, type, strength). */
    public Map<String, List<Relationship>> incomingRelationships() {
        Map<String, List<Relationship>> out = new LinkedHashMap<>();
        relationships.forEach((source, list) -> {
            for (Relationship r : list) {
                out.computeIfAbsent(r.target(), k -> new ArrayList<>())
                        .add(new Relationship(source, r.type(), r.strength()));
            }
        });
        return out;
    }
}
