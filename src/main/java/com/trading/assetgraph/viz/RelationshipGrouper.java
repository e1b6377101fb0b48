package com.trading.assetgraph.viz;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Buckets indexed edges by (type, bidirectional). */
public final class RelationshipGrouper {

    private record GroupKey(String type, boolean bidirectional) {
    }

    public List<RelationshipGroup> group(VisualizationIndex index) {
        return group(index, Map.of());
    }

    /**
     * @param filters types mapped to {@code false} are left out; absent types
     *                are kept.
     */
    public List<RelationshipGroup> group(VisualizationIndex index, Map<String, Boolean> filters) {
        Map<GroupKey, List<RelationshipGroup.GroupedEdge>> groups = new LinkedHashMap<>();
        Set<EdgeKey> processedPairs = new HashSet<>();

        for (Map.Entry<EdgeKey, Double> e : index.edges().entrySet()) {
            EdgeKey key = e.getKey();
            if (filters != null && Boolean.FALSE.equals(filters.get(key.type())))
                continue;

            boolean bidirectional = index.isBidirectional(key);
            if (bidirectional && !processedPairs.add(key.canonical()))
                continue;

            groups.computeIfAbsent(new GroupKey(key.type(), bidirectional), k -> new ArrayList<>())
                    .add(new RelationshipGroup.GroupedEdge(key.source(), key.target(), e.getValue()));
        }

        List<RelationshipGroup> out = new ArrayList<>(groups.size());
        groups.forEach((k, edges) -> out.add(new RelationshipGroup(k.type(), k.bidirectional(), edges)));
        return out;
    }
}
