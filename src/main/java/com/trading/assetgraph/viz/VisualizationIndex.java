package com.trading.assetgraph.viz;

import com.trading.assetgraph.api.StructuralValidationException;
import com.trading.assetgraph.model.Relationship;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup structures for one rendering pass.
 *
 * <p>
 * Holds the position of every requested id and a (source, target, type) to
 * strength map restricted to edges whose endpoints are both requested. The
 * edge map iterates in store traversal order.
 *
 * <p>
 * {@link #build} is the structural check for store contents. Consumers of a
 * built index can assume well-typed edges.
 */
public final class VisualizationIndex {
    private final List<String> ids;
    private final Map<String, Integer> idToPosition;
    private final Map<EdgeKey, Double> edges;

    private VisualizationIndex(List<String> ids, Map<String, Integer> idToPosition, Map<EdgeKey, Double> edges) {
        this.ids = ids;
        this.idToPosition = idToPosition;
        this.edges = edges;
    }

    /**
     * @throws StructuralValidationException if the id list contains a blank or
     *                                       repeated id, or a relationship under
     *                                       a requested source is malformed.
     */
    public static VisualizationIndex build(List<String> idOrder, Map<String, List<Relationship>> relationships) {
        Map<String, Integer> positions = requireValidIds(idOrder);
        if (relationships == null)
            throw new StructuralValidationException("relationship map must not be null");

        Map<EdgeKey, Double> edges = new LinkedHashMap<>();
        for (Map.Entry<String, List<Relationship>> e : relationships.entrySet()) {
            String source = e.getKey();
            if (!positions.containsKey(source))
                continue;
            List<Relationship> list = e.getValue();
            if (list == null)
                throw new StructuralValidationException("relationships for '" + source + "' must be a list");
            for (int i = 0; i < list.size(); i++) {
                Relationship r = list.get(i);
                if (r == null)
                    throw new StructuralValidationException(
                            "relationship at index " + i + " for '" + source + "' must not be null");
                if (r.target() == null || r.target().isBlank())
                    throw new StructuralValidationException(
                            "target id at index " + i + " for '" + source + "' must be a non-empty string");
                if (r.type() == null || r.type().isBlank())
                    throw new StructuralValidationException(
                            "relationship type at index " + i + " for '" + source + "' must be a non-empty string");
                if (!Double.isFinite(r.strength()))
                    throw new StructuralValidationException(
                            "strength at index " + i + " for '" + source + "' must be numeric, got " + r.strength());
                if (positions.containsKey(r.target()))
                    edges.put(new EdgeKey(source, r.target(), r.type()), r.strength());
            }
        }
        return new VisualizationIndex(List.copyOf(idOrder), Collections.unmodifiableMap(positions),
                Collections.unmodifiableMap(edges));
    }

    /**
     * Checks that {@code idOrder} holds distinct non-blank ids.
     *
     * @return id to index in {@code idOrder}
     */
    public static Map<String, Integer> requireValidIds(List<String> idOrder) {
        if (idOrder == null)
            throw new StructuralValidationException("asset id list must not be null");
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < idOrder.size(); i++) {
            String id = idOrder.get(i);
            if (id == null || id.isBlank())
                throw new StructuralValidationException("asset id at index " + i + " must be a non-empty string");
            if (positions.putIfAbsent(id, i) != null)
                throw new StructuralValidationException("Duplicate asset id detected: " + id);
        }
        return positions;
    }

    public List<String> ids() {
        return ids;
    }

    public int size() {
        return ids.size();
    }

    /** Index of {@code id} in the requested order. */
    public int positionOf(String id) {
        Integer idx = idToPosition.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown asset id: " + id);
        return idx;
    }

    public boolean containsAsset(String id) {
        return idToPosition.containsKey(id);
    }

    public Map<EdgeKey, Double> edges() {
        return edges;
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean containsEdge(EdgeKey key) {
        return edges.containsKey(key);
    }

    /** True when the same-typed reverse edge is indexed too. */
    public boolean isBidirectional(EdgeKey key) {
        return edges.containsKey(key.reverse());
    }
}
