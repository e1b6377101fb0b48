package com.trading.assetgraph.engine;

import com.trading.assetgraph.model.Relationship;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outgoing relationship lists keyed by source id.
 * <p>
 * At most one relationship exists per (source, target, type). Sources keep
 * their first-insertion order and each list keeps append order, which makes
 * every downstream traversal deterministic.
 * <p>
 * Not thread-safe. Wrap the owning graph in a
 * {@link com.trading.assetgraph.concurrent.SynchronizedAssetGraph} for
 * shared use.
 */
public final class RelationshipStore {
    private final Map<String, List<Relationship>> bySource = new LinkedHashMap<>();

    /**
     * Appends {@code (target, type, strength)} under {@code source}.
     * The source entry is created even when the edge turns out to be a
     * duplicate.
     *
     * @return false if the source already holds an edge with the same
     *         target and type, or if source and target are equal.
     */
    public boolean add(String source, String target, String type, double strength) {
        List<Relationship> list = bySource.computeIfAbsent(source, k -> new ArrayList<>());
        if (source.equals(target))
            return false;
        for (Relationship r : list) {
            if (r.target().equals(target) && r.type().equals(type))
                return false;
        }
        list.add(new Relationship(target, type, strength));
        return true;
    }

    public boolean contains(String source, String target, String type) {
        List<Relationship> list = bySource.get(source);
        if (list == null)
            return false;
        for (Relationship r : list) {
            if (r.target().equals(target) && r.type().equals(type))
                return true;
        }
        return false;
    }

    public void clear() {
        bySource.clear();
    }

    public int totalCount() {
        int n = 0;
        for (List<Relationship> list : bySource.values())
            n += list.size();
        return n;
    }

    public List<Relationship> outgoing(String source) {
        List<Relationship> list = bySource.get(source);
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Inverted view: target id to (source, type, strength) triples, in
     * traversal order of the outgoing lists.
     */
    public Map<String, List<Relationship>> incoming() {
        Map<String, List<Relationship>> result = new LinkedHashMap<>();
        bySource.forEach((source, list) -> {
            for (Relationship r : list) {
                result.computeIfAbsent(r.target(), k -> new ArrayList<>())
                        .add(new Relationship(source, r.type(), r.strength()));
            }
        });
        return result;
    }

    /**
     * Union of {@code explicitIds} and every relationship target id. A source
     * that is neither an explicit asset nor a target does not count.
     * Iteration order is explicit ids first, then targets in store order.
     */
    public Set<String> effectiveAssetIds(Collection<String> explicitIds) {
        Set<String> ids = new LinkedHashSet<>(explicitIds);
        for (List<Relationship> list : bySource.values()) {
            for (Relationship r : list)
                ids.add(r.target());
        }
        return ids;
    }

    /** Independent copy with fresh lists. */
    public Map<String, List<Relationship>> copy() {
        Map<String, List<Relationship>> out = new LinkedHashMap<>();
        bySource.forEach((k, v) -> out.put(k, new ArrayList<>(v)));
        return out;
    }

    public boolean isEmpty() {
        return bySource.isEmpty();
    }
}
