package com.trading.assetgraph.viz;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic node placement. Every layout maps each requested id to
 * exactly one position and an empty request to an empty map.
 */
public final class LayoutEngine {

    /** 3D circle in the z = 0 plane; the graph's reference layout. */
    public Map<String, Position> circular3d(List<String> ids) {
        Map<String, Position> out = new LinkedHashMap<>();
        int n = ids.size();
        for (int i = 0; i < n; i++) {
            double theta = 2.0 * Math.PI * i / n;
            out.put(ids.get(i), new Position(Math.cos(theta), Math.sin(theta), 0.0));
        }
        return out;
    }

    public Map<String, Position> circular(List<String> ids) {
        Map<String, Position> out = new LinkedHashMap<>();
        int n = ids.size();
        for (int i = 0; i < n; i++) {
            double theta = 2.0 * Math.PI * i / n;
            out.put(ids.get(i), Position.of(Math.cos(theta), Math.sin(theta)));
        }
        return out;
    }

    /** Row-major grid with {@code ceil(sqrt(n))} columns. */
    public Map<String, Position> grid(List<String> ids) {
        Map<String, Position> out = new LinkedHashMap<>();
        int n = ids.size();
        if (n == 0)
            return out;
        int cols = (int) Math.ceil(Math.sqrt(n));
        for (int i = 0; i < n; i++) {
            out.put(ids.get(i), Position.of(i % cols, i / cols));
        }
        return out;
    }

    /**
     * Projects the graph's 3D layout onto its first two coordinates. Ids the
     * reference layout does not know are dropped.
     */
    public Map<String, Position> spring(List<String> ids, Map<String, Position> reference3d) {
        Map<String, Position> out = new LinkedHashMap<>();
        for (String id : ids) {
            Position p = reference3d.get(id);
            if (p != null)
                out.put(id, Position.of(p.x(), p.y()));
        }
        return out;
    }

    public Map<String, Position> layout(LayoutType type, List<String> ids, Map<String, Position> reference3d) {
        return switch (type) {
            case CIRCULAR -> circular(ids);
            case GRID -> grid(ids);
            case SPRING -> spring(ids, reference3d);
        };
    }

    static List<String> sorted(Collection<String> ids) {
        return ids.stream().sorted().toList();
    }
}
