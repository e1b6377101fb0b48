package com.trading.assetgraph.util;

import com.trading.assetgraph.io.GraphSnapshot;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.Bond;
import com.trading.assetgraph.model.Relationship;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a graph snapshot.
 *
 * <p>
 * Produces human-readable renderings of one asset, of the whole relationship
 * store, and a Mermaid diagram. Intended for debugging and the dashboard,
 * not for request hot paths.
 */
public final class GraphExplain {
    private final GraphSnapshot snapshot;

    public GraphExplain(GraphSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * Dumps the attributes and relationships of one asset.
     *
     * @throws IllegalArgumentException if the id is not in the snapshot.
     */
    public String explainAsset(String assetId) {
        Asset asset = snapshot.assets().get(assetId);
        if (asset == null)
            throw new IllegalArgumentException("Unknown asset: " + assetId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Asset: ").append(asset.getId()).append('\n')
                .append("  Type: ").append(asset.typeName()).append('\n')
                .append("  Symbol: ").append(asset.getSymbol()).append('\n')
                .append("  Name: ").append(asset.getName()).append('\n')
                .append("  Class: ").append(asset.getAssetClass().value()).append('\n')
                .append("  Sector: ").append(asset.getSector()).append('\n')
                .append("  Price: ").append(String.format(Locale.ROOT, "%.2f %s", asset.getPrice(),
                        asset.getCurrency()))
                .append('\n');
        if (asset instanceof Bond b && b.getIssuerId() != null)
            sb.append("  Issuer: ").append(b.getIssuerId()).append('\n');

        List<Relationship> out = snapshot.relationships().getOrDefault(assetId, List.of());
        sb.append("  Outgoing (").append(out.size()).append("): ");
        appendEdges(sb, out);
        List<Relationship> in = snapshot.incomingRelationships().getOrDefault(assetId, List.of());
        sb.append('\n').append("  Incoming (").append(in.size()).append("): ");
        appendEdges(sb, in);
        return sb.append('\n').toString();
    }

    /** Dumps every source and its outgoing relationships. */
    public String dumpRelationships() {
        StringBuilder sb = new StringBuilder(1024);
        int total = 0;
        for (List<Relationship> list : snapshot.relationships().values())
            total += list.size();
        sb.append("Graph (").append(snapshot.assets().size()).append(" assets, ").append(total)
                .append(" relationships):\n");
        for (Map.Entry<String, List<Relationship>> e : snapshot.relationships().entrySet()) {
            sb.append("  ").append(e.getKey());
            if (!e.getValue().isEmpty()) {
                sb.append(" → ");
                appendEdges(sb, e.getValue());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart with one node per asset and one labelled
     * arrow per relationship.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        List<String> ids = new ArrayList<>(snapshot.assets().keySet());
        for (Map.Entry<String, List<Relationship>> e : snapshot.relationships().entrySet()) {
            if (!ids.contains(e.getKey()))
                ids.add(e.getKey());
            for (Relationship r : e.getValue()) {
                if (!ids.contains(r.target()))
                    ids.add(r.target());
            }
        }

        for (String id : ids) {
            Asset a = snapshot.assets().get(id);
            String label = a == null ? id : a.getSymbol() + "<br/>" + a.getAssetClass().value();
            sb.append("  ").append(sanitize(id)).append("[\"").append(label).append("\"];\n");
        }

        for (Map.Entry<String, List<Relationship>> e : snapshot.relationships().entrySet()) {
            String src = sanitize(e.getKey());
            for (Relationship r : e.getValue()) {
                sb.append("  ").append(src).append(" -- \"").append(r.type())
                        .append(String.format(Locale.ROOT, " %.2f", r.strength()))
                        .append("\" --> ").append(sanitize(r.target())).append(";\n");
            }
        }
        return sb.toString();
    }

    private static void appendEdges(StringBuilder sb, List<Relationship> edges) {
        for (int i = 0; i < edges.size(); i++) {
            Relationship r = edges.get(i);
            sb.append(r.target()).append(" [").append(r.type())
                    .append(String.format(Locale.ROOT, " %.2f", r.strength())).append(']');
            if (i < edges.size() - 1)
                sb.append(", ");
        }
    }

    static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
