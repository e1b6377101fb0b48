package com.trading.assetgraph.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trading.assetgraph.api.GraphAccess;
import com.trading.assetgraph.api.ModelValidationException;
import com.trading.assetgraph.api.StructuralValidationException;
import com.trading.assetgraph.engine.NetworkMetrics;
import com.trading.assetgraph.io.GraphSnapshotCodec;
import com.trading.assetgraph.model.Equity;
import com.trading.assetgraph.util.GraphExplain;
import com.trading.assetgraph.viz.LayoutType;
import com.trading.assetgraph.viz.OverlayMarker;
import com.trading.assetgraph.viz.Position;
import com.trading.assetgraph.viz.RelationshipGroup;
import com.trading.assetgraph.viz.VisualizationData;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Request handling for the HTTP surface, kept free of any web framework so
 * it can be driven directly. Every method takes the current graph from the
 * supplier and returns a JSON (or text) body.
 */
public final class GraphApi {
    private final Supplier<GraphAccess> graph;
    private final LayoutType defaultLayout;
    private final GraphSnapshotCodec codec = new GraphSnapshotCodec();

    public GraphApi(Supplier<GraphAccess> graph, LayoutType defaultLayout) {
        this.graph = graph;
        this.defaultLayout = defaultLayout;
    }

    public String assets() {
        return codec.toTree(graph.get().snapshot()).get("assets").toString();
    }

    public String relationships() {
        return codec.toTree(graph.get().snapshot()).get("relationships").toString();
    }

    public String events() {
        return codec.toTree(graph.get().snapshot()).get("regulatory_events").toString();
    }

    public String snapshot() {
        return codec.write(graph.get().snapshot());
    }

    public String metrics() {
        return JsonSupport.toJson(graph.get().calculateMetrics());
    }

    /** Rebuilds relationships and returns the resulting metrics. */
    public String rebuild() {
        GraphAccess g = graph.get();
        g.buildRelationships();
        NetworkMetrics metrics = g.calculateMetrics();
        return JsonSupport.toJson(metrics);
    }

    public String mermaid() {
        return new GraphExplain(graph.get().snapshot()).toMermaid();
    }

    public String explainAsset(String assetId) {
        return new GraphExplain(graph.get().snapshot()).explainAsset(assetId);
    }

    /**
     * @param layout  layout name, or null for the configured default.
     * @param ids     comma-separated asset ids, or null for all.
     * @param exclude comma-separated relationship types to hide, or null.
     */
    public String visualization(String layout, String ids, String exclude) {
        GraphAccess g = graph.get();
        VisualizationData data;
        if (isBlank(layout) && isBlank(ids) && isBlank(exclude)) {
            data = g.getVisualizationData();
        } else {
            LayoutType type = isBlank(layout) ? defaultLayout : LayoutType.fromValue(layout);
            Map<String, Boolean> filters = new LinkedHashMap<>();
            for (String t : splitCsv(exclude))
                filters.put(t, Boolean.FALSE);
            data = g.getVisualizationData(isBlank(ids) ? null : splitCsv(ids), type, filters);
        }
        return visualizationTree(data).toString();
    }

    /** Node coordinates of the default 3D view. */
    public String layout3d() {
        VisualizationData data = graph.get().getVisualizationData();
        ObjectNode root = JsonSupport.MAPPER.createObjectNode();
        ArrayNode ids = root.putArray("asset_ids");
        data.assetIds().forEach(ids::add);
        ArrayNode positions = root.putArray("positions");
        data.positions().forEach(p -> fillPosition(positions.addArray(), p));
        ArrayNode colors = root.putArray("colors");
        data.colors().forEach(colors::add);
        ArrayNode hover = root.putArray("hover");
        data.hover().forEach(hover::add);
        return root.toString();
    }

    /**
     * Validates and adds an equity. Never throws for bad input; the result
     * message says what happened.
     */
    public String addEquityNode(String assetId, String symbol, String name, String sector, Double price) {
        try {
            if (price == null)
                throw new ModelValidationException("price is required");
            Equity equity = new Equity(assetId, symbol, name, sector, price);
            graph.get().addAsset(equity);
            return "Successfully added: " + equity.getName() + " (" + equity.getSymbol() + ")";
        } catch (IllegalArgumentException e) {
            return "Validation Error: " + e.getMessage();
        }
    }

    /** Body form of {@link #addEquityNode}, wrapped as {@code {"result": ..}}. */
    public String addEquityNode(String jsonBody) {
        JsonNode body;
        try {
            body = JsonSupport.MAPPER.readTree(jsonBody);
        } catch (JsonProcessingException e) {
            throw new StructuralValidationException("Request body must be JSON: " + e.getOriginalMessage(), e);
        }
        if (body == null || !body.isObject())
            throw new StructuralValidationException("Request body must be a JSON object");
        JsonNode price = body.get("price");
        String result = addEquityNode(text(body, "asset_id"), text(body, "symbol"), text(body, "name"),
                text(body, "sector"), price != null && price.isNumber() ? price.asDouble() : null);
        return JsonSupport.MAPPER.createObjectNode().put("result", result).toString();
    }

    ObjectNode visualizationTree(VisualizationData data) {
        ObjectNode root = JsonSupport.MAPPER.createObjectNode();
        root.put("title", data.title());
        root.put("layout", data.layout() == null ? "3d" : data.layout().value());
        root.put("placeholder", data.placeholder());

        ObjectNode nodes = root.putObject("nodes");
        ArrayNode ids = nodes.putArray("asset_ids");
        data.assetIds().forEach(ids::add);
        ArrayNode positions = nodes.putArray("positions");
        data.positions().forEach(p -> fillPosition(positions.addArray(), p));
        ArrayNode colors = nodes.putArray("colors");
        data.colors().forEach(colors::add);
        ArrayNode hover = nodes.putArray("hover");
        data.hover().forEach(hover::add);

        ArrayNode groups = root.putArray("relationship_groups");
        for (RelationshipGroup g : data.relationshipGroups()) {
            ObjectNode gn = groups.addObject();
            gn.put("type", g.type());
            gn.put("bidirectional", g.bidirectional());
            gn.put("name", g.traceName());
            gn.put("color", g.color());
            gn.put("width", g.lineWidth());
            gn.put("dash", g.lineDash());
            ArrayNode edges = gn.putArray("edges");
            for (RelationshipGroup.GroupedEdge e : g.edges()) {
                edges.addObject().put("source", e.source()).put("target", e.target()).put("strength", e.strength());
            }
            ArrayNode gh = gn.putArray("hover");
            g.hoverTexts().forEach(gh::add);
        }

        ArrayNode markers = root.putArray("direction_markers");
        for (OverlayMarker m : data.directionMarkers()) {
            ObjectNode mn = markers.addObject();
            mn.put("source", m.source());
            mn.put("target", m.target());
            mn.put("type", m.type());
            fillPosition(mn.putArray("position"), m.position());
            mn.put("hover", m.hover());
        }
        return root;
    }

    private static void fillPosition(ArrayNode arr, Position p) {
        arr.add(p.x()).add(p.y()).add(p.z());
    }

    private static String text(JsonNode body, String field) {
        JsonNode v = body.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    static List<String> splitCsv(String csv) {
        List<String> out = new ArrayList<>();
        if (csv == null)
            return out;
        Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(out::add);
        return out;
    }
}
