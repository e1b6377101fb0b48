package com.trading.assetgraph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trading.assetgraph.api.AssetClass;
import com.trading.assetgraph.api.GraphAccess;
import com.trading.assetgraph.api.RegulatoryActivity;
import com.trading.assetgraph.api.StructuralValidationException;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.Bond;
import com.trading.assetgraph.model.Commodity;
import com.trading.assetgraph.model.Currency;
import com.trading.assetgraph.model.Equity;
import com.trading.assetgraph.model.RegulatoryEvent;
import com.trading.assetgraph.model.Relationship;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link GraphSnapshot}, shared with the on-disk cache.
 *
 * <pre>
 * {
 *   "assets": [ {"id": .., "asset_class": "equity", .., "__type__": "Equity"} ],
 *   "regulatory_events": [ {"id": .., "event_type": "sec_filing", .., "__type__": "RegulatoryEvent"} ],
 *   "relationships": { "SRC": [ {"target": .., "relationship_type": .., "strength": ..} ] },
 *   "incoming_relationships": { "TGT": [ {"source": .., "relationship_type": .., "strength": ..} ] }
 * }
 * </pre>
 *
 * {@code incoming_relationships} is derived and ignored on read.
 */
public final class GraphSnapshotCodec {
    public static final String TYPE_KEY = "__type__";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    // ── Write ──────────────────────────────────────────────────────

    public String write(GraphSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(toTree(snapshot));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph snapshot", e);
        }
    }

    public ObjectNode toTree(GraphSnapshot snapshot) {
        ObjectNode root = mapper.createObjectNode();

        ArrayNode assets = root.putArray("assets");
        for (Asset a : snapshot.assets().values())
            assets.add(assetNode(a));

        ArrayNode events = root.putArray("regulatory_events");
        for (RegulatoryEvent e : snapshot.regulatoryEvents())
            events.add(eventNode(e));

        ObjectNode rels = root.putObject("relationships");
        snapshot.relationships().forEach((source, list) -> {
            ArrayNode arr = rels.putArray(source);
            for (Relationship r : list) {
                arr.addObject().put("target", r.target()).put("relationship_type", r.type())
                        .put("strength", r.strength());
            }
        });

        ObjectNode incoming = root.putObject("incoming_relationships");
        snapshot.incomingRelationships().forEach((target, list) -> {
            ArrayNode arr = incoming.putArray(target);
            for (Relationship r : list) {
                arr.addObject().put("source", r.target()).put("relationship_type", r.type())
                        .put("strength", r.strength());
            }
        });
        return root;
    }

    private ObjectNode assetNode(Asset a) {
        ObjectNode n = mapper.createObjectNode();
        n.put("id", a.getId());
        n.put("symbol", a.getSymbol());
        n.put("name", a.getName());
        n.put("asset_class", a.getAssetClass().value());
        n.put("sector", a.getSector());
        n.put("price", a.getPrice());
        n.put("market_cap", a.getMarketCap());
        n.put("currency", a.getCurrency());
        if (a instanceof Equity e) {
            n.put("pe_ratio", e.getPeRatio());
            n.put("dividend_yield", e.getDividendYield());
            n.put("earnings_per_share", e.getEarningsPerShare());
            n.put("book_value", e.getBookValue());
        } else if (a instanceof Bond b) {
            n.put("yield_to_maturity", b.getYieldToMaturity());
            n.put("coupon_rate", b.getCouponRate());
            n.put("maturity_date", b.getMaturityDate());
            n.put("credit_rating", b.getCreditRating());
            n.put("issuer_id", b.getIssuerId());
        } else if (a instanceof Commodity c) {
            n.put("contract_size", c.getContractSize());
            n.put("delivery_date", c.getDeliveryDate());
            n.put("volatility", c.getVolatility());
        } else if (a instanceof Currency c) {
            n.put("exchange_rate", c.getExchangeRate());
            n.put("country", c.getCountry());
            n.put("central_bank_rate", c.getCentralBankRate());
        }
        n.put(TYPE_KEY, a.typeName());
        return n;
    }

    private ObjectNode eventNode(RegulatoryEvent e) {
        ObjectNode n = mapper.createObjectNode();
        n.put("id", e.getId());
        n.put("asset_id", e.getAssetId());
        n.put("event_type", e.getEventType().value());
        n.put("date", e.getDate());
        n.put("description", e.getDescription());
        n.put("impact_score", e.getImpactScore());
        ArrayNode related = n.putArray("related_assets");
        e.getRelatedAssets().forEach(related::add);
        n.put(TYPE_KEY, "RegulatoryEvent");
        return n;
    }

    // ── Read ───────────────────────────────────────────────────────

    /**
     * Parses a snapshot document.
     *
     * @throws StructuralValidationException if the document is not valid JSON
     *                                       or does not have the expected shape.
     */
    public GraphSnapshot read(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StructuralValidationException("Malformed graph snapshot: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    public GraphSnapshot fromTree(JsonNode root) {
        if (root == null || !root.isObject())
            throw new StructuralValidationException("graph snapshot must be a JSON object");

        Map<String, Asset> assets = new LinkedHashMap<>();
        for (JsonNode n : array(root, "assets")) {
            Asset a = readAsset(n);
            assets.put(a.getId(), a);
        }

        List<RegulatoryEvent> events = new ArrayList<>();
        for (JsonNode n : array(root, "regulatory_events"))
            events.add(readEvent(n));

        Map<String, List<Relationship>> rels = new LinkedHashMap<>();
        JsonNode relsNode = root.get("relationships");
        if (relsNode != null && !relsNode.isNull()) {
            if (!relsNode.isObject())
                throw new StructuralValidationException("'relationships' must be an object");
            Iterator<Map.Entry<String, JsonNode>> it = relsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isArray())
                    throw new StructuralValidationException("relationships for '" + e.getKey() + "' must be a list");
                List<Relationship> list = new ArrayList<>();
                int i = 0;
                for (JsonNode item : e.getValue()) {
                    String where = "relationship " + i++ + " of '" + e.getKey() + "'";
                    if (!item.isObject())
                        throw new StructuralValidationException(where + " must be an object");
                    list.add(new Relationship(requiredText(item, "target", where),
                            requiredText(item, "relationship_type", where), requiredNumber(item, "strength", where)));
                }
                rels.put(e.getKey(), list);
            }
        }
        return new GraphSnapshot(assets, events, rels);
    }

    /**
     * Adds every asset, event and relationship of {@code snapshot} to
     * {@code graph}. Relationships are added one-way, so duplicates in the
     * document collapse.
     */
    public static void populate(GraphSnapshot snapshot, GraphAccess graph) {
        snapshot.assets().values().forEach(graph::addAsset);
        snapshot.regulatoryEvents().forEach(graph::addRegulatoryEvent);
        snapshot.relationships().forEach((source, list) -> {
            for (Relationship r : list)
                graph.addRelationship(source, r.target(), r.type(), r.strength(), false);
        });
    }

    private Asset readAsset(JsonNode n) {
        if (!n.isObject())
            throw new StructuralValidationException("asset entries must be objects");
        String type = n.hasNonNull(TYPE_KEY) ? n.get(TYPE_KEY).asText() : "Asset";
        String id = optionalText(n, "id");
        String where = "asset '" + id + "'";
        String symbol = optionalText(n, "symbol");
        String name = optionalText(n, "name");
        String sector = optionalText(n, "sector");
        double price = requiredNumber(n, "price", where);
        Double marketCap = optionalNumber(n, "market_cap", where);
        String currency = optionalText(n, "currency");

        switch (type) {
            case "Asset":
                return new Asset(id, symbol, name, assetClass(n, where), sector, price, marketCap, currency);
            case "Equity":
                return new Equity(id, symbol, name, sector, price, marketCap, currency,
                        optionalNumber(n, "pe_ratio", where), optionalNumber(n, "dividend_yield", where),
                        optionalNumber(n, "earnings_per_share", where), optionalNumber(n, "book_value", where));
            case "Bond":
                return new Bond(id, symbol, name, sector, price, marketCap, currency,
                        optionalNumber(n, "yield_to_maturity", where), optionalNumber(n, "coupon_rate", where),
                        optionalText(n, "maturity_date"), optionalText(n, "credit_rating"),
                        optionalText(n, "issuer_id"));
            case "Commodity":
                return new Commodity(id, symbol, name, sector, price, marketCap, currency,
                        optionalNumber(n, "contract_size", where), optionalText(n, "delivery_date"),
                        optionalNumber(n, "volatility", where));
            case "Currency":
                return new Currency(id, symbol, name, sector, price, marketCap, currency,
                        optionalNumber(n, "exchange_rate", where), optionalText(n, "country"),
                        optionalNumber(n, "central_bank_rate", where));
            default:
                throw new StructuralValidationException("Unknown asset type '" + type + "' for " + where);
        }
    }

    private RegulatoryEvent readEvent(JsonNode n) {
        if (!n.isObject())
            throw new StructuralValidationException("regulatory event entries must be objects");
        String id = optionalText(n, "id");
        String where = "event '" + id + "'";
        String typeValue = requiredText(n, "event_type", where);
        RegulatoryActivity type;
        try {
            type = RegulatoryActivity.fromValue(typeValue);
        } catch (IllegalArgumentException e) {
            throw new StructuralValidationException("Unknown event_type '" + typeValue + "' for " + where, e);
        }
        List<String> related = new ArrayList<>();
        for (JsonNode r : array(n, "related_assets"))
            related.add(r.isNull() ? null : r.asText());
        return new RegulatoryEvent(id, optionalText(n, "asset_id"), type, optionalText(n, "date"),
                optionalText(n, "description"), requiredNumber(n, "impact_score", where), related);
    }

    private static AssetClass assetClass(JsonNode n, String where) {
        String value = requiredText(n, "asset_class", where);
        try {
            return AssetClass.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new StructuralValidationException("Unknown asset_class '" + value + "' for " + where, e);
        }
    }

    private static Iterable<JsonNode> array(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull())
            return List.of();
        if (!node.isArray())
            throw new StructuralValidationException("'" + field + "' must be a list");
        return node;
    }

    private static String optionalText(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull())
            return null;
        if (!v.isTextual())
            throw new StructuralValidationException("'" + field + "' must be a string");
        return v.asText();
    }

    private static String requiredText(JsonNode n, String field, String where) {
        String v = optionalText(n, field);
        if (v == null)
            throw new StructuralValidationException("Missing '" + field + "' in " + where);
        return v;
    }

    private static Double optionalNumber(JsonNode n, String field, String where) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull())
            return null;
        if (!v.isNumber())
            throw new StructuralValidationException("'" + field + "' in " + where + " must be numeric");
        return v.asDouble();
    }

    private static double requiredNumber(JsonNode n, String field, String where) {
        Double v = optionalNumber(n, field, where);
        if (v == null)
            throw new StructuralValidationException("Missing '" + field + "' in " + where);
        return v;
    }
}
