package com.trading.assetgraph.engine;

import com.trading.assetgraph.api.RelationshipRule;
import com.trading.assetgraph.model.RelationshipTypes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Registry mapping rule names to their factories. Configuration refers to
 * rules by the relationship type they emit.
 */
public final class RuleRegistry {
    private final Map<String, Supplier<RelationshipRule>> registry = new LinkedHashMap<>();

    public RuleRegistry() {
        registerBuiltIns();
    }

    public RuleRegistry registerFactory(String name, Supplier<RelationshipRule> factory) {
        registry.put(name, factory);
        return this;
    }

    public boolean isRegistered(String name) {
        return registry.containsKey(name);
    }

    public RelationshipRule create(String name) {
        Supplier<RelationshipRule> factory = registry.get(name);
        if (factory == null)
            throw new IllegalArgumentException("Unknown relationship rule: " + name + ", known: " + registry.keySet());
        return factory.get();
    }

    /** Instantiates the named rules in the given order. */
    public List<RelationshipRule> createAll(List<String> names) {
        List<RelationshipRule> rules = new ArrayList<>(names.size());
        for (String name : names)
            rules.add(create(name));
        return rules;
    }

    /** The default pipeline: same-sector then corporate-link. */
    public List<RelationshipRule> defaults() {
        return createAll(List.of(RelationshipTypes.SAME_SECTOR, RelationshipTypes.CORPORATE_LINK));
    }

    private void registerBuiltIns() {
        registerFactory(RelationshipTypes.SAME_SECTOR, SameSectorRule::new);
        registerFactory(RelationshipTypes.CORPORATE_LINK, CorporateLinkRule::new);
    }
}
