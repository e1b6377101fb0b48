package com.trading.assetgraph.engine;

import com.trading.assetgraph.api.RelationshipRule;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class RuleRegistryTest {

    @Test
    public void testBuiltInsResolveInOrder() {
        List<RelationshipRule> rules = new RuleRegistry().createAll(List.of("corporate_link", "same_sector"));
        assertTrue(rules.get(0) instanceof CorporateLinkRule);
        assertTrue(rules.get(1) instanceof SameSectorRule);
    }

    @Test
    public void testDefaults() {
        List<RelationshipRule> rules = new RuleRegistry().defaults();
        assertEquals("same_sector", rules.get(0).type());
        assertEquals("corporate_link", rules.get(1).type());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownRuleRejected() {
        new RuleRegistry().create("market_cap_similar");
    }

    @Test
    public void testCustomRegistration() {
        RuleRegistry registry = new RuleRegistry().registerFactory("noop", () -> new RelationshipRule() {
            @Override
            public String type() {
                return "noop";
            }

            @Override
            public void evaluate(com.trading.assetgraph.model.Asset first, com.trading.assetgraph.model.Asset second,
                    Sink sink) {
            }
        });
        assertTrue(registry.isRegistered("noop"));
        assertEquals("noop", registry.create("noop").type());
    }
}
