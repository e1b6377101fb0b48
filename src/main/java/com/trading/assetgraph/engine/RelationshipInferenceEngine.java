package com.trading.assetgraph.engine;

import com.trading.assetgraph.api.InferenceListener;
import com.trading.assetgraph.api.RelationshipRule;
import com.trading.assetgraph.api.SkipReason;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.RegulatoryEvent;
import com.trading.assetgraph.model.RelationshipTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Derives the relationship store from the asset map and event list.
 *
 * <p>
 * A run proceeds in two passes:
 * <ol>
 * <li>Every unordered pair of distinct assets, enumerated in ascending id
 * order, is offered to every rule in registration order before the next
 * pair is considered.</li>
 * <li>Each event whose asset is known emits one {@code event_impact} edge to
 * every known related asset, with strength {@code |impactScore|}.</li>
 * </ol>
 * Unknown event endpoints, self references and duplicate
 * (source, target, type) inserts are dropped. They are reported to the listener and nowhere else.
 */
public final class RelationshipInferenceEngine {
    private final List<RelationshipRule> rules;

    public RelationshipInferenceEngine(List<RelationshipRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<RelationshipRule> rules() {
        return rules;
    }

    /**
     * Clears {@code store} and regenerates it.
     *
     * @return number of relationships in the store after the run.
     */
    public int infer(Map<String, Asset> assets, List<RegulatoryEvent> events, RelationshipStore store, long run,
            InferenceListener listener) {
        listener.onInferenceStart(run);
        store.clear();

        List<String> ids = new ArrayList<>(assets.keySet());
        Collections.sort(ids);

        RelationshipRule.Sink[] sinks = new RelationshipRule.Sink[rules.size()];
        for (int r = 0; r < sinks.length; r++) {
            String type = rules.get(r).type();
            sinks[r] = (source, target, strength, bidirectional) -> {
                insert(store, source, target, type, strength, run, listener);
                if (bidirectional)
                    insert(store, target, source, type, strength, run, listener);
            };
        }

        for (int i = 0; i < ids.size(); i++) {
            Asset first = assets.get(ids.get(i));
            for (int j = i + 1; j < ids.size(); j++) {
                Asset second = assets.get(ids.get(j));
                for (int r = 0; r < sinks.length; r++)
                    rules.get(r).evaluate(first, second, sinks[r]);
            }
        }

        for (RegulatoryEvent event : events) {
            String source = event.getAssetId();
            if (!assets.containsKey(source)) {
                listener.onRelationshipSkipped(run, source, null, RelationshipTypes.EVENT_IMPACT,
                        SkipReason.UNKNOWN_EVENT_SOURCE);
                continue;
            }
            double strength = Math.abs(event.getImpactScore());
            for (String target : event.getRelatedAssets()) {
                if (!assets.containsKey(target)) {
                    listener.onRelationshipSkipped(run, source, target, RelationshipTypes.EVENT_IMPACT,
                            SkipReason.UNKNOWN_EVENT_TARGET);
                    continue;
                }
                insert(store, source, target, RelationshipTypes.EVENT_IMPACT, strength, run, listener);
            }
        }

        int count = store.totalCount();
        listener.onInferenceEnd(run, count);
        return count;
    }

    private static void insert(RelationshipStore store, String source, String target, String type, double strength,
            long run, InferenceListener listener) {
        if (source.equals(target)) {
            listener.onRelationshipSkipped(run, source, target, type, SkipReason.SELF_REFERENCE);
            return;
        }
        if (!store.add(source, target, type, strength))
            listener.onRelationshipSkipped(run, source, target, type, SkipReason.DUPLICATE);
    }
}
