package com.trading.assetgraph;

import com.trading.assetgraph.api.GraphAccess;
import com.trading.assetgraph.api.InferenceListener;
import com.trading.assetgraph.api.RelationshipRule;
import com.trading.assetgraph.engine.MetricsEngine;
import com.trading.assetgraph.engine.NetworkMetrics;
import com.trading.assetgraph.engine.RelationshipInferenceEngine;
import com.trading.assetgraph.engine.RelationshipStore;
import com.trading.assetgraph.engine.RuleRegistry;
import com.trading.assetgraph.io.GraphSnapshot;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.RegulatoryEvent;
import com.trading.assetgraph.model.Relationship;
import com.trading.assetgraph.util.CompositeInferenceListener;
import com.trading.assetgraph.util.SkipCountingListener;
import com.trading.assetgraph.viz.LayoutType;
import com.trading.assetgraph.viz.VisualizationData;
import com.trading.assetgraph.viz.VisualizationPipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owner of the asset model and its derived relationship store.
 * <p>
 * This class handles:
 * <ul>
 * <li>Holding assets (by id) and regulatory events (in insertion order)</li>
 * <li>Rebuilding relationships through a {@link RelationshipInferenceEngine}</li>
 * <li>Computing {@link NetworkMetrics} and {@link VisualizationData}</li>
 * <li>Fanning inference callbacks out to registered listeners</li>
 * </ul>
 * No locking is done here. Share an instance across threads only through
 * {@link com.trading.assetgraph.concurrent.SynchronizedAssetGraph}.
 */
public class AssetGraph implements GraphAccess {
    private static final Logger log = LogManager.getLogger(AssetGraph.class);

    private final Map<String, Asset> assets = new LinkedHashMap<>();
    private final List<RegulatoryEvent> events = new ArrayList<>();
    private final RelationshipStore store = new RelationshipStore();

    private final RelationshipInferenceEngine inference;
    private final MetricsEngine metricsEngine = new MetricsEngine();
    private final VisualizationPipeline pipeline = new VisualizationPipeline();
    private final CompositeInferenceListener compositeListener = new CompositeInferenceListener();

    private long run;

    /** Graph with the default rules: same-sector then corporate-link. */
    public AssetGraph() {
        this(new RuleRegistry().defaults());
    }

    public AssetGraph(List<RelationshipRule> rules) {
        this.inference = new RelationshipInferenceEngine(rules);
    }

    /**
     * Registers a listener for rebuild callbacks. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(InferenceListener listener) {
        compositeListener.add(listener);
    }

    /** Enables counting of dropped relationships per reason. */
    public SkipCountingListener enableSkipCounting(boolean logEachSkip) {
        var counter = new SkipCountingListener(logEachSkip);
        compositeListener.add(counter);
        return counter;
    }

    public List<RelationshipRule> rules() {
        return inference.rules();
    }

    /** Number of completed or started rebuilds. */
    public long rebuildCount() {
        return run;
    }

    @Override
    public Map<String, Asset> getAssets() {
        return Collections.unmodifiableMap(assets);
    }

    @Override
    public Map<String, List<Relationship>> getRelationships() {
        return store.copy();
    }

    @Override
    public List<RegulatoryEvent> getRegulatoryEvents() {
        return Collections.unmodifiableList(events);
    }

    /** Adds or replaces the asset with the same id. */
    @Override
    public void addAsset(Asset asset) {
        if (asset == null)
            throw new IllegalArgumentException("asset must not be null");
        assets.put(asset.getId(), asset);
    }

    @Override
    public void addRegulatoryEvent(RegulatoryEvent event) {
        if (event == null)
            throw new IllegalArgumentException("event must not be null");
        events.add(event);
    }

    @Override
    public boolean addRelationship(String source, String target, String type, double strength,
            boolean bidirectional) {
        if (source == null || target == null || type == null)
            throw new IllegalArgumentException("source, target and type are required");
        boolean added = store.add(source, target, type, strength);
        if (bidirectional)
            store.add(target, source, type, strength);
        return added;
    }

    @Override
    public void buildRelationships() {
        long start = System.nanoTime();
        int count = inference.infer(assets, events, store, ++run, compositeListener);
        if (log.isInfoEnabled()) {
            log.info("Rebuilt relationships: {} assets, {} events, {} relationships in {} ms", assets.size(),
                    events.size(), count, String.format("%.3f", (System.nanoTime() - start) / 1_000_000.0));
        }
    }

    @Override
    public NetworkMetrics calculateMetrics() {
        return metricsEngine.calculate(assets, store.copy(), events);
    }

    /** Explicit asset ids plus every relationship target id. */
    public Set<String> effectiveAssetIds() {
        return store.effectiveAssetIds(assets.keySet());
    }

    @Override
    public VisualizationData getVisualizationData() {
        return pipeline.render3d(effectiveAssetIds(), store.copy());
    }

    @Override
    public VisualizationData getVisualizationData(List<String> idOrder, LayoutType layout,
            Map<String, Boolean> filters) {
        return pipeline.render(effectiveAssetIds(), store.copy(), idOrder, layout, filters);
    }

    @Override
    public GraphSnapshot snapshot() {
        return new GraphSnapshot(assets, events, store.copy());
    }
}
