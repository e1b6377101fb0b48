package com.trading.assetgraph.concurrent;

import com.trading.assetgraph.api.GraphAccess;
import com.trading.assetgraph.engine.NetworkMetrics;
import com.trading.assetgraph.io.GraphSnapshot;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.RegulatoryEvent;
import com.trading.assetgraph.model.Relationship;
import com.trading.assetgraph.viz.LayoutType;
import com.trading.assetgraph.viz.VisualizationData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Serializes every operation on a wrapped graph behind one reentrant lock.
 *
 * <p>
 * Collection accessors return fresh copies made while the lock is held, so a
 * caller can mutate or iterate them freely without affecting the graph or
 * racing a rebuild. Asset, event and relationship records are immutable and
 * shared.
 *
 * <p>
 * Callers never see the wrapped instance; the set of operations is fixed by
 * {@link GraphAccess}.
 */
public final class SynchronizedAssetGraph implements GraphAccess {
    private final GraphAccess delegate;
    private final ReentrantLock lock = new ReentrantLock();

    public SynchronizedAssetGraph(GraphAccess delegate) {
        if (delegate == null)
            throw new IllegalArgumentException("delegate must not be null");
        if (delegate instanceof SynchronizedAssetGraph)
            throw new IllegalArgumentException("graph is already guarded");
        this.delegate = delegate;
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void lockedRun(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Asset> getAssets() {
        return locked(() -> new LinkedHashMap<>(delegate.getAssets()));
    }

    @Override
    public Map<String, List<Relationship>> getRelationships() {
        return locked(() -> {
            Map<String, List<Relationship>> copy = new LinkedHashMap<>();
            delegate.getRelationships().forEach((k, v) -> copy.put(k, new ArrayList<>(v)));
            return copy;
        });
    }

    @Override
    public List<RegulatoryEvent> getRegulatoryEvents() {
        return locked(() -> new ArrayList<>(delegate.getRegulatoryEvents()));
    }

    @Override
    public void addAsset(Asset asset) {
        lockedRun(() -> delegate.addAsset(asset));
    }

    @Override
    public void addRegulatoryEvent(RegulatoryEvent event) {
        lockedRun(() -> delegate.addRegulatoryEvent(event));
    }

    @Override
    public boolean addRelationship(String source, String target, String type, double strength,
            boolean bidirectional) {
        return locked(() -> delegate.addRelationship(source, target, type, strength, bidirectional));
    }

    @Override
    public void buildRelationships() {
        lockedRun(delegate::buildRelationships);
    }

    @Override
    public NetworkMetrics calculateMetrics() {
        return locked(delegate::calculateMetrics);
    }

    @Override
    public VisualizationData getVisualizationData() {
        return locked(() -> delegate.getVisualizationData());
    }

    @Override
    public VisualizationData getVisualizationData(List<String> idOrder, LayoutType layout,
            Map<String, Boolean> filters) {
        List<String> ids = idOrder == null ? null : new ArrayList<>(idOrder);
        Map<String, Boolean> f = filters == null ? null : new LinkedHashMap<>(filters);
        return locked(() -> delegate.getVisualizationData(ids, layout, f));
    }

    @Override
    public GraphSnapshot snapshot() {
        return locked(delegate::snapshot);
    }

    /**
     * Runs {@code action} against the wrapped graph while holding the lock.
     * Used for compound operations (add then rebuild) that must not
     * interleave with other callers.
     */
    public <T> T atomically(Function<GraphAccess, T> action) {
        return locked(() -> action.apply(delegate));
    }
}
