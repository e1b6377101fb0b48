package com.trading.assetgraph.api;

import com.trading.assetgraph.engine.NetworkMetrics;
import com.trading.assetgraph.io.GraphSnapshot;
import com.trading.assetgraph.model.Asset;
import com.trading.assetgraph.model.RegulatoryEvent;
import com.trading.assetgraph.model.Relationship;
import com.trading.assetgraph.viz.LayoutType;
import com.trading.assetgraph.viz.VisualizationData;

import java.util.List;
import java.util.Map;

/**
 * The fixed set of operations callers may perform on an asset graph.
 * <p>
 * Implemented directly by {@code AssetGraph} (single-threaded use) and by
 * {@code SynchronizedAssetGraph}, which serializes every call behind one lock
 * and hands out copies of internal state.
 */
public interface GraphAccess {

    Map<String, Asset> getAssets();

    Map<String, List<Relationship>> getRelationships();

    List<RegulatoryEvent> getRegulatoryEvents();

    void addAsset(Asset asset);

    void addRegulatoryEvent(RegulatoryEvent event);

    /**
     * Stores one relationship directly, and its mirror when
     * {@code bidirectional}. A duplicate (source, target, type) is ignored.
     *
     * @return true if the forward relationship was new.
     */
    boolean addRelationship(String source, String target, String type, double strength, boolean bidirectional);

    /** Clears and regenerates the relationship store from assets and events. */
    void buildRelationships();

    NetworkMetrics calculateMetrics();

    /** Default view: sorted effective asset set on the 3D circular layout. */
    VisualizationData getVisualizationData();

    /**
     * @param idOrder Asset ids to render, in position order.
     * @param layout  Coordinate assignment strategy.
     * @param filters Relationship type to enabled flag; {@code null} keeps all.
     */
    VisualizationData getVisualizationData(List<String> idOrder, LayoutType layout, Map<String, Boolean> filters);

    /** Assets, events and relationships captured together. */
    GraphSnapshot snapshot();
}
