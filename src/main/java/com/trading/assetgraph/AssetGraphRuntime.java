package com.trading.assetgraph;

import com.trading.assetgraph.api.GraphAccess;
import com.trading.assetgraph.api.RelationshipRule;
import com.trading.assetgraph.concurrent.SynchronizedAssetGraph;
import com.trading.assetgraph.engine.RuleRegistry;
import com.trading.assetgraph.io.AssetGraphConfig;
import com.trading.assetgraph.io.AssetGraphLoader;
import com.trading.assetgraph.io.GraphCache;
import com.trading.assetgraph.util.SkipCountingListener;
import com.trading.assetgraph.web.AssetGraphServer;
import com.trading.assetgraph.web.GraphApi;

import java.nio.file.Path;
import java.util.List;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Owns the shared, guarded graph handle for an application.
 *
 * <p>
 * Lifecycle: {@link #init()} loads the graph (cache or sample dataset) and
 * wraps it in a {@link SynchronizedAssetGraph}; {@link #reset()} loads a
 * fresh graph and swaps it in only once loading succeeded; {@link #close()} stops the server and releases the graph.
 * Components that need the graph receive {@link #graph()} or a supplier of
 * it, never a global.
 */
@Log4j2
@Getter
public final class AssetGraphRuntime implements AutoCloseable {
    private final AssetGraphConfig config;
    private final List<RelationshipRule> rules;

    private volatile SynchronizedAssetGraph guarded;
    private volatile AssetGraphLoader.Source loadSource;
    private SkipCountingListener skipListener;
    @Getter(AccessLevel.NONE)
    private SkipCountingListener pendingSkipListener;
    private AssetGraphServer server;

    public AssetGraphRuntime(AssetGraphConfig config) {
        this(config, new RuleRegistry());
    }

    public AssetGraphRuntime(AssetGraphConfig config, RuleRegistry registry) {
        this.config = config;
        this.rules = registry.createAll(config.getRules());
    }

    /** Loads the graph. Calling it again on a live runtime is an error. */
    public synchronized AssetGraphRuntime init() {
        if (guarded != null)
            throw new IllegalStateException("Runtime already initialized, use reset()");
        return swapIn(load());
    }

    /**
     * Replaces the current graph with a freshly loaded one. If loading fails
     * the exception propagates and the previous graph stays live.
     */
    public synchronized AssetGraphRuntime reset() {
        return swapIn(load());
    }

    private AssetGraphLoader.Loaded load() {
        GraphCache cache = config.getCachePath() == null ? null : new GraphCache(Path.of(config.getCachePath()));
        return new AssetGraphLoader(cache, this::newGraph).load();
    }

    private AssetGraphRuntime swapIn(AssetGraphLoader.Loaded loaded) {
        SynchronizedAssetGraph next = new SynchronizedAssetGraph(loaded.graph());
        this.loadSource = loaded.source();
        this.skipListener = pendingSkipListener;
        this.guarded = next;
        log.info("Asset graph ready from {}: {} assets", loadSource, next.getAssets().size());
        return this;
    }

    /**
     * @throws IllegalStateException before {@link #init()} or after
     *                               {@link #close()}.
     */
    public GraphAccess graph() {
        SynchronizedAssetGraph g = guarded;
        if (g == null)
            throw new IllegalStateException("Runtime not initialized");
        return g;
    }

    /** Boots the HTTP/WebSocket server over this runtime's graph. */
    public synchronized AssetGraphRuntime enableServer(int port) {
        if (server == null) {
            server = new AssetGraphServer(new GraphApi(this::graph, config.layoutType()));
            server.start(port);
        }
        return this;
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop();
            server = null;
        }
        guarded = null;
    }

    private AssetGraph newGraph() {
        AssetGraph graph = new AssetGraph(rules);
        if (config.isLogSkips())
            pendingSkipListener = graph.enableSkipCounting(true);
        return graph;
    }
}
