package com.trading.assetgraph.io;

import com.trading.assetgraph.AssetGraph;

import java.io.IOException;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Produces a populated graph: from the cache when one is configured and
 * readable, otherwise from {@link SampleDataset}. A freshly built fallback
 * graph is written back to the cache.
 */
public final class AssetGraphLoader {
    private static final Logger log = LogManager.getLogger(AssetGraphLoader.class);

    public enum Source {
        CACHE,
        FALLBACK
    }

    public record Loaded(AssetGraph graph, Source source) {
    }

    private final GraphCache cache;
    private final Supplier<AssetGraph> graphFactory;

    /**
     * @param cache        may be null to disable caching.
     * @param graphFactory creates the empty graph to populate.
     */
    public AssetGraphLoader(GraphCache cache, Supplier<AssetGraph> graphFactory) {
        this.cache = cache;
        this.graphFactory = graphFactory;
    }

    public Loaded load() {
        if (cache != null && cache.exists()) {
            try {
                log.info("Loading asset graph from cache at {}", cache.path());
                AssetGraph graph = graphFactory.get();
                GraphSnapshotCodec.populate(cache.load(), graph);
                return new Loaded(graph, Source.CACHE);
            } catch (IOException | IllegalArgumentException e) {
                log.error("Failed to load cached dataset from {}, using fallback dataset", cache.path(), e);
            }
        }

        log.info("Building asset graph from the built-in sample dataset");
        AssetGraph graph = graphFactory.get();
        SampleDataset.populate(graph);
        if (cache != null) {
            try {
                cache.persist(graph.snapshot());
            } catch (IOException e) {
                log.error("Failed to persist dataset cache to {}", cache.path(), e);
            }
        }
        return new Loaded(graph, Source.FALLBACK);
    }
}
