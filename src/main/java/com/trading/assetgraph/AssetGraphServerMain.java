package com.trading.assetgraph;

import com.trading.assetgraph.io.AssetGraphConfig;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Starts the asset graph server.
 *
 * Usage: {@code AssetGraphServerMain [config.json]}. Without an argument the
 * classpath {@code asset-graph.json} is used.
 */
public class AssetGraphServerMain {
    private static final Logger log = LogManager.getLogger(AssetGraphServerMain.class);

    public static void main(String[] args) throws IOException {
        AssetGraphConfig config = args.length > 0
                ? AssetGraphConfig.load(Path.of(args[0]))
                : AssetGraphConfig.loadDefault();

        AssetGraphRuntime runtime = new AssetGraphRuntime(config).init().enableServer(config.getPort());
        Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "asset-graph-shutdown"));

        log.info("Asset graph server listening on port {} with rules {}", config.getPort(), config.getRules());
    }
}
