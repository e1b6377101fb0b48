package com.trading.assetgraph.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.assetgraph.model.RelationshipTypes;
import com.trading.assetgraph.viz.LayoutType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * POJO representation of the application settings, read from JSON.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssetGraphConfig {
    public static final String CLASSPATH_RESOURCE = "asset-graph.json";

    private int port = 7070;

    /** Cache file; {@code null} disables caching. */
    @JsonProperty("cache_path")
    private String cachePath;

    @JsonProperty("default_layout")
    private String defaultLayout = LayoutType.SPRING.value();

    private List<String> rules = new ArrayList<>(
            List.of(RelationshipTypes.SAME_SECTOR, RelationshipTypes.CORPORATE_LINK));

    @JsonProperty("log_skips")
    private boolean logSkips;

    public LayoutType layoutType() {
        return LayoutType.fromValue(defaultLayout);
    }

    public static AssetGraphConfig load(Path path) throws IOException {
        return validate(new ObjectMapper().readValue(Files.readAllBytes(path), AssetGraphConfig.class));
    }

    /**
     * Reads {@value #CLASSPATH_RESOURCE} from the classpath, or returns the
     * defaults when it is absent.
     */
    public static AssetGraphConfig loadDefault() throws IOException {
        try (InputStream in = AssetGraphConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null)
                return new AssetGraphConfig();
            return validate(new ObjectMapper().readValue(in, AssetGraphConfig.class));
        }
    }

    private static AssetGraphConfig validate(AssetGraphConfig config) {
        if (config.port < 0 || config.port > 65535)
            throw new IllegalArgumentException("port must be between 0 and 65535, got " + config.port);
        if (config.rules == null)
            config.rules = new ArrayList<>();
        config.layoutType();
        return config;
    }
}
