package com.trading.assetgraph.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import lombok.extern.log4j.Log4j2;

/**
 * A single JSON file holding the latest graph snapshot.
 *
 * <p>
 * Writes go to a temporary file next to the cache and are then moved over
 * it, so readers never observe a partially written cache.
 */
@Log4j2
public final class GraphCache {
    private final Path path;
    private final GraphSnapshotCodec codec;

    public GraphCache(Path path) {
        this(path, new GraphSnapshotCodec());
    }

    public GraphCache(Path path, GraphSnapshotCodec codec) {
        this.path = path.toAbsolutePath().normalize();
        this.codec = codec;
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    /**
     * @throws IOException if the file cannot be read.
     * @throws com.trading.assetgraph.api.StructuralValidationException if the
     *         content is malformed.
     */
    public GraphSnapshot load() throws IOException {
        return codec.read(Files.readString(path, StandardCharsets.UTF_8));
    }

    public void persist(GraphSnapshot snapshot) throws IOException {
        Path dir = path.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, codec.write(snapshot), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, replacing non-atomically", dir);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Persisted graph cache to {} ({} assets)", path, snapshot.assets().size());
    }
}
