package com.trading.assetgraph.io;

import com.trading.assetgraph.viz.LayoutType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class AssetGraphConfigTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path write(String json) throws IOException {
        Path p = tmp.newFile().toPath();
        Files.writeString(p, json, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    public void testDefaults() {
        AssetGraphConfig c = new AssetGraphConfig();
        assertEquals(7070, c.getPort());
        assertNull(c.getCachePath());
        assertEquals(LayoutType.SPRING, c.layoutType());
        assertEquals(List.of("same_sector", "corporate_link"), c.getRules());
        assertFalse(c.isLogSkips());
    }

    @Test
    public void testLoadFromFileIgnoresUnknownKeys() throws IOException {
        AssetGraphConfig c = AssetGraphConfig.load(write(
                "{\"port\": 0, \"cache_path\": \"/tmp/g.json\", \"default_layout\": \"grid\", "
                        + "\"rules\": [\"same_sector\"], \"log_skips\": true, \"theme\": \"dark\"}"));
        assertEquals(0, c.getPort());
        assertEquals("/tmp/g.json", c.getCachePath());
        assertEquals(LayoutType.GRID, c.layoutType());
        assertEquals(List.of("same_sector"), c.getRules());
        assertTrue(c.isLogSkips());
    }

    @Test
    public void testClasspathDefault() throws IOException {
        AssetGraphConfig c = AssetGraphConfig.loadDefault();
        assertNotNull(c.layoutType());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadPort() throws IOException {
        AssetGraphConfig.load(write("{\"port\": 70000}"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadLayout() throws IOException {
        AssetGraphConfig.load(write("{\"default_layout\": \"force\"}"));
    }
}
