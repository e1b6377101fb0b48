package com.trading.assetgraph.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.trading.assetgraph.AssetGraph;
import com.trading.assetgraph.Fixtures;
import com.trading.assetgraph.concurrent.SynchronizedAssetGraph;
import com.trading.assetgraph.viz.LayoutType;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class AssetGraphServerTest {
    private final HttpClient client = HttpClient.newHttpClient();
    private AssetGraphServer server;
    private int port;

    @Before
    public void setUp() {
        AssetGraph g = Fixtures.smallGraph();
        g.buildRelationships();
        SynchronizedAssetGraph graph = new SynchronizedAssetGraph(g);
        server = new AssetGraphServer(new GraphApi(() -> graph, LayoutType.SPRING));
        port = server.start(0);
    }

    @After
    public void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create("http://localhost:" + port + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create("http://localhost:" + port + path))
                .POST(HttpRequest.BodyPublishers.ofString(body)).build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpoint() throws Exception {
        HttpResponse<String> r = get("/api/metrics");
        assertEquals(200, r.statusCode());
        JsonNode m = JsonSupport.MAPPER.readTree(r.body());
        assertEquals(4, m.get("total_assets").asInt());
    }

    @Test
    public void testBadRequestMapsTo400() throws Exception {
        HttpResponse<String> r = get("/api/visualization?layout=force");
        assertEquals(400, r.statusCode());
        assertTrue(JsonSupport.MAPPER.readTree(r.body()).get("error").asText().contains("force"));

        assertEquals(400, get("/api/assets/NOPE/explain").statusCode());
    }

    @Test
    public void testAddThenRebuild() throws Exception {
        HttpResponse<String> add = post("/api/tools/add_equity_node",
                "{\"asset_id\":\"E\",\"symbol\":\"E\",\"name\":\"E Corp\",\"sector\":\"Energy\",\"price\":10}");
        assertEquals(200, add.statusCode());

        HttpResponse<String> rebuilt = post("/api/rebuild", "");
        assertEquals(200, rebuilt.statusCode());
        assertEquals(5, JsonSupport.MAPPER.readTree(rebuilt.body()).get("total_relationships").asInt());
        assertEquals(0, server.sessionCount());
    }
}
