package com.trading.assetgraph.web;

import com.trading.assetgraph.util.ErrorRateLimiter;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.websocket.WsContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP and WebSocket front end over a {@link GraphApi}.
 *
 * <p>
 * Routes:
 * <ul>
 * <li>{@code GET /api/assets}, {@code /api/relationships}, {@code /api/events}</li>
 * <li>{@code GET /api/metrics}, {@code POST /api/rebuild}</li>
 * <li>{@code GET /api/visualization?layout=&ids=&exclude=}</li>
 * <li>{@code GET /api/layout/3d}, {@code GET /api/snapshot}, {@code GET /api/mermaid}</li>
 * <li>{@code GET /api/assets/{id}/explain}</li>
 * <li>{@code POST /api/tools/add_equity_node}</li>
 * <li>{@code WS /ws/metrics}: receives the metrics after every rebuild</li>
 * </ul>
 */
public class AssetGraphServer {
    private static final Logger log = LogManager.getLogger(AssetGraphServer.class);
    private static final String JSON = "application/json";

    private final GraphApi api;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final Set<WsContext> sessions = ConcurrentHashMap.newKeySet();
    private Javalin app;

    public AssetGraphServer(GraphApi api) {
        this.api = api;
    }

    /**
     * Starts listening on {@code port}; 0 picks a free port.
     *
     * @return the bound port.
     */
    public int start(int port) {
        log.info("Starting Asset Graph Server on port {}", port);
        app = Javalin.create();

        app.get("/api/assets", ctx -> json(ctx, api.assets()));
        app.get("/api/assets/{id}/explain", ctx -> ctx.contentType("text/plain")
                .result(api.explainAsset(ctx.pathParam("id"))));
        app.get("/api/relationships", ctx -> json(ctx, api.relationships()));
        app.get("/api/events", ctx -> json(ctx, api.events()));
        app.get("/api/metrics", ctx -> json(ctx, api.metrics()));
        app.post("/api/rebuild", ctx -> {
            String metrics = api.rebuild();
            broadcast(metrics);
            json(ctx, metrics);
        });
        app.get("/api/visualization", ctx -> json(ctx, api.visualization(ctx.queryParam("layout"),
                ctx.queryParam("ids"), ctx.queryParam("exclude"))));
        app.get("/api/layout/3d", ctx -> json(ctx, api.layout3d()));
        app.get("/api/snapshot", ctx -> json(ctx, api.snapshot()));
        app.get("/api/mermaid", ctx -> ctx.contentType("text/plain").result(api.mermaid()));
        app.post("/api/tools/add_equity_node", ctx -> json(ctx, api.addEquityNode(ctx.body())));

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            ctx.status(400);
            json(ctx, JsonSupport.error(e.getMessage()));
        });
        app.exception(Exception.class, (e, ctx) -> {
            String route = ctx.method() + " " + ctx.path();
            errLimiter.record(route, String.format("Request %s failed: %s", route, e.getMessage()), e);
            ctx.status(500);
            json(ctx, JsonSupport.error("Internal server error"));
        });

        app.ws("/ws/metrics", ws -> {
            ws.onConnect(ctx -> {
                log.info("WebSocket Client Connected: {}", ctx.sessionId());
                sessions.add(ctx);
                if (ctx.session.isOpen())
                    ctx.send(api.metrics());
            });
            ws.onClose(ctx -> {
                log.info("WebSocket Client Disconnected: {}", ctx.sessionId());
                sessions.remove(ctx);
            });
            ws.onError(ctx -> {
                log.error("WebSocket Client Error: {}", ctx.sessionId(), ctx.error());
                sessions.remove(ctx);
            });
        });

        app.start(port);
        return app.port();
    }

    /** Sends {@code jsonPayload} to every connected metrics subscriber. */
    public void broadcast(String jsonPayload) {
        if (sessions.isEmpty())
            return;
        for (WsContext ctx : sessions) {
            if (ctx.session.isOpen())
                ctx.send(jsonPayload);
        }
    }

    public int sessionCount() {
        return sessions.size();
    }

    public void stop() {
        if (app != null) {
            log.info("Stopping Asset Graph Server");
            app.stop();
            sessions.clear();
            app = null;
        }
    }

    private static void json(Context ctx, String body) {
        ctx.contentType(JSON).result(body);
    }
}
