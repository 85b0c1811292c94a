package infra.director.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static infra.director.services.LogUtil.*;

/**
 * HTTP host for the MCP servers.
 * Servers register their sub-routers here; routers registered before the
 * service starts are mounted once it does.
 */
public class MCPRouterService extends AbstractVerticle {

    private static final Map<String, Router> pendingRouters = new ConcurrentHashMap<>();
    private static volatile MCPRouterService instance;

    private final int port;
    private Router mainRouter;
    private HttpServer httpServer;

    /**
     * @param port HTTP port; 0 picks a free one
     */
    public MCPRouterService(int port) {
        this.port = port;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        mainRouter = Router.router(vertx);
        addGlobalHandlers();

        mainRouter.get("/health").handler(ctx -> ctx.response()
            .putHeader("content-type", "application/json")
            .end(new JsonObject()
                .put("status", "healthy")
                .put("timestamp", System.currentTimeMillis())
                .encode()));

        instance = this;
        mountRegisteredRouters();

        HttpServerOptions options = new HttpServerOptions()
            .setPort(port)
            .setCompressionSupported(true)
            .setHandle100ContinueAutomatically(true);

        httpServer = vertx.createHttpServer(options);
        httpServer.requestHandler(mainRouter)
            .listen()
            .onSuccess(server -> {
                logInfo(vertx, "MCPRouterService started on port " + server.actualPort(), "MCPRouterService", "Service", "System");
                vertx.eventBus().publish("mcp.router.ready", new JsonObject()
                    .put("port", server.actualPort())
                    .put("address", "localhost")
                    .put("timestamp", System.currentTimeMillis()));
                startPromise.complete();
            })
            .onFailure(err -> {
                logError(vertx, "Failed to start MCPRouterService", err, "MCPRouterService", "Service", "System");
                startPromise.fail(err);
            });
    }

    private void addGlobalHandlers() {
        Set<String> allowedHeaders = new HashSet<>();
        allowedHeaders.add("content-type");
        allowedHeaders.add("authorization");

        Set<HttpMethod> allowedMethods = new HashSet<>();
        allowedMethods.add(HttpMethod.GET);
        allowedMethods.add(HttpMethod.POST);
        allowedMethods.add(HttpMethod.OPTIONS);

        mainRouter.route().handler(CorsHandler.create()
            .addOrigin("*")
            .allowedHeaders(allowedHeaders)
            .allowedMethods(allowedMethods));

        mainRouter.route().handler(BodyHandler.create().setBodyLimit(10 * 1024 * 1024));

        mainRouter.route("/mcp/*").failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            int statusCode = ctx.statusCode() == -1 ? 500 : ctx.statusCode();
            if (failure != null) {
                logError(vertx, "Unhandled failure on " + ctx.request().path(), failure, "MCPRouterService", "HTTP", "Router");
            }
            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(new JsonObject()
                    .put("jsonrpc", "2.0")
                    .put("error", new JsonObject()
                        .put("code", -32603)
                        .put("message", failure != null ? failure.getMessage() : "Unknown error"))
                    .encode());
        });
    }

    /**
     * Mount a server's router under <code>path</code>, now or once the service starts.
     */
    public static void registerRouter(String path, Router subRouter) {
        MCPRouterService current = instance;
        if (current != null && current.mainRouter != null) {
            current.vertx.runOnContext(v -> current.mountRouter(path, subRouter));
        } else {
            pendingRouters.put(path, subRouter);
        }
    }

    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    private void mountRouter(String path, Router subRouter) {
        mainRouter.route(path + "/*").subRouter(subRouter);
        logInfo(vertx, "Mounted router at path: " + path, "MCPRouterService", "Service", "System");
    }

    private void mountRegisteredRouters() {
        for (Map.Entry<String, Router> entry : pendingRouters.entrySet()) {
            mountRouter(entry.getKey(), entry.getValue());
        }
        pendingRouters.clear();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (instance == this) {
            instance = null;
        }
        if (httpServer == null) {
            stopPromise.complete();
            return;
        }
        httpServer.close()
            .onSuccess(v -> {
                logInfo(vertx, "MCPRouterService stopped", "MCPRouterService", "Service", "System");
                stopPromise.complete();
            })
            .onFailure(stopPromise::fail);
    }
}
