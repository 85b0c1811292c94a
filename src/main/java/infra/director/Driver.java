package infra.director;

import infra.director.config.HostConfig;
import infra.director.mcp.servers.DatabaseQueryServer;
import infra.director.mcp.servers.DatabaseSchemaServer;
import infra.director.schema.FallbackQueryExecutor;
import infra.director.schema.RowNormalizer;
import infra.director.schema.SchemaAssembler;
import infra.director.schema.SchemaCache;
import infra.director.services.DatabaseManager;
import infra.director.services.Logger;
import infra.director.services.MCPRouterService;
import infra.director.services.ReadOnlyQueryService;
import infra.director.services.SchemaExplorerService;
import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvException;
import io.vertx.core.*;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

public class Driver {
  public static int logLevel = 2; // 0=errors, 1=warn, 2=info, 3=debug, 4=data
  public static Vertx vertx;

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final LinkedList<String> emergencyLogBuffer = new LinkedList<>();
  private static volatile boolean loggerReady = false;

  private final HostConfig config;
  private DatabaseManager databaseManager;
  private SchemaCache schemaCache;

  private Driver(HostConfig config) {
    this.config = config;
  }

  /**
   * Captures log messages to the emergency buffer, or publishes directly once the logger is ready.
   * Keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.removeFirst();
        }
        emergencyLogBuffer.add(message);
      }
    } else {
      vertx.eventBus().publish(Logger.LOG_ADDRESS, message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish(Logger.LOG_ADDRESS, entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    captureOrPublishLog("=== Database Schema MCP Host Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");

    loadEnvironment();
    HostConfig config = HostConfig.load();
    logLevel = config.getLogLevel();

    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(8)
        .setEventLoopPoolSize(1)
    );

    // Logger goes first so nothing after this point is lost
    vertx.deployVerticle(new Logger(config.getLogsPath()), res -> {
      if (res.succeeded()) {
        loggerReady = true;
        flushEmergencyBuffer();
        captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");
        new Driver(config).doIt();
      } else {
        System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
        System.exit(1);
      }
    });
  }

  private static void loadEnvironment() {
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,System");
    } catch (DotenvException e) {
      // not fatal, the process environment still applies
      captureOrPublishLog("Could not load .env.local file: " + e.getMessage() + ",1,Driver,StartUp,System");
    }
  }

  private void doIt() {
    if (config.getSchemaCacheTtlProblem() != null) {
      captureOrPublishLog(config.getSchemaCacheTtlProblem() + ",1,Driver,StartUp,Schema");
    }
    if (logLevel >= 2) captureOrPublishLog("Driver initialization starting,2,Driver,StartUp,MCP");

    vertx.eventBus().consumer("mcp.router.ready", msg -> {
      JsonObject status = (JsonObject) msg.body();
      captureOrPublishLog("MCP Router Ready on port: " + status.getInteger("port") + ". Connecting databases,2,Driver,StartUp,MCP");
      connectDatabases();
    });

    vertx.deployVerticle(new MCPRouterService(config.getMcpPort()), res -> {
      if (res.failed()) {
        captureOrPublishLog("MCPRouterService deployment failed: " + res.cause().getMessage() + ",0,Driver,System,System");
        System.err.println("Fatal error - cannot continue without router");
      }
    });
  }

  private void connectDatabases() {
    databaseManager = new DatabaseManager(vertx);
    databaseManager.loadConfiguration(config)
        .compose(v -> databaseManager.connectAll())
        .onSuccess(count -> {
          captureOrPublishLog("Connected " + count + " databases,2,Driver,StartUp,Database");
          Runtime.getRuntime().addShutdownHook(new Thread(databaseManager::closeAll, "database-shutdown"));
          deployMCPServers();
        })
        .onFailure(err -> {
          captureOrPublishLog("Fatal error - database initialization failed: " + err.getMessage() + ",0,Driver,StartUp,Database");
          System.err.println("Fatal error - database initialization failed: " + err.getMessage());
        });
  }

  private void deployMCPServers() {
    schemaCache = new SchemaCache(config.getSchemaCacheTtl(), vertx);
    RowNormalizer normalizer = new RowNormalizer();
    SchemaAssembler assembler = new SchemaAssembler(new FallbackQueryExecutor(normalizer, vertx), vertx);
    SchemaExplorerService explorer = new SchemaExplorerService(vertx, databaseManager, assembler, schemaCache);
    ReadOnlyQueryService queryService = new ReadOnlyQueryService(vertx, databaseManager, normalizer);

    vertx.setPeriodic(config.getSchemaCacheTtl().toMillis(), id -> {
      int removed = schemaCache.cleanupExpired();
      if (removed > 0 && logLevel >= 3) {
        captureOrPublishLog("Removed " + removed + " expired schema cache entries,3,Driver,Cleanup,Schema");
      }
    });

    List<Future<String>> deploymentFutures = new ArrayList<>();
    deploymentFutures.add(vertx.deployVerticle(
        new DatabaseSchemaServer(explorer, databaseManager),
        new DeploymentOptions().setThreadingModel(ThreadingModel.WORKER)));
    deploymentFutures.add(vertx.deployVerticle(
        new DatabaseQueryServer(queryService),
        new DeploymentOptions().setThreadingModel(ThreadingModel.WORKER)));

    Future.all(deploymentFutures).onComplete(ar -> {
      if (ar.succeeded()) {
        captureOrPublishLog("=== Database Schema MCP Host Started with " + deploymentFutures.size() + " servers ===,1,Driver,System,System");
        vertx.eventBus().publish("mcp.servers.ready", new JsonObject()
            .put("serverCount", deploymentFutures.size())
            .put("databases", databaseManager.getConnectedIds().size())
            .put("timestamp", System.currentTimeMillis()));
      } else {
        captureOrPublishLog("Failed to deploy MCP servers: " + ar.cause().getMessage() + ",0,Driver,StartUp,MCP");
        System.err.println("Failed to deploy MCP servers: " + ar.cause().getMessage());
      }
    });
  }
}
