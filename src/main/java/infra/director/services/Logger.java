package infra.director.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Event-bus sink that writes CSV log records to <code>current.csv</code> under the logs directory.
 * <p>
 * Records arrive on {@value #LOG_ADDRESS} as pre-formatted CSV fragments (see {@link LogUtil}); the
 * logger appends a receive sequence number and a timestamp. Pending lines are appended on a timer,
 * the file is rolled into a UTC-stamped copy once per rotation period, and only the newest
 * {@value #KEEP_ROLLED} rolled copies are kept. Undeploying the verticle flushes what is pending.
 */
public class Logger extends AbstractVerticle {

    public static final String LOG_ADDRESS = "log";
    public static final String FLUSH_ADDRESS = "logger.flush";
    public static final String READY_ADDRESS = "logger.ready";

    static final String CURRENT = "current.csv";
    static final String HEADER = "Message,Level,Class,Category,Subcategory,SequenceReceived,EpochTimeMillis\n";
    private static final int KEEP_ROLLED = 12;
    private static final DateTimeFormatter ROLL_NAME =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final String logsDir;
    private final long flushIntervalMs;
    private final long rotationMs;

    private List<String> pending = new ArrayList<>();
    private long sequence;
    private long periodStart;
    private long timerId = -1;
    private Future<Void> lastWrite = Future.succeededFuture();

    public Logger(String logsDir) {
        this(logsDir, 20_000L, 86_400_000L);
    }

    public Logger(String logsDir, long flushIntervalMs, long rotationMs) {
        this.logsDir = logsDir;
        this.flushIntervalMs = flushIntervalMs;
        this.rotationMs = rotationMs;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        FileSystem fs = vertx.fileSystem();
        fs.mkdirs(logsDir)
            .compose(v -> fs.writeFile(currentPath(), Buffer.buffer(HEADER)))
            .onSuccess(v -> {
                periodStart = System.currentTimeMillis();
                vertx.eventBus().<String>consumer(LOG_ADDRESS, msg ->
                    pending.add(msg.body() + "," + (++sequence) + "," + System.currentTimeMillis() + "\n"));
                vertx.eventBus().consumer(FLUSH_ADDRESS, msg -> flush().onComplete(ar -> msg.reply(ar.succeeded())));
                timerId = vertx.setPeriodic(flushIntervalMs, id -> tick());
                vertx.eventBus().publish(READY_ADDRESS, "true");
                startPromise.complete();
            })
            .onFailure(err -> startPromise.fail(
                new IllegalStateException("Cannot prepare log directory " + logsDir, err)));
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
        }
        flush().onComplete(ar -> stopPromise.complete());
    }

    private void tick() {
        if (System.currentTimeMillis() - periodStart >= rotationMs) {
            roll();
        } else {
            flush();
        }
    }

    /**
     * Appends pending lines. Writes are chained so lines keep their receive order.
     */
    Future<Void> flush() {
        if (pending.isEmpty()) {
            return lastWrite;
        }
        List<String> batch = pending;
        pending = new ArrayList<>();
        Buffer chunk = Buffer.buffer();
        batch.forEach(chunk::appendString);

        lastWrite = lastWrite.transform(prev -> append(chunk));
        return lastWrite;
    }

    private Future<Void> append(Buffer chunk) {
        return vertx.fileSystem().open(currentPath(), new OpenOptions().setAppend(true).setCreate(true))
            .compose(file -> file.write(chunk).eventually(v -> file.close()))
            .recover(err -> {
                // the logger cannot log its own failure through the bus
                System.err.println("Logger: append to " + currentPath() + " failed: " + err.getMessage());
                return Future.failedFuture(err);
            });
    }

    private Future<Void> roll() {
        String rolled = logsDir + "/" + ROLL_NAME.format(Instant.ofEpochMilli(periodStart)) + ".csv";
        FileSystem fs = vertx.fileSystem();
        return flush()
            .compose(v -> fs.move(currentPath(), rolled))
            .compose(v -> {
                periodStart = System.currentTimeMillis();
                return fs.writeFile(currentPath(), Buffer.buffer(HEADER));
            })
            .compose(v -> pruneRolled());
    }

    private Future<Void> pruneRolled() {
        return vertx.fileSystem().readDir(logsDir, ".*\\.csv").compose(files -> {
            List<String> rolled = files.stream()
                .filter(path -> !path.endsWith(CURRENT))
                .sorted()
                .collect(Collectors.toList());
            List<Future<Void>> deletions = new ArrayList<>();
            for (int i = 0; i < rolled.size() - KEEP_ROLLED; i++) {
                deletions.add(vertx.fileSystem().delete(rolled.get(i)));
            }
            return Future.all(deletions).mapEmpty();
        });
    }

    private String currentPath() {
        return logsDir + "/" + CURRENT;
    }
}
