package infra.director.schema;

import io.vertx.core.Vertx;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static infra.director.services.LogUtil.*;

/**
 * Per-database cache of introspection payloads with a fixed time-to-live.
 * Payloads are opaque; expired entries are dropped lazily on read and by {@link #cleanupExpired()}.
 */
public class SchemaCache {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Map<String, Entry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration ttl;
    private final Clock clock;
    private final Vertx vertx;

    public SchemaCache(Duration ttl, Vertx vertx) {
        this(ttl, Clock.systemUTC(), vertx);
    }

    public SchemaCache(Duration ttl, Clock clock, Vertx vertx) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("cache TTL must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.clock = clock;
        this.vertx = vertx;
    }

    public Duration getTtl() {
        return ttl;
    }

    public Optional<Object> get(String dbId) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(dbId);
            if (entry == null || isExpired(entry, clock.instant())) {
                return Optional.empty();
            }
            logDebug(vertx, "Cache hit for database " + dbId, "SchemaCache", "Get", "Cache");
            return Optional.of(entry.value);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Typed read; an entry of another type counts as a miss.
     */
    public <T> Optional<T> get(String dbId, Class<T> type) {
        return get(dbId).filter(type::isInstance).map(type::cast);
    }

    public void set(String dbId, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("cannot cache a null payload for " + dbId);
        }
        lock.writeLock().lock();
        try {
            entries.put(dbId, new Entry(value, clock.instant()));
        } finally {
            lock.writeLock().unlock();
        }
        logDebug(vertx, "Cached schema for database " + dbId, "SchemaCache", "Set", "Cache");
    }

    public void invalidate(String dbId) {
        lock.writeLock().lock();
        try {
            entries.remove(dbId);
        } finally {
            lock.writeLock().unlock();
        }
        logDebug(vertx, "Invalidated cache for database " + dbId, "SchemaCache", "Invalidate", "Cache");
    }

    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        logInfo(vertx, "Schema cache cleared", "SchemaCache", "InvalidateAll", "Cache");
    }

    /**
     * Remove every entry older than the TTL.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        int removed = 0;
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Iterator<Entry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (isExpired(it.next(), now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            logDebug(vertx, "Removed " + removed + " expired schema cache entries", "SchemaCache", "Cleanup", "Cache");
        }
        return removed;
    }

    /**
     * Entries currently held, expired or not.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.createdAt, now).compareTo(ttl) > 0;
    }

    private static final class Entry {
        final Object value;
        final Instant createdAt;

        Entry(Object value, Instant createdAt) {
            this.value = value;
            this.createdAt = createdAt;
        }
    }
}
