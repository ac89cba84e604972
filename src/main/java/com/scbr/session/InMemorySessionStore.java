package com.scbr.session;

import com.scbr.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * InMemorySessionStore - Capacity-bounded session map.
 * Per-key atomicity comes from {@link ConcurrentHashMap#compute}.
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final int capacity;
    private final Clock clock;

    private final AtomicLong created = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong evictedRounds = new AtomicLong();

    public InMemorySessionStore(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public InMemorySessionStore(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    @Override
    public Session getOrCreate(String sessionId) {
        Session existing = sessions.get(sessionId);
        if (existing != null) {
            return existing;
        }
        if (sessions.size() >= capacity) {
            // make room: at least one, or a tenth of capacity
            evictOldest(Math.max(1, sessions.size() - capacity + Math.max(1, capacity / 10)));
        }
        return sessions.computeIfAbsent(sessionId, id -> {
            created.incrementAndGet();
            log.debug("🆕 Session created: {}", id);
            return Session.fresh(id, clock.instant());
        });
    }

    @Override
    public Optional<Session> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public boolean updateIfVersionMatches(String sessionId, long baseVersion, Session next) {
        boolean[] applied = {false};
        sessions.computeIfPresent(sessionId, (id, current) -> {
            if (current.version != baseVersion) {
                return current;
            }
            applied[0] = true;
            return next;
        });
        if (applied[0]) {
            log.debug("💾 Session {} committed at v{}", sessionId, next.version);
        } else {
            log.debug("⚠️ Stale write rejected for session {} (base v{})", sessionId, baseVersion);
        }
        return applied[0];
    }

    @Override
    public boolean evict(String sessionId) {
        Session removed = sessions.remove(sessionId);
        if (removed != null) {
            evictions.incrementAndGet();
            evictedRounds.addAndGet(removed.roundCount);
            return true;
        }
        return false;
    }

    @Override
    public int evictIdle(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        int count = 0;
        for (Session session : List.copyOf(sessions.values())) {
            if (session.lastUpdatedAt.isBefore(cutoff)
                && sessions.remove(session.id, session)) {
                evictions.incrementAndGet();
                evictedRounds.addAndGet(session.roundCount);
                count++;
            }
        }
        if (count > 0) {
            log.info("🧹 Evicted {} idle session(s)", count);
        }
        return count;
    }

    @Override
    public int evictOverCapacity() {
        int excess = sessions.size() - capacity;
        return excess > 0 ? evictOldest(excess) : 0;
    }

    private int evictOldest(int count) {
        List<Session> oldest = sessions.values().stream()
            .sorted(Comparator.comparing((Session s) -> s.lastUpdatedAt))
            .limit(count)
            .collect(Collectors.toList());
        int evicted = 0;
        for (Session session : oldest) {
            if (sessions.remove(session.id, session)) {
                evictions.incrementAndGet();
                evictedRounds.addAndGet(session.roundCount);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("🧹 Capacity eviction removed {} session(s)", evicted);
        }
        return evicted;
    }

    @Override
    public int size() {
        return sessions.size();
    }

    @Override
    public SessionStats stats() {
        int active = sessions.size();
        long liveRounds = sessions.values().stream().mapToLong(s -> s.roundCount).sum();
        long total = liveRounds + evictedRounds.get();
        long sessionsCreated = created.get();
        double average = sessionsCreated == 0 ? 0.0 : (double) total / sessionsCreated;
        return new SessionStats(active, sessionsCreated, total, average, evictions.get(), capacity);
    }
}
