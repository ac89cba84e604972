package com.scbr.session;

import com.scbr.model.Session;

import java.time.Duration;
import java.util.Optional;

/**
 * SessionStore - Cross-round session state keyed by session id.
 *
 * <p>Writes are optimistic: {@link #updateIfVersionMatches} only replaces the stored snapshot when
 * the caller's base version is still current, so two writers can never both commit a round.</p>
 */
public interface SessionStore {

    /** Returns the stored session or creates an empty one, evicting oldest-idle entries when full. */
    Session getOrCreate(String sessionId);

    Optional<Session> get(String sessionId);

    /**
     * Replaces the snapshot whose version equals {@code baseVersion} with {@code next}.
     *
     * @return false when the stored version moved on or the session was evicted meanwhile
     */
    boolean updateIfVersionMatches(String sessionId, long baseVersion, Session next);

    boolean evict(String sessionId);

    /** Evicts every session whose last update is older than {@code maxIdle}. */
    int evictIdle(Duration maxIdle);

    /** Evicts oldest-idle sessions until the store is within capacity. */
    int evictOverCapacity();

    int size();

    SessionStats stats();
}
