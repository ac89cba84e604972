package com.scbr.session;

/**
 * SessionStats - Point-in-time counters exposed by the stats endpoint and console
 */
public final class SessionStats {

    public final int activeSessions;
    public final long sessionsCreated;
    public final long totalRounds;
    public final double averageRounds;
    public final long evictions;
    public final int capacity;

    public SessionStats(int activeSessions, long sessionsCreated, long totalRounds,
                        double averageRounds, long evictions, int capacity) {
        this.activeSessions = activeSessions;
        this.sessionsCreated = sessionsCreated;
        this.totalRounds = totalRounds;
        this.averageRounds = averageRounds;
        this.evictions = evictions;
        this.capacity = capacity;
    }

    @Override
    public String toString() {
        return String.format("active=%d/%d created=%d rounds=%d avgRounds=%.2f evicted=%d",
            activeSessions, capacity, sessionsCreated, totalRounds, averageRounds, evictions);
    }
}
