package com.scbr.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Session - Immutable snapshot of one consultation's cross-round state.
 *
 * <p>Every mutation returns a new snapshot with {@code version + 1}; the store only accepts a
 * snapshot whose base version still matches what it holds.</p>
 */
public final class Session {

    public static final String SUPPLEMENT_MARKER = " supplement: ";
    public static final String FURTHER_SUPPLEMENT_MARKER = " further-supplement: ";

    public final String id;
    public final long version;
    public final int roundCount;
    public final String accumulatedQuery;
    public final List<RoundRecord> history;
    public final String lastAnchorCaseId;     // null before the first diagnosis
    public final double lastCoverageRatio;
    public final int securityFlagCount;
    public final Instant createdAt;
    public final Instant lastUpdatedAt;

    private Session(String id, long version, int roundCount, String accumulatedQuery,
                    List<RoundRecord> history, String lastAnchorCaseId, double lastCoverageRatio,
                    int securityFlagCount, Instant createdAt, Instant lastUpdatedAt) {
        this.id = id;
        this.version = version;
        this.roundCount = roundCount;
        this.accumulatedQuery = accumulatedQuery;
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
        this.lastAnchorCaseId = lastAnchorCaseId;
        this.lastCoverageRatio = lastCoverageRatio;
        this.securityFlagCount = securityFlagCount;
        this.createdAt = createdAt;
        this.lastUpdatedAt = lastUpdatedAt;
    }

    public static Session fresh(String id, Instant now) {
        return new Session(id, 0L, 0, "", List.of(), null, 0.0, 0, now, now);
    }

    /**
     * The accumulated query the next round would work on, without committing it.
     */
    public String pendingQuery(String newText) {
        String text = newText.trim();
        if (roundCount == 0 || accumulatedQuery.isEmpty()) {
            return text;
        }
        String marker = roundCount == 1 ? SUPPLEMENT_MARKER : FURTHER_SUPPLEMENT_MARKER;
        return accumulatedQuery + marker + text;
    }

    /**
     * Commits an accepted round: round count, query, history, anchor and coverage move together.
     */
    public Session withRound(String newText, String anchorCaseId, double coverageRatio,
                             boolean converged, Instant now) {
        int nextRound = roundCount + 1;
        List<RoundRecord> nextHistory = new ArrayList<>(history);
        nextHistory.add(new RoundRecord(nextRound, newText.trim(), anchorCaseId, coverageRatio, converged, now));
        return new Session(id, version + 1, nextRound, pendingQuery(newText), nextHistory,
            anchorCaseId != null ? anchorCaseId : lastAnchorCaseId,
            coverageRatio, securityFlagCount, createdAt, now);
    }

    public Session withSecurityFlag(Instant now) {
        return new Session(id, version + 1, roundCount, accumulatedQuery, history, lastAnchorCaseId,
            lastCoverageRatio, securityFlagCount + 1, createdAt, now);
    }

    public Session touched(Instant now) {
        return new Session(id, version, roundCount, accumulatedQuery, history, lastAnchorCaseId,
            lastCoverageRatio, securityFlagCount, createdAt, now);
    }

    @Override
    public String toString() {
        return String.format("Session{id='%s', v%d, rounds=%d, anchor=%s, coverage=%.2f}",
            id, version, roundCount, lastAnchorCaseId, lastCoverageRatio);
    }
}
