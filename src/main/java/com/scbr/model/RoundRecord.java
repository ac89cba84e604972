package com.scbr.model;

import java.time.Instant;

/**
 * RoundRecord - One accepted round as kept in the session history
 */
public final class RoundRecord {

    public final int roundNumber;
    public final String inputText;
    public final String anchorCaseId;
    public final double coverageRatio;
    public final boolean converged;
    public final Instant timestamp;

    public RoundRecord(int roundNumber, String inputText, String anchorCaseId,
                       double coverageRatio, boolean converged, Instant timestamp) {
        this.roundNumber = roundNumber;
        this.inputText = inputText;
        this.anchorCaseId = anchorCaseId;
        this.coverageRatio = coverageRatio;
        this.converged = converged;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return String.format("Round %d: anchor=%s coverage=%.2f%s",
            roundNumber, anchorCaseId, coverageRatio, converged ? " (converged)" : "");
    }
}
