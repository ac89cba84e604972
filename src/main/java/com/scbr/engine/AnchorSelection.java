package com.scbr.engine;

import java.util.List;

/**
 * AnchorSelection - The anchor picked for a round and how it was picked
 */
public final class AnchorSelection {

    public final ScoredCandidate anchor;
    public final List<ScoredCandidate> ranked;
    public final boolean keptByContinuity;
    public final boolean tieBreakApplied;
    public final String switchReason;      // null when nothing was switched

    public AnchorSelection(ScoredCandidate anchor, List<ScoredCandidate> ranked, boolean keptByContinuity,
                           boolean tieBreakApplied, String switchReason) {
        this.anchor = anchor;
        this.ranked = List.copyOf(ranked);
        this.keptByContinuity = keptByContinuity;
        this.tieBreakApplied = tieBreakApplied;
        this.switchReason = switchReason;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder("anchor ").append(anchor);
        if (keptByContinuity) sb.append(", kept from previous round");
        if (tieBreakApplied) sb.append(", specificity tie-break");
        if (switchReason != null) sb.append(", switched: ").append(switchReason);
        return sb.toString();
    }
}
