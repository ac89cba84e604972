package com.scbr.engine;

import java.util.List;

/**
 * ReviewVerdict - Outcome of the Review stage with the text that may be presented
 */
public final class ReviewVerdict {

    public enum Outcome { PASSED, REWRITTEN, REJECTED }

    public final Outcome outcome;
    public final String reviewedText;     // null when rejected
    public final List<String> issues;
    public final boolean localRulesOnly;

    public ReviewVerdict(Outcome outcome, String reviewedText, List<String> issues, boolean localRulesOnly) {
        this.outcome = outcome;
        this.reviewedText = outcome == Outcome.REJECTED ? null : reviewedText;
        this.issues = List.copyOf(issues);
        this.localRulesOnly = localRulesOnly;
    }

    @Override
    public String toString() {
        return outcome + (issues.isEmpty() ? "" : " " + issues);
    }
}
