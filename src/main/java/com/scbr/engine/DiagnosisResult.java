package com.scbr.engine;

import java.util.List;

/**
 * DiagnosisResult - Anchor, pattern and coverage produced by the Diagnose stage
 */
public final class DiagnosisResult {

    public final String anchorCaseId;
    public final String patternLabel;
    public final String reasoning;
    public final double coverageRatio;
    public final List<String> missingInfo;
    public final List<String> proposedQuestions;
    public final String proposedAnchorId;   // what the reasoning call named, null when degraded
    public final AnchorSelection selection;
    public final ConvergenceDecision convergence;
    public final boolean degraded;

    public DiagnosisResult(String anchorCaseId, String patternLabel, String reasoning, double coverageRatio,
                           List<String> missingInfo, List<String> proposedQuestions, String proposedAnchorId,
                           AnchorSelection selection, ConvergenceDecision convergence, boolean degraded) {
        this.anchorCaseId = anchorCaseId;
        this.patternLabel = patternLabel;
        this.reasoning = reasoning != null ? reasoning : "";
        this.coverageRatio = coverageRatio;
        this.missingInfo = List.copyOf(missingInfo);
        this.proposedQuestions = List.copyOf(proposedQuestions);
        this.proposedAnchorId = proposedAnchorId;
        this.selection = selection;
        this.convergence = convergence;
        this.degraded = degraded;
    }

    /**
     * Plain draft handed to Review.
     */
    public String draftText() {
        StringBuilder sb = new StringBuilder();
        sb.append("辨證參考：").append(patternLabel);
        if (!reasoning.isBlank()) {
            sb.append("\n").append(reasoning.trim());
        }
        return sb.toString();
    }
}
