package com.scbr.engine;

/**
 * ConvergenceDecision - Termination signals for one round
 */
public final class ConvergenceDecision {

    public final double coverageRatio;
    public final double anchorMatchScore;
    public final int round;
    public final double convergenceScore;
    public final boolean converged;
    public final boolean forced;
    public final int followUpCount;

    public ConvergenceDecision(double coverageRatio, double anchorMatchScore, int round, double convergenceScore,
                               boolean converged, boolean forced, int followUpCount) {
        this.coverageRatio = coverageRatio;
        this.anchorMatchScore = anchorMatchScore;
        this.round = round;
        this.convergenceScore = convergenceScore;
        this.converged = converged;
        this.forced = forced;
        this.followUpCount = followUpCount;
    }

    @Override
    public String toString() {
        return String.format("coverage=%.2f score=%.3f round=%d converged=%s forced=%s followUps=%d",
            coverageRatio, convergenceScore, round, converged, forced, followUpCount);
    }
}
