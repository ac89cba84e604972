package com.scbr.engine;

/**
 * ConvergenceEvaluator - Coverage-driven termination and follow-up volume
 */
public class ConvergenceEvaluator {

    private final SpiralConfig config;

    public ConvergenceEvaluator(SpiralConfig config) {
        this.config = config;
    }

    public ConvergenceDecision evaluate(double coverageRatio, double anchorMatchScore, int round) {
        double coverage = clamp(coverageRatio);
        double roundFactor = 1.0 - Math.min(0.5, (round - 1) * 0.1);
        double score = config.coverageWeight * coverage
            + config.anchorWeight * clamp(anchorMatchScore)
            + config.roundWeight * roundFactor;

        boolean exhausted = round >= config.maxRounds;
        boolean converged = coverage >= config.highThreshold || exhausted;
        boolean forced = exhausted && coverage < config.forcedThreshold;

        return new ConvergenceDecision(coverage, anchorMatchScore, round, score, converged, forced,
            followUpCount(coverage, converged));
    }

    /**
     * Follow-up questions to ask after this round. Converged rounds ask none; below the low band
     * the maximum, below the mid band one fewer, and one optional question otherwise.
     */
    public int followUpCount(double coverage, boolean converged) {
        if (converged) {
            return 0;
        }
        if (coverage < config.lowBand) {
            return config.maxFollowUps;
        }
        if (coverage < config.midBand) {
            return Math.max(2, config.maxFollowUps - 1);
        }
        return 1;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
