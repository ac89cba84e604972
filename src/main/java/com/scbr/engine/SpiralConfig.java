package com.scbr.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.List;

/**
 * SpiralConfig - Engine weights, thresholds and limits from the {@code spiral} block of
 * application.conf
 */
public class SpiralConfig {

    public final int maxRounds;
    public final int candidateCount;
    public final List<String> fallbackFields;

    // CaseSelector
    public final double similarityWeight;
    public final double symptomWeight;
    public final double tonguePulseWeight;
    public final double specificityWeight;
    public final double tieBreakGap;
    public final double regressionThreshold;

    // ConvergenceEvaluator
    public final double coverageWeight;
    public final double anchorWeight;
    public final double roundWeight;
    public final double highThreshold;
    public final double forcedThreshold;
    public final double lowBand;
    public final double midBand;
    public final int maxFollowUps;

    // Reasoning calls
    public final Duration reasoningTimeout;
    public final int retryBudget;

    // Sessions
    public final int sessionCapacity;
    public final Duration idleTimeout;
    public final Duration sweepInterval;
    public final int stashCapacity;
    public final Duration passivateAfter;

    public final String httpHost;
    public final int httpPort;

    public SpiralConfig(Config root) {
        Config c = root.getConfig("spiral");
        this.maxRounds = c.getInt("max-rounds");
        this.candidateCount = c.getInt("candidate-count");
        this.fallbackFields = List.copyOf(c.getStringList("fallback-fields"));

        Config s = c.getConfig("selector");
        this.similarityWeight = s.getDouble("similarity-weight");
        this.symptomWeight = s.getDouble("symptom-weight");
        this.tonguePulseWeight = s.getDouble("tongue-pulse-weight");
        this.specificityWeight = s.getDouble("specificity-weight");
        this.tieBreakGap = s.getDouble("tie-break-gap");
        this.regressionThreshold = s.getDouble("regression-threshold");

        Config v = c.getConfig("convergence");
        this.coverageWeight = v.getDouble("coverage-weight");
        this.anchorWeight = v.getDouble("anchor-weight");
        this.roundWeight = v.getDouble("round-weight");
        this.highThreshold = v.getDouble("high-threshold");
        this.forcedThreshold = v.getDouble("forced-threshold");
        this.lowBand = v.getDouble("low-band");
        this.midBand = v.getDouble("mid-band");
        this.maxFollowUps = v.getInt("max-follow-ups");

        this.reasoningTimeout = c.getDuration("reasoning.timeout");
        this.retryBudget = c.getInt("reasoning.retry-budget");

        Config session = c.getConfig("session");
        this.sessionCapacity = session.getInt("capacity");
        this.idleTimeout = session.getDuration("idle-timeout");
        this.sweepInterval = session.getDuration("sweep-interval");
        this.stashCapacity = session.getInt("stash-capacity");
        this.passivateAfter = session.getDuration("passivate-after");

        this.httpHost = c.getString("http.host");
        this.httpPort = c.getInt("http.port");

        validate();
    }

    public static SpiralConfig load() {
        return new SpiralConfig(ConfigFactory.load());
    }

    private void validate() {
        if (maxRounds < 1) throw new IllegalArgumentException("spiral.max-rounds must be >= 1");
        if (candidateCount < 1) throw new IllegalArgumentException("spiral.candidate-count must be >= 1");
        if (fallbackFields.isEmpty()) throw new IllegalArgumentException("spiral.fallback-fields must not be empty");
        if (retryBudget < 0) throw new IllegalArgumentException("spiral.reasoning.retry-budget must be >= 0");
        if (maxFollowUps < 3) {
            throw new IllegalArgumentException("spiral.convergence.max-follow-ups must be >= 3, got " + maxFollowUps);
        }
        if (stashCapacity < 1) throw new IllegalArgumentException("spiral.session.stash-capacity must be >= 1");
        if (!(lowBand <= midBand && midBand <= highThreshold)) {
            throw new IllegalArgumentException("spiral.convergence bands must satisfy low <= mid <= high");
        }
    }

    @Override
    public String toString() {
        return String.format("SpiralConfig{maxRounds=%d, N=%d, fields=%s, timeout=%s, retries=%d, capacity=%d}",
            maxRounds, candidateCount, fallbackFields, reasoningTimeout, retryBudget, sessionCapacity);
    }
}
