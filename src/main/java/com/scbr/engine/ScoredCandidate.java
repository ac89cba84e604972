package com.scbr.engine;

import com.scbr.model.CandidateCase;

/**
 * ScoredCandidate - A candidate with the sub-scores that produced its anchor score
 */
public final class ScoredCandidate {

    public final CandidateCase candidate;
    public final double similarity;
    public final double symptomJaccard;
    public final double tonguePulseScore;
    public final double specificity;
    public final boolean compoundPattern;
    public final double total;

    public ScoredCandidate(CandidateCase candidate, double similarity, double symptomJaccard,
                           double tonguePulseScore, double specificity, boolean compoundPattern, double total) {
        this.candidate = candidate;
        this.similarity = similarity;
        this.symptomJaccard = symptomJaccard;
        this.tonguePulseScore = tonguePulseScore;
        this.specificity = specificity;
        this.compoundPattern = compoundPattern;
        this.total = total;
    }

    public String caseId() {
        return candidate.caseId;
    }

    @Override
    public String toString() {
        return String.format("%s(%s) total=%.3f [sim=%.2f sym=%.2f tp=%.2f spec=%.0f]",
            candidate.caseId, candidate.patternLabel, total, similarity, symptomJaccard, tonguePulseScore, specificity);
    }
}
