package com.scbr.engine;

import com.scbr.model.CandidateCase;
import com.scbr.model.RetrievalPlan;
import com.scbr.reasoning.TermLexicon;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * CaseSelector - Scores candidates against the round's terms and picks the anchor case.
 *
 * <p>score = w_sim * similarity + w_sym * symptom Jaccard + w_tp * tongue/pulse Jaccard average
 * + w_spec * single-organ indicator. A compound top pattern yields to a single-organ runner-up
 * within the tie-break gap. The previous anchor is kept while it is still a candidate, unless
 * coverage regressed past the threshold or the evidence contradicts it.</p>
 */
public class CaseSelector {

    private static final double EPSILON = 1e-9;

    private final SpiralConfig config;

    public CaseSelector(SpiralConfig config) {
        this.config = config;
    }

    public ScoredCandidate score(CandidateCase candidate, RetrievalPlan plan) {
        double symptom = jaccard(plan.symptomTerms, candidate.symptomTerms);

        Set<String> caseTongue = new LinkedHashSet<>();
        Set<String> casePulse = new LinkedHashSet<>();
        for (String term : candidate.tonguePulseTerms) {
            if (TermLexicon.isPulseTerm(term)) {
                casePulse.add(TermLexicon.normalize(term));
            } else if (TermLexicon.isTongueTerm(term)) {
                caseTongue.add(term);
            }
        }
        double tpSum = 0.0;
        int modalities = 0;
        if (!plan.tongueTerms.isEmpty()) {
            tpSum += jaccard(plan.tongueTerms, caseTongue);
            modalities++;
        }
        if (!plan.pulseTerms.isEmpty()) {
            Set<String> planPulse = new LinkedHashSet<>();
            plan.pulseTerms.forEach(t -> planPulse.add(TermLexicon.normalize(t)));
            tpSum += jaccard(planPulse, casePulse);
            modalities++;
        }
        double tonguePulse = modalities == 0 ? 0.0 : tpSum / modalities;

        int organs = TermLexicon.organsIn(candidate.patternLabel).size();
        boolean compound = organs >= 2 || candidate.patternLabel.contains("兩") || candidate.patternLabel.contains("两");
        double specificity = (!compound && organs == 1) ? 1.0 : 0.0;

        double total = config.similarityWeight * candidate.similarity
            + config.symptomWeight * symptom
            + config.tonguePulseWeight * tonguePulse
            + config.specificityWeight * specificity;

        return new ScoredCandidate(candidate, candidate.similarity, symptom, tonguePulse, specificity, compound, total);
    }

    /**
     * Candidates best-first; equal scores keep retrieval order.
     */
    public List<ScoredCandidate> rank(List<CandidateCase> candidates, RetrievalPlan plan) {
        List<ScoredCandidate> scored = new ArrayList<>();
        for (CandidateCase candidate : candidates) {
            scored.add(score(candidate, plan));
        }
        scored.sort(Comparator.comparingDouble((ScoredCandidate s) -> s.total).reversed());
        return scored;
    }

    /**
     * Fresh pick with the specificity tie-break, ignoring any previous anchor.
     */
    public AnchorSelection pickFresh(List<ScoredCandidate> ranked) {
        if (ranked.isEmpty()) {
            throw new IllegalArgumentException("cannot select an anchor from no candidates");
        }
        ScoredCandidate top = ranked.get(0);
        if (ranked.size() > 1) {
            ScoredCandidate second = ranked.get(1);
            boolean secondSingleOrgan = !second.compoundPattern && second.specificity > 0;
            if (top.compoundPattern && secondSingleOrgan && top.total - second.total <= config.tieBreakGap + EPSILON) {
                return new AnchorSelection(second, ranked, false, true, null);
            }
        }
        return new AnchorSelection(top, ranked, false, false, null);
    }

    /**
     * @param previousAnchorId  anchor of the previous round, null on the first diagnosis
     * @param previousCoverage  coverage of the previous round
     * @param currentCoverage   coverage reported for this round
     * @param contradiction     whether this round's evidence contradicts the previous anchor
     */
    public AnchorSelection select(List<ScoredCandidate> ranked, String previousAnchorId, double previousCoverage,
                                  double currentCoverage, boolean contradiction) {
        AnchorSelection fresh = pickFresh(ranked);
        if (previousAnchorId == null) {
            return fresh;
        }

        ScoredCandidate previous = ranked.stream()
            .filter(s -> s.caseId().equals(previousAnchorId))
            .findFirst()
            .orElse(null);

        String reason;
        if (previous == null) {
            reason = "previous anchor " + previousAnchorId + " not among candidates";
        } else if (previousCoverage - currentCoverage >= config.regressionThreshold - EPSILON) {
            reason = String.format("coverage regressed %.2f -> %.2f", previousCoverage, currentCoverage);
        } else if (contradiction) {
            reason = "new evidence contradicts " + previousAnchorId;
        } else {
            return new AnchorSelection(previous, ranked, true, false, null);
        }

        boolean switched = !fresh.anchor.caseId().equals(previousAnchorId);
        return new AnchorSelection(fresh.anchor, ranked, false, fresh.tieBreakApplied, switched ? reason : null);
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
