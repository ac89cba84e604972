package com.scbr.engine;

import com.scbr.model.CandidateCase;
import com.scbr.model.RetrievalPlan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.scbr.engine.Fixtures.caseRecord;
import static com.scbr.engine.Fixtures.scored;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CaseSelectorTest {

    private final CaseSelector selector = new CaseSelector(Fixtures.config());

    @Test
    public void shouldCombineWeightedSubScores() {
        RetrievalPlan plan = new RetrievalPlan(Set.of("失眠", "多夢"), Set.of("舌淡"), Set.of("脈細"), Set.of());
        CandidateCase heartBlood = caseRecord("C2", "心血虛", 0.5, Set.of("失眠", "心悸"), Set.of("舌淡", "脈細"));

        ScoredCandidate s = selector.score(heartBlood, plan);

        assertEquals(1.0 / 3.0, s.symptomJaccard, 1e-9);
        assertEquals(1.0, s.tonguePulseScore, 1e-9);
        assertEquals(1.0, s.specificity, 1e-9);
        assertFalse(s.compoundPattern);
        assertEquals(0.4 * 0.5 + 0.3 / 3.0 + 0.2 + 0.1, s.total, 1e-9);
    }

    @Test
    public void shouldTreatTwoOrganPatternsAsCompound() {
        RetrievalPlan plan = new RetrievalPlan(Set.of("失眠"), Set.of(), Set.of(), Set.of());

        ScoredCandidate heartSpleen = selector.score(caseRecord("C1", "心脾兩虛", 0.5, Set.of("失眠"), Set.of()), plan);
        ScoredCandidate liverSpleen = selector.score(caseRecord("C3", "肝鬱脾虛", 0.5, Set.of("失眠"), Set.of()), plan);

        assertTrue(heartSpleen.compoundPattern);
        assertTrue(liverSpleen.compoundPattern);
        assertEquals(0.0, heartSpleen.specificity);
        assertEquals(0.0, heartSpleen.tonguePulseScore);
    }

    @Test
    public void shouldMatchSimplifiedPulseCharacters() {
        RetrievalPlan plan = new RetrievalPlan(Set.of(), Set.of(), Set.of("脉细"), Set.of());
        RetrievalPlan traditional = new RetrievalPlan(Set.of(), Set.of(), Set.of("脉細"), Set.of());
        CandidateCase c = caseRecord("C2", "心血虛", 0.5, Set.of(), Set.of("脈細"));

        assertEquals(0.0, selector.score(c, plan).tonguePulseScore, 1e-9);
        assertEquals(1.0, selector.score(c, traditional).tonguePulseScore, 1e-9);
    }

    @Test
    public void shouldPreferSingleOrganPatternWithinTieBreakGap() {
        List<ScoredCandidate> ranked = List.of(
            scored("C1", "心脾兩虛", true, 0.0, 0.86),
            scored("C2", "心血虛", false, 1.0, 0.81));

        AnchorSelection selection = selector.pickFresh(ranked);

        assertEquals("C2", selection.anchor.caseId());
        assertTrue(selection.tieBreakApplied);
    }

    @Test
    public void shouldKeepCompoundTopOutsideTieBreakGap() {
        List<ScoredCandidate> ranked = List.of(
            scored("C1", "心脾兩虛", true, 0.0, 0.90),
            scored("C2", "心血虛", false, 1.0, 0.80));

        AnchorSelection selection = selector.pickFresh(ranked);

        assertEquals("C1", selection.anchor.caseId());
        assertFalse(selection.tieBreakApplied);
    }

    @Test
    public void shouldRefuseToPickFromNoCandidates() {
        assertThrows(IllegalArgumentException.class, () -> selector.pickFresh(List.of()));
    }

    @Test
    public void shouldKeepPreviousAnchorWhileCoverageHolds() {
        List<ScoredCandidate> ranked = List.of(
            scored("C3", "肝血虛", false, 1.0, 0.90),
            scored("C2", "心血虛", false, 1.0, 0.70));

        AnchorSelection selection = selector.select(ranked, "C2", 0.45, 0.75, false);

        assertEquals("C2", selection.anchor.caseId());
        assertTrue(selection.keptByContinuity);
        assertNull(selection.switchReason);
    }

    @Test
    public void shouldSwitchWhenCoverageRegresses() {
        List<ScoredCandidate> ranked = List.of(
            scored("C3", "肝血虛", false, 1.0, 0.90),
            scored("C2", "心血虛", false, 1.0, 0.70));

        AnchorSelection selection = selector.select(ranked, "C2", 0.70, 0.45, false);

        assertEquals("C3", selection.anchor.caseId());
        assertFalse(selection.keptByContinuity);
        assertTrue(selection.switchReason.startsWith("coverage regressed"));
    }

    @Test
    public void shouldSwitchOnContradictionOrMissingAnchor() {
        List<ScoredCandidate> ranked = List.of(
            scored("C3", "肝血虛", false, 1.0, 0.90),
            scored("C2", "心血虛", false, 1.0, 0.70));

        AnchorSelection contradicted = selector.select(ranked, "C2", 0.5, 0.6, true);
        AnchorSelection gone = selector.select(ranked, "C9", 0.5, 0.6, false);

        assertEquals("C3", contradicted.anchor.caseId());
        assertTrue(contradicted.switchReason.contains("contradicts"));
        assertEquals("C3", gone.anchor.caseId());
        assertTrue(gone.switchReason.contains("not among candidates"));
    }

    @Test
    public void shouldComputeJaccardWithEmptySets() {
        assertEquals(0.0, CaseSelector.jaccard(Set.of(), Set.of()));
        assertEquals(0.0, CaseSelector.jaccard(Set.of("a"), Set.of()));
        assertEquals(0.5, CaseSelector.jaccard(Set.of("a", "b"), Set.of("a")), 1e-9);
    }
}
