package com.scbr.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConvergenceEvaluatorTest {

    private final ConvergenceEvaluator evaluator = new ConvergenceEvaluator(Fixtures.config());

    @Test
    public void shouldConvergeAtHighCoverage() {
        ConvergenceDecision decision = evaluator.evaluate(0.85, 0.7, 3);

        assertTrue(decision.converged);
        assertFalse(decision.forced);
        assertEquals(0, decision.followUpCount);
        assertEquals(0.5 * 0.85 + 0.3 * 0.7 + 0.2 * 0.8, decision.convergenceScore, 1e-9);
    }

    @Test
    public void shouldContinueBelowThreshold() {
        ConvergenceDecision decision = evaluator.evaluate(0.75, 0.7, 2);

        assertFalse(decision.converged);
        assertFalse(decision.forced);
        assertEquals(1, decision.followUpCount);
    }

    @Test
    public void shouldForceConvergenceAtMaxRoundsWithThinEvidence() {
        ConvergenceDecision decision = evaluator.evaluate(0.6, 0.5, 7);

        assertTrue(decision.converged);
        assertTrue(decision.forced);
    }

    @Test
    public void shouldNotFlagForcedWhenEvidenceIsSufficientAtMaxRounds() {
        ConvergenceDecision decision = evaluator.evaluate(0.78, 0.5, 7);

        assertTrue(decision.converged);
        assertFalse(decision.forced);
    }

    @Test
    public void shouldScaleFollowUpsWithCoverage() {
        assertEquals(3, evaluator.followUpCount(0.2, false));
        assertEquals(3, evaluator.followUpCount(0.44, false));
        assertEquals(2, evaluator.followUpCount(0.45, false));
        assertEquals(2, evaluator.followUpCount(0.69, false));
        assertEquals(1, evaluator.followUpCount(0.7, false));
        assertEquals(0, evaluator.followUpCount(0.2, true));
    }

    @Test
    public void shouldClampCoverageIntoUnitRange() {
        assertEquals(1.0, evaluator.evaluate(1.4, 0.5, 1).coverageRatio);
        assertEquals(0.0, evaluator.evaluate(-0.2, 0.5, 1).coverageRatio);
    }
}
