package com.scbr.engine;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StageTransitionsTest {

    @Test
    public void shouldFollowTheHappyPath() {
        assertEquals(Optional.of(Stage.DIAGNOSE), StageTransitions.next(Stage.GATE, StageOutcome.PROCEED));
        assertEquals(Optional.of(Stage.REVIEW), StageTransitions.next(Stage.DIAGNOSE, StageOutcome.DIAGNOSED));
        assertEquals(Optional.of(Stage.REVIEW), StageTransitions.next(Stage.DIAGNOSE, StageOutcome.DIAGNOSED_DEGRADED));
        assertEquals(Optional.of(Stage.PRESENT), StageTransitions.next(Stage.REVIEW, StageOutcome.REWRITTEN));
        assertEquals(Optional.empty(), StageTransitions.next(Stage.PRESENT, StageOutcome.PRESENTED));
    }

    @Test
    public void shouldEndRoundOnTerminalOutcomes() {
        assertTrue(StageTransitions.next(Stage.GATE, StageOutcome.REJECT).isEmpty());
        assertTrue(StageTransitions.next(Stage.GATE, StageOutcome.ASK_MORE).isEmpty());
        assertTrue(StageTransitions.next(Stage.GATE, StageOutcome.SECURITY_FAIL).isEmpty());
        assertTrue(StageTransitions.next(Stage.DIAGNOSE, StageOutcome.RETRIEVAL_EMPTY).isEmpty());
        assertTrue(StageTransitions.next(Stage.REVIEW, StageOutcome.REVIEW_REJECTED).isEmpty());
        assertTrue(StageTransitions.next(Stage.PRESENT, StageOutcome.SECURITY_FAIL).isEmpty());
    }

    @Test
    public void shouldRejectUndefinedPairs() {
        assertFalse(StageTransitions.isDefined(Stage.GATE, StageOutcome.PRESENTED));
        assertThrows(IllegalStateException.class, () -> StageTransitions.next(Stage.REVIEW, StageOutcome.PROCEED));
    }

    @Test
    public void shouldNeverSkipOrRepeatAStage() {
        for (Stage stage : Stage.values()) {
            StageTransitions.outgoing(stage).values().forEach(next ->
                next.ifPresent(n -> assertEquals(stage.ordinal() + 1, n.ordinal())));
        }
    }
}
