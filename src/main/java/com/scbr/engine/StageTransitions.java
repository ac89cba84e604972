package com.scbr.engine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * StageTransitions - (stage, outcome) to next stage, or terminal.
 * Pairs missing from the table are programming errors, not runtime conditions.
 */
public final class StageTransitions {

    private static final Map<Stage, Map<StageOutcome, Optional<Stage>>> TABLE = new EnumMap<>(Stage.class);

    static {
        on(Stage.GATE, StageOutcome.PROCEED, Stage.DIAGNOSE);
        terminal(Stage.GATE, StageOutcome.REJECT);
        terminal(Stage.GATE, StageOutcome.ASK_MORE);
        terminal(Stage.GATE, StageOutcome.SECURITY_FAIL);

        on(Stage.DIAGNOSE, StageOutcome.DIAGNOSED, Stage.REVIEW);
        on(Stage.DIAGNOSE, StageOutcome.DIAGNOSED_DEGRADED, Stage.REVIEW);
        terminal(Stage.DIAGNOSE, StageOutcome.RETRIEVAL_EMPTY);

        on(Stage.REVIEW, StageOutcome.PASSED, Stage.PRESENT);
        on(Stage.REVIEW, StageOutcome.REWRITTEN, Stage.PRESENT);
        terminal(Stage.REVIEW, StageOutcome.REVIEW_REJECTED);

        terminal(Stage.PRESENT, StageOutcome.PRESENTED);
        terminal(Stage.PRESENT, StageOutcome.SECURITY_FAIL);
    }

    private static void on(Stage from, StageOutcome outcome, Stage to) {
        TABLE.computeIfAbsent(from, s -> new EnumMap<>(StageOutcome.class)).put(outcome, Optional.of(to));
    }

    private static void terminal(Stage from, StageOutcome outcome) {
        TABLE.computeIfAbsent(from, s -> new EnumMap<>(StageOutcome.class)).put(outcome, Optional.empty());
    }

    /**
     * @return the next stage, or empty when the round ends here
     * @throws IllegalStateException for a pair the table does not define
     */
    public static Optional<Stage> next(Stage stage, StageOutcome outcome) {
        Optional<Stage> next = TABLE.getOrDefault(stage, Map.of()).get(outcome);
        if (next == null) {
            throw new IllegalStateException("No transition for " + stage + " -> " + outcome);
        }
        return next;
    }

    public static boolean isDefined(Stage stage, StageOutcome outcome) {
        return TABLE.getOrDefault(stage, Map.of()).containsKey(outcome);
    }

    public static Map<StageOutcome, Optional<Stage>> outgoing(Stage stage) {
        return Collections.unmodifiableMap(TABLE.getOrDefault(stage, Map.of()));
    }

    private StageTransitions() {}
}
