package com.scbr.reasoning;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scbr.engine.Stage;

import java.time.Duration;

/**
 * ReasoningCapability - Stage-specific structured call to an external text-reasoning service.
 * Implementations never throw; every failure comes back as a {@link ReasoningResult}.
 */
public interface ReasoningCapability {

    ReasoningResult call(Stage stage, ObjectNode context, Duration timeout);

    default String name() {
        return getClass().getSimpleName();
    }
}
