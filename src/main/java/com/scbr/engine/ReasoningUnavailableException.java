package com.scbr.engine;

/**
 * Thrown when the reasoning capability stays unavailable past the retry budget.
 * Nothing from the failed round is committed to the session.
 */
public class ReasoningUnavailableException extends RuntimeException {

    public final Stage stage;
    public final int attempts;

    public ReasoningUnavailableException(Stage stage, int attempts, String detail) {
        super("Reasoning capability unavailable at " + stage + " after " + attempts + " attempt(s): " + detail);
        this.stage = stage;
        this.attempts = attempts;
    }
}
