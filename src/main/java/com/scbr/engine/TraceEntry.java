package com.scbr.engine;

/**
 * TraceEntry - One decision point of a round, in the order it happened
 */
public final class TraceEntry {

    public static final String SECURITY_INPUT = "SECURITY_INPUT";
    public static final String RETRIEVAL = "RETRIEVAL";
    public static final String CONVERGENCE = "CONVERGENCE";
    public static final String SECURITY_OUTPUT = "SECURITY_OUTPUT";
    public static final String COMMIT = "COMMIT";

    public final String step;        // a Stage name or one of the constants above
    public final String decision;
    public final String detail;
    public final boolean degraded;

    public TraceEntry(String step, String decision, String detail, boolean degraded) {
        this.step = step;
        this.decision = decision;
        this.detail = detail;
        this.degraded = degraded;
    }

    public static TraceEntry of(Stage stage, String decision, String detail) {
        return new TraceEntry(stage.name(), decision, detail, false);
    }

    public static TraceEntry degraded(Stage stage, String decision, String detail) {
        return new TraceEntry(stage.name(), decision, detail, true);
    }

    public boolean isStage(Stage stage) {
        return stage.name().equals(step);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s%s - %s", step, decision, degraded ? " (degraded)" : "", detail);
    }
}
