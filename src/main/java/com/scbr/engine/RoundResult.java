package com.scbr.engine;

import com.scbr.model.CandidateCase;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * RoundResult - Everything one round produced, including the stages that never ran (null).
 */
public final class RoundResult {

    public final String sessionId;
    public final int round;
    public final RoundStatus status;
    public final String message;            // refusal or clarification text for terminal rounds
    public final String accumulatedQuery;
    public final GateOutput gateOutput;
    public final List<CandidateCase> candidates;
    public final DiagnosisResult diagnosis;
    public final ReviewVerdict reviewVerdict;
    public final Presentation presentation;
    public final List<TraceEntry> trace;
    public final double coverageRatio;
    public final boolean converged;
    public final boolean forcedConvergence;
    public final Set<Stage> degradedStages;
    public final List<SpiralErrorKind> errors;

    public RoundResult(String sessionId, int round, RoundStatus status, String message, String accumulatedQuery,
                       GateOutput gateOutput, List<CandidateCase> candidates, DiagnosisResult diagnosis,
                       ReviewVerdict reviewVerdict, Presentation presentation, List<TraceEntry> trace,
                       double coverageRatio, boolean converged, boolean forcedConvergence,
                       Set<Stage> degradedStages, List<SpiralErrorKind> errors) {
        this.sessionId = sessionId;
        this.round = round;
        this.status = status;
        this.message = message;
        this.accumulatedQuery = accumulatedQuery;
        this.gateOutput = gateOutput;
        this.candidates = candidates != null ? List.copyOf(candidates) : List.of();
        this.diagnosis = diagnosis;
        this.reviewVerdict = reviewVerdict;
        this.presentation = presentation;
        this.trace = List.copyOf(trace);
        this.coverageRatio = coverageRatio;
        this.converged = converged;
        this.forcedConvergence = forcedConvergence;
        this.degradedStages = degradedStages.isEmpty()
            ? Set.of() : Set.copyOf(EnumSet.copyOf(degradedStages));
        this.errors = List.copyOf(errors);
    }

    public boolean isDegraded() {
        return !degradedStages.isEmpty();
    }

    public long traceCount(Stage stage) {
        return trace.stream().filter(e -> e.isStage(stage)).count();
    }

    /** Text to show the caller: the presentation when there is one, otherwise the message. */
    public String displayText() {
        return presentation != null ? presentation.text : message;
    }
}
