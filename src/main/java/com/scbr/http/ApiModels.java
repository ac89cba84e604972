package com.scbr.http;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scbr.engine.RoundResult;
import com.scbr.engine.Stage;
import com.scbr.engine.TraceEntry;
import com.scbr.model.CandidateCase;
import com.scbr.session.SessionStats;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ApiModels - Data Transfer Objects for the HTTP API
 */
public final class ApiModels {

    private ApiModels() {}

    /**
     * ConsultRequest - One round of input. A missing sessionId starts a new session.
     */
    public static final class ConsultRequest {
        public final String text;
        public final String sessionId;

        @JsonCreator
        public ConsultRequest(
                @JsonProperty("text") String text,
                @JsonProperty("sessionId") String sessionId) {
            this.text = text;
            this.sessionId = sessionId;
        }
    }

    public static final class CandidateView {
        public final String caseId;
        public final String patternLabel;
        public final String domain;
        public final double score;
        public final boolean virtual;

        public CandidateView(CandidateCase c) {
            this.caseId = c.caseId;
            this.patternLabel = c.patternLabel;
            this.domain = c.domain;
            this.score = c.blendedScore;
            this.virtual = c.isVirtual();
        }
    }

    public static final class TraceView {
        public final String step;
        public final String decision;
        public final String detail;
        public final boolean degraded;

        public TraceView(TraceEntry entry) {
            this.step = entry.step;
            this.decision = entry.decision;
            this.detail = entry.detail;
            this.degraded = entry.degraded;
        }
    }

    /**
     * ConsultResponse - Round outcome sent back to the caller
     */
    public static final class ConsultResponse {
        public final String sessionId;
        public final int round;
        public final String status;
        public final String reply;                      // presentation text or refusal/clarification
        public final String patternLabel;
        public final String anchorCaseId;
        public final double coverageRatio;
        public final boolean converged;
        public final boolean forcedConvergence;
        public final List<String> followUpQuestions;
        public final List<String> pulseNotes;
        public final String insufficiencyNotice;
        public final List<String> degradedStages;
        public final List<CandidateView> candidates;
        public final List<TraceView> trace;

        public ConsultResponse(RoundResult r) {
            this.sessionId = r.sessionId;
            this.round = r.round;
            this.status = r.status.name();
            this.reply = r.displayText();
            this.patternLabel = r.presentation != null ? r.presentation.patternLabel : null;
            this.anchorCaseId = r.presentation != null ? r.presentation.anchorCaseId : null;
            this.coverageRatio = r.coverageRatio;
            this.converged = r.converged;
            this.forcedConvergence = r.forcedConvergence;
            this.followUpQuestions = r.presentation != null ? r.presentation.followUpQuestions : List.of();
            this.pulseNotes = r.presentation != null ? r.presentation.pulseNotes : List.of();
            this.insufficiencyNotice = r.presentation != null ? r.presentation.insufficiencyNotice : null;
            this.degradedStages = r.degradedStages.stream().sorted().map(Stage::name).collect(Collectors.toList());
            this.candidates = r.candidates.stream().map(CandidateView::new).collect(Collectors.toList());
            this.trace = r.trace.stream().map(TraceView::new).collect(Collectors.toList());
        }
    }

    public static final class ErrorResponse {
        public final String sessionId;
        public final String error;
        public final boolean retryable;

        public ErrorResponse(String sessionId, String error, boolean retryable) {
            this.sessionId = sessionId;
            this.error = error;
            this.retryable = retryable;
        }
    }

    public static final class ResetResponse {
        public final String sessionId;
        public final boolean existed;

        public ResetResponse(String sessionId, boolean existed) {
            this.sessionId = sessionId;
            this.existed = existed;
        }
    }

    public static final class StatsResponse {
        public final int activeSessions;
        public final long sessionsCreated;
        public final long totalRounds;
        public final double averageRounds;
        public final long evictions;
        public final int capacity;

        public StatsResponse(SessionStats stats) {
            this.activeSessions = stats.activeSessions;
            this.sessionsCreated = stats.sessionsCreated;
            this.totalRounds = stats.totalRounds;
            this.averageRounds = stats.averageRounds;
            this.evictions = stats.evictions;
            this.capacity = stats.capacity;
        }
    }

    public static final class HealthResponse {
        public final String status;
        public final String reasoning;

        public HealthResponse(String status, String reasoning) {
            this.status = status;
            this.reasoning = reasoning;
        }
    }
}
