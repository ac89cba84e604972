package com.scbr.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scbr.model.CandidateCase;
import com.scbr.model.RetrievalPlan;
import com.scbr.model.Session;
import com.scbr.reasoning.PulseKnowledge;
import com.scbr.reasoning.ReasoningCapability;
import com.scbr.reasoning.ReasoningResult;
import com.scbr.reasoning.TermLexicon;
import com.scbr.retrieval.AssembledCandidates;
import com.scbr.retrieval.RetrievalAssembler;
import com.scbr.security.SecurityGateway;
import com.scbr.security.SecurityVerdict;
import com.scbr.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * PipelineOrchestrator - Runs one round Gate → Diagnose → Review → Present.
 *
 * <p>Stages report a {@link StageOutcome}; {@link StageTransitions} decides what runs next.
 * Timeouts and malformed replies at Gate, Diagnose and Review fall back locally and tag the stage
 * degraded. The session is read once at the start and written once at the end with a
 * version check, so nothing of a failed round leaks into the session.</p>
 *
 * <p>Callers must not run two rounds of the same session concurrently; the session actors
 * guarantee that.</p>
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    public static final String SCOPE_REFUSAL = "抱歉，此問題不在本系統可協助的範圍內。";
    public static final String SECURITY_REFUSAL = "抱歉，此請求無法處理。";
    public static final String REVIEW_REFUSAL = "抱歉，本輪分析內容未能通過審查，請調整或補充描述後再試。";
    public static final String RETRIEVAL_EMPTY_MESSAGE = "目前找不到可參考的案例，請補充更具體的症狀描述。";

    private final SessionStore store;
    private final RetrievalAssembler assembler;
    private final CaseSelector selector;
    private final ConvergenceEvaluator evaluator;
    private final ContentSafetyAuditor auditor;
    private final PresentationFormatter formatter;
    private final ReasoningCapability reasoning;
    private final SecurityGateway security;
    private final SpiralConfig config;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public PipelineOrchestrator(SessionStore store, RetrievalAssembler assembler, ReasoningCapability reasoning,
                                SecurityGateway security, SpiralConfig config, Clock clock) {
        this.store = store;
        this.assembler = assembler;
        this.reasoning = reasoning;
        this.security = security;
        this.config = config;
        this.clock = clock;
        this.selector = new CaseSelector(config);
        this.evaluator = new ConvergenceEvaluator(config);
        this.auditor = new ContentSafetyAuditor();
        this.formatter = new PresentationFormatter();
    }

    /**
     * @throws ReasoningUnavailableException when the reasoning capability stays unavailable
     *         past the retry budget; the session is left untouched
     */
    public RoundResult runRound(String sessionId, String inputText) {
        Session base = store.getOrCreate(sessionId);
        RoundState r = new RoundState(base, inputText);
        log.info("🌀 Session {} round {} started", sessionId, r.round);

        Stage stage = Stage.GATE;
        StageOutcome outcome;
        while (true) {
            outcome = switch (stage) {
                case GATE -> gate(r);
                case DIAGNOSE -> diagnose(r);
                case REVIEW -> review(r);
                case PRESENT -> present(r);
            };
            Optional<Stage> next = StageTransitions.next(stage, outcome);
            if (next.isEmpty()) {
                break;
            }
            stage = next.get();
        }

        commit(r, outcome);
        log.info("🏁 Session {} round {} ended at {} with {} ({})",
            sessionId, r.round, stage, outcome, r.degraded.isEmpty() ? "clean" : "degraded " + r.degraded);
        return r.toResult();
    }

    // ---------------------------------------------------------------- GATE

    private StageOutcome gate(RoundState r) {
        SecurityVerdict input = security.checkInput(r.base.id, r.rawInput);
        if (!input.passed) {
            r.trace.add(new TraceEntry(TraceEntry.SECURITY_INPUT, "fail", "input refused by security gateway", false));
            r.trace.add(TraceEntry.of(Stage.GATE, "security_fail", "round ended before scope check"));
            r.terminal(RoundStatus.SECURITY_REJECTED, SECURITY_REFUSAL, SpiralErrorKind.SECURITY_REJECTED);
            log.warn("🛡️ Session {} input refused: {}", r.base.id, input.reason);
            return StageOutcome.SECURITY_FAIL;
        }
        r.trace.add(new TraceEntry(TraceEntry.SECURITY_INPUT, "pass", "input accepted", false));
        r.input = input.sanitizedText;
        r.pendingQuery = r.base.pendingQuery(input.sanitizedText);

        ObjectNode context = mapper.createObjectNode();
        context.put("accumulated_query", r.pendingQuery);
        context.put("new_input", r.input);
        context.put("round", r.round);

        ReasoningResult result = call(Stage.GATE, context);
        GateOutput gate = result.isOk() ? parseGate(result.body, r.pendingQuery) : null;
        if (gate == null) {
            gate = localGate(r.pendingQuery);
            r.degrade(Stage.GATE, result.isOk() ? ReasoningResult.Failure.MALFORMED : result.failure);
            r.trace.add(TraceEntry.degraded(Stage.GATE, gate.action.name().toLowerCase(),
                "lexicon fallback after " + describe(result) + ", plan " + gate.plan));
        } else {
            r.trace.add(TraceEntry.of(Stage.GATE, gate.action.name().toLowerCase(),
                gate.action == GateOutput.Action.PROCEED ? "plan " + gate.plan : String.valueOf(gate.reason)));
        }
        r.gate = gate;

        switch (gate.action) {
            case REJECT:
                r.terminal(RoundStatus.SCOPE_REJECTED, SCOPE_REFUSAL, SpiralErrorKind.SCOPE_REJECTED);
                return StageOutcome.REJECT;
            case ASK_MORE:
                String clarification = gate.clarification != null && !gate.clarification.isBlank()
                    ? gate.clarification
                    : TermLexicon.clarificationFor(TermLexicon.missingCategories(r.pendingQuery, gate.plan));
                r.terminal(RoundStatus.ASK_MORE, clarification, null);
                return StageOutcome.ASK_MORE;
            default:
                return StageOutcome.PROCEED;
        }
    }

    private GateOutput parseGate(JsonNode body, String pendingQuery) {
        GateOutput.Action action;
        switch (body.path("action").asText("").trim().toLowerCase()) {
            case "proceed": action = GateOutput.Action.PROCEED; break;
            case "reject": action = GateOutput.Action.REJECT; break;
            case "ask_more": action = GateOutput.Action.ASK_MORE; break;
            default:
                log.warn("⚠️ Gate reply without a usable action: {}", body);
                return null;
        }
        RetrievalPlan plan = new RetrievalPlan(
            strings(body.path("symptom_terms")), strings(body.path("tongue_terms")),
            strings(body.path("pulse_terms")), strings(body.path("zangfu_terms")));
        if (action == GateOutput.Action.PROCEED && plan.isEmpty()) {
            plan = TermLexicon.extractPlan(pendingQuery);
        }
        return new GateOutput(action, plan, textOrNull(body, "clarification"), textOrNull(body, "reason"), false);
    }

    private static GateOutput localGate(String pendingQuery) {
        RetrievalPlan plan = TermLexicon.extractPlan(pendingQuery);
        if (plan.isEmpty()) {
            String clarification = TermLexicon.clarificationFor(TermLexicon.missingCategories(pendingQuery, plan));
            return new GateOutput(GateOutput.Action.ASK_MORE, plan, clarification, "no clinical terms found", true);
        }
        return new GateOutput(GateOutput.Action.PROCEED, plan, null, "clinical terms found", true);
    }

    // ---------------------------------------------------------------- DIAGNOSE

    private StageOutcome diagnose(RoundState r) {
        RetrievalPlan plan = r.gate.plan;
        AssembledCandidates assembled =
            assembler.assemble(r.pendingQuery, plan, config.fallbackFields, config.candidateCount);
        r.candidates = assembled.candidates;
        r.trace.add(new TraceEntry(TraceEntry.RETRIEVAL,
            assembled.retrievalEmpty ? "empty" : assembled.candidates.size() + " candidate(s)",
            String.join("; ", assembled.notes), false));

        if (assembled.retrievalEmpty) {
            r.trace.add(TraceEntry.of(Stage.DIAGNOSE, "skipped", "no candidates to diagnose"));
            r.terminal(RoundStatus.RETRIEVAL_EMPTY, RETRIEVAL_EMPTY_MESSAGE, SpiralErrorKind.RETRIEVAL_EMPTY);
            return StageOutcome.RETRIEVAL_EMPTY;
        }

        List<ScoredCandidate> ranked = selector.rank(assembled.candidates, plan);
        ReasoningResult result = call(Stage.DIAGNOSE, diagnoseContext(r, ranked));
        ParsedDiagnosis parsed = result.isOk() ? parseDiagnosis(result.body, assembled.candidates) : null;

        AnchorSelection selection;
        double coverage;
        List<String> missing;
        String pattern;
        String reasoningText;
        List<String> proposedQuestions;
        boolean degraded = parsed == null;

        if (!degraded) {
            selection = selector.select(ranked, r.base.lastAnchorCaseId, r.base.lastCoverageRatio,
                parsed.coverage, parsed.contradicts);
            coverage = parsed.coverage;
            missing = parsed.missingInfo;
            boolean agreed = selection.anchor.caseId().equals(parsed.anchorId);
            pattern = agreed && parsed.pattern != null ? parsed.pattern : selection.anchor.candidate.patternLabel;
            reasoningText = parsed.reasoning;
            proposedQuestions = parsed.questions;
        } else {
            // raw top retrieval candidate, coverage carried over
            String topId = assembled.candidates.get(0).caseId;
            ScoredCandidate top = ranked.stream().filter(s -> s.caseId().equals(topId)).findFirst().orElseThrow();
            selection = new AnchorSelection(top, ranked, false, false, null);
            coverage = r.base.lastCoverageRatio;
            missing = TermLexicon.missingCategories(r.pendingQuery, plan);
            pattern = top.candidate.patternLabel;
            reasoningText = top.candidate.summaryText;
            proposedQuestions = List.of();
            r.degrade(Stage.DIAGNOSE, result.isOk() ? ReasoningResult.Failure.MALFORMED : result.failure);
        }

        ConvergenceDecision convergence = evaluator.evaluate(coverage, selection.anchor.total, r.round);
        r.followUps = TermLexicon.followUpQuestions(missing, proposedQuestions, convergence.followUpCount);
        r.diagnosis = new DiagnosisResult(selection.anchor.caseId(), pattern, reasoningText, coverage, missing,
            proposedQuestions, degraded ? null : parsed.anchorId, selection, convergence, degraded);

        if (degraded) {
            r.trace.add(TraceEntry.degraded(Stage.DIAGNOSE, "fallback_anchor",
                describe(result) + "; " + selection.describe() + String.format(", coverage kept at %.2f", coverage)));
        } else {
            r.trace.add(TraceEntry.of(Stage.DIAGNOSE, "anchored", selection.describe()));
        }
        r.trace.add(new TraceEntry(TraceEntry.CONVERGENCE,
            convergence.forced ? "forced" : convergence.converged ? "converged" : "continue",
            convergence.toString(), false));
        if (convergence.forced) {
            r.errors.add(SpiralErrorKind.CONVERGENCE_FORCED);
        }
        return degraded ? StageOutcome.DIAGNOSED_DEGRADED : StageOutcome.DIAGNOSED;
    }

    private ObjectNode diagnoseContext(RoundState r, List<ScoredCandidate> ranked) {
        ObjectNode context = mapper.createObjectNode();
        context.put("accumulated_query", r.pendingQuery);
        context.put("round", r.round);
        context.put("previous_anchor_case_id", r.base.lastAnchorCaseId);
        context.put("previous_coverage_ratio", r.base.lastCoverageRatio);
        ObjectNode plan = context.putObject("plan");
        plan.set("symptom_terms", array(r.gate.plan.symptomTerms));
        plan.set("tongue_terms", array(r.gate.plan.tongueTerms));
        plan.set("pulse_terms", array(r.gate.plan.pulseTerms));
        plan.set("zangfu_terms", array(r.gate.plan.zangfuTerms));

        ArrayNode candidates = context.putArray("candidates");
        for (ScoredCandidate scored : ranked) {
            CandidateCase c = scored.candidate;
            ObjectNode node = candidates.addObject();
            node.put("case_id", c.caseId);
            node.put("pattern", c.patternLabel);
            node.put("chief_complaint", c.chiefComplaint);
            node.put("summary", c.summaryText);
            node.put("virtual", c.isVirtual());
            node.put("anchor_score", scored.total);
            node.set("symptom_terms", array(c.symptomTerms));
            node.set("tongue_pulse_terms", array(c.tonguePulseTerms));
        }
        return context;
    }

    private ParsedDiagnosis parseDiagnosis(JsonNode body, List<CandidateCase> candidates) {
        JsonNode anchor = body.get("anchor_case_id");
        JsonNode coverage = body.get("coverage_ratio");
        JsonNode missing = body.get("missing_info");
        if (anchor == null || !anchor.isTextual() || coverage == null || !coverage.isNumber()
            || missing == null || !missing.isArray()) {
            log.warn("⚠️ Diagnose reply missing required fields: {}", body);
            return null;
        }
        String anchorId = anchor.asText();
        if (candidates.stream().noneMatch(c -> c.caseId.equals(anchorId))) {
            log.warn("⚠️ Diagnose reply names unknown anchor {}", anchorId);
            return null;
        }
        double ratio = coverage.asDouble();
        if (ratio < 0.0 || ratio > 1.0) {
            log.warn("⚠️ Diagnose reply coverage out of range: {}", ratio);
            return null;
        }
        return new ParsedDiagnosis(anchorId, ratio, new ArrayList<>(strings(missing)),
            textOrNull(body, "pattern"), textOrNull(body, "reasoning"),
            body.path("contradicts_previous_anchor").asBoolean(false),
            new ArrayList<>(strings(body.path("follow_up_questions"))));
    }

    // ---------------------------------------------------------------- REVIEW

    private StageOutcome review(RoundState r) {
        String draft = r.diagnosis.draftText();
        ObjectNode context = mapper.createObjectNode();
        context.put("draft", draft);
        context.put("anchor_case_id", r.diagnosis.anchorCaseId);
        context.put("pattern", r.diagnosis.patternLabel);

        ReasoningResult result = call(Stage.REVIEW, context);
        ReviewVerdict modelVerdict = result.isOk() ? parseReview(result.body) : null;

        ReviewVerdict verdict;
        if (modelVerdict != null && modelVerdict.outcome == ReviewVerdict.Outcome.REJECTED) {
            verdict = modelVerdict;
        } else {
            String text = modelVerdict != null && modelVerdict.reviewedText != null ? modelVerdict.reviewedText : draft;
            ReviewVerdict local = auditor.audit(text);
            Set<String> issues = new LinkedHashSet<>();
            if (modelVerdict != null) issues.addAll(modelVerdict.issues);
            issues.addAll(local.issues);

            ReviewVerdict.Outcome outcome;
            if (local.outcome == ReviewVerdict.Outcome.REJECTED) {
                outcome = ReviewVerdict.Outcome.REJECTED;
            } else if (local.outcome == ReviewVerdict.Outcome.REWRITTEN
                || (modelVerdict != null && modelVerdict.outcome == ReviewVerdict.Outcome.REWRITTEN)) {
                outcome = ReviewVerdict.Outcome.REWRITTEN;
            } else {
                outcome = ReviewVerdict.Outcome.PASSED;
            }
            verdict = new ReviewVerdict(outcome, local.reviewedText, new ArrayList<>(issues), modelVerdict == null);
        }
        r.review = verdict;

        String decision = verdict.outcome.name().toLowerCase();
        if (modelVerdict == null) {
            r.degrade(Stage.REVIEW, result.isOk() ? ReasoningResult.Failure.MALFORMED : result.failure);
            r.trace.add(TraceEntry.degraded(Stage.REVIEW, decision,
                "local rules only after " + describe(result) + ", issues " + verdict.issues));
        } else {
            r.trace.add(TraceEntry.of(Stage.REVIEW, decision, "issues " + verdict.issues));
        }

        return switch (verdict.outcome) {
            case PASSED -> StageOutcome.PASSED;
            case REWRITTEN -> StageOutcome.REWRITTEN;
            case REJECTED -> {
                r.terminal(RoundStatus.REVIEW_REJECTED, REVIEW_REFUSAL, null);
                yield StageOutcome.REVIEW_REJECTED;
            }
        };
    }

    private ReviewVerdict parseReview(JsonNode body) {
        List<String> issues = new ArrayList<>(strings(body.path("issues")));
        switch (body.path("verdict").asText("").trim().toLowerCase()) {
            case "passed":
                return new ReviewVerdict(ReviewVerdict.Outcome.PASSED, textOrNull(body, "revised_text"), issues, false);
            case "rewritten":
                String revised = textOrNull(body, "revised_text");
                if (revised == null) {
                    log.warn("⚠️ Review rewrote without revised_text");
                    return null;
                }
                return new ReviewVerdict(ReviewVerdict.Outcome.REWRITTEN, revised, issues, false);
            case "rejected":
                return new ReviewVerdict(ReviewVerdict.Outcome.REJECTED, null, issues, false);
            default:
                log.warn("⚠️ Review reply without a usable verdict: {}", body);
                return null;
        }
    }

    // ---------------------------------------------------------------- PRESENT

    private StageOutcome present(RoundState r) {
        List<String> pulseNotes = PulseKnowledge.notesFor(r.gate.plan.pulseTerms, r.diagnosis.patternLabel);
        Presentation presentation = formatter.format(r.round, r.diagnosis, r.review, r.followUps, pulseNotes);
        SecurityVerdict output = security.checkOutput(r.base.id, presentation.text);
        if (!output.passed) {
            r.trace.add(new TraceEntry(TraceEntry.SECURITY_OUTPUT, "fail", "output refused by security gateway", false));
            r.trace.add(TraceEntry.of(Stage.PRESENT, "withheld", "presentation discarded"));
            r.terminal(RoundStatus.SECURITY_REJECTED, SECURITY_REFUSAL, SpiralErrorKind.SECURITY_REJECTED);
            log.warn("🛡️ Session {} output refused: {}", r.base.id, output.reason);
            return StageOutcome.SECURITY_FAIL;
        }
        r.trace.add(new TraceEntry(TraceEntry.SECURITY_OUTPUT, "pass", "output accepted", false));
        r.presentation = new Presentation(output.sanitizedText, presentation.anchorCaseId, presentation.patternLabel,
            presentation.followUpQuestions, presentation.pulseNotes, presentation.insufficiencyNotice,
            presentation.converged);
        r.trace.add(TraceEntry.of(Stage.PRESENT, "presented",
            r.followUps.size() + " follow-up question(s), " + pulseNotes.size() + " pulse note(s)"
                + (presentation.insufficiencyNotice != null
                ? ", insufficiency notice attached" : "")));
        r.status = RoundStatus.COMPLETED;
        return StageOutcome.PRESENTED;
    }

    // ---------------------------------------------------------------- commit

    private void commit(RoundState r, StageOutcome outcome) {
        Session next;
        switch (outcome) {
            case REJECT:
                r.trace.add(new TraceEntry(TraceEntry.COMMIT, "none", "rejected input is not accumulated", false));
                return;
            case SECURITY_FAIL:
                next = r.base.withSecurityFlag(clock.instant());
                break;
            case ASK_MORE:
            case RETRIEVAL_EMPTY:
                next = r.base.withRound(r.input, null, r.base.lastCoverageRatio, false, clock.instant());
                break;
            default:
                next = r.base.withRound(r.input, r.diagnosis.anchorCaseId, r.diagnosis.coverageRatio,
                    r.diagnosis.convergence.converged, clock.instant());
        }

        if (store.updateIfVersionMatches(r.base.id, r.base.version, next)) {
            r.committed = next;
            r.trace.add(new TraceEntry(TraceEntry.COMMIT, "committed", "session v" + next.version, false));
        } else {
            log.warn("⚠️ Session {} changed during round {}, result not committed", r.base.id, r.round);
            r.trace.add(new TraceEntry(TraceEntry.COMMIT, "stale", "session reset or evicted during the round", false));
            r.status = RoundStatus.SESSION_CHANGED;
        }
    }

    // ---------------------------------------------------------------- helpers

    private ReasoningResult call(Stage stage, ObjectNode context) {
        context.put("stage", stage.name());
        int attempts = config.retryBudget + 1;
        ReasoningResult last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            last = reasoning.call(stage, context, config.reasoningTimeout);
            if (last == null) {
                last = ReasoningResult.malformed("no result");
            }
            if (last.failure != ReasoningResult.Failure.UNAVAILABLE) {
                return last;
            }
            log.warn("⚠️ Reasoning unavailable at {} (attempt {}/{}): {}", stage, attempt, attempts, last.detail);
        }
        throw new ReasoningUnavailableException(stage, attempts, last.detail);
    }

    private static String describe(ReasoningResult result) {
        return result.isOk() ? "malformed reply" : result.toString();
    }

    private ArrayNode array(Collection<String> values) {
        ArrayNode node = mapper.createArrayNode();
        values.forEach(node::add);
        return node;
    }

    private static Set<String> strings(JsonNode node) {
        Set<String> values = new LinkedHashSet<>();
        if (node != null && node.isArray()) {
            node.forEach(v -> {
                if (v.isTextual() && !v.asText().isBlank()) values.add(v.asText().trim());
            });
        }
        return values;
    }

    private static String textOrNull(JsonNode body, String field) {
        JsonNode value = body.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText().trim() : null;
    }

    private static final class ParsedDiagnosis {
        final String anchorId;
        final double coverage;
        final List<String> missingInfo;
        final String pattern;
        final String reasoning;
        final boolean contradicts;
        final List<String> questions;

        ParsedDiagnosis(String anchorId, double coverage, List<String> missingInfo, String pattern,
                        String reasoning, boolean contradicts, List<String> questions) {
            this.anchorId = anchorId;
            this.coverage = coverage;
            this.missingInfo = missingInfo;
            this.pattern = pattern;
            this.reasoning = reasoning;
            this.contradicts = contradicts;
            this.questions = questions;
        }
    }

    /**
     * Working state of one round; never shared outside {@link #runRound}.
     */
    private static final class RoundState {
        final Session base;
        final String rawInput;
        final int round;
        final List<TraceEntry> trace = new ArrayList<>();
        final Set<Stage> degraded = EnumSet.noneOf(Stage.class);
        final List<SpiralErrorKind> errors = new ArrayList<>();

        String input;
        String pendingQuery;
        GateOutput gate;
        List<CandidateCase> candidates = List.of();
        DiagnosisResult diagnosis;
        ReviewVerdict review;
        Presentation presentation;
        List<String> followUps = List.of();
        RoundStatus status;
        String message;
        Session committed;

        RoundState(Session base, String rawInput) {
            this.base = base;
            this.rawInput = rawInput;
            this.round = base.roundCount + 1;
            this.input = rawInput;
            this.pendingQuery = base.accumulatedQuery;
        }

        void terminal(RoundStatus status, String message, SpiralErrorKind error) {
            this.status = status;
            this.message = message;
            if (error != null) {
                errors.add(error);
            }
        }

        void degrade(Stage stage, ReasoningResult.Failure failure) {
            degraded.add(stage);
            if (failure == ReasoningResult.Failure.TIMEOUT && !errors.contains(SpiralErrorKind.STAGE_TIMEOUT)) {
                errors.add(SpiralErrorKind.STAGE_TIMEOUT);
            }
            if (!errors.contains(SpiralErrorKind.STAGE_DEGRADED)) {
                errors.add(SpiralErrorKind.STAGE_DEGRADED);
            }
        }

        RoundResult toResult() {
            ConvergenceDecision convergence = diagnosis != null ? diagnosis.convergence : null;
            double coverage = diagnosis != null ? diagnosis.coverageRatio : base.lastCoverageRatio;
            String query = committed != null ? committed.accumulatedQuery : base.accumulatedQuery;
            return new RoundResult(base.id, round, status, message, query, gate, candidates, diagnosis,
                review, presentation, trace, coverage,
                convergence != null && convergence.converged,
                convergence != null && convergence.forced,
                degraded, errors);
        }
    }
}
