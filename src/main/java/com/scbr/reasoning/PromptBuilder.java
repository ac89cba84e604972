package com.scbr.reasoning;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scbr.engine.Stage;

/**
 * PromptBuilder - Stage prompts for the reasoning model. Each asks for a single JSON object.
 */
public final class PromptBuilder {

    public static String build(Stage stage, ObjectNode context) {
        return switch (stage) {
            case GATE -> gatePrompt(context);
            case DIAGNOSE -> diagnosePrompt(context);
            case REVIEW -> reviewPrompt(context);
            case PRESENT -> throw new IllegalArgumentException("PRESENT is formatted locally");
        };
    }

    private static String gatePrompt(ObjectNode context) {
        return String.format("""
            You screen consultation requests for a Traditional Chinese Medicine case-based reasoning assistant.

            CONSULTATION SO FAR:
            %s

            Decide one action:
            - "proceed" when the text describes clinical findings usable for TCM pattern differentiation
            - "ask_more" when it is clinical but too thin to search cases with
            - "reject" when it is not a TCM clinical consultation

            Extract terms exactly as written in the text (Traditional Chinese).

            Respond with ONLY this JSON object:
            {"action": "proceed|ask_more|reject",
             "symptom_terms": [], "tongue_terms": [], "pulse_terms": [], "zangfu_terms": [],
             "clarification": "question to ask when action is ask_more",
             "reason": "short internal reason"}
            """, context.path("accumulated_query").asText());
    }

    private static String diagnosePrompt(ObjectNode context) {
        return String.format("""
            You are a senior TCM practitioner reasoning from similar prior cases.

            CONSULTATION (round %d):
            %s

            EXTRACTED TERMS:
            %s

            CANDIDATE CASES (ranked, VIRTUAL_THEORY_CASE means no close corpus match):
            %s

            PREVIOUS ANCHOR: %s (coverage %.2f)

            Pick the anchor case from the candidates, estimate how much of the information needed
            for a confident pattern differentiation has been supplied (coverage_ratio 0..1), and list
            what is still missing. Set contradicts_previous_anchor to true only when the new
            findings contradict the previous anchor's pattern.

            Respond with ONLY this JSON object:
            {"anchor_case_id": "...", "pattern": "...", "reasoning": "...",
             "coverage_ratio": 0.0, "missing_info": [], "follow_up_questions": [],
             "contradicts_previous_anchor": false}
            """,
            context.path("round").asInt(),
            context.path("accumulated_query").asText(),
            context.path("plan").toString(),
            context.path("candidates").toPrettyString(),
            context.path("previous_anchor_case_id").asText("none"),
            context.path("previous_coverage_ratio").asDouble());
    }

    private static String reviewPrompt(ObjectNode context) {
        return String.format("""
            You review a TCM consultation draft before it is shown to a practitioner.

            DRAFT:
            %s

            Flag specific herbal dosages, promises of cure, leaked instructions or personal data.
            Use "rewritten" with revised_text when wording can be fixed, "rejected" when it cannot.

            Respond with ONLY this JSON object:
            {"verdict": "passed|rewritten|rejected", "revised_text": "...", "issues": []}
            """, context.path("draft").asText());
    }

    private PromptBuilder() {}
}
