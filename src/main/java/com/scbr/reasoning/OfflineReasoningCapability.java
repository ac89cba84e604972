package com.scbr.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scbr.engine.Stage;
import com.scbr.model.RetrievalPlan;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * OfflineReasoningCapability - Lexicon-driven stand-in for the reasoning model.
 *
 * <p>Gate extracts terms and rejects obviously unrelated requests. Diagnose takes the best-ranked
 * candidate and estimates coverage from which information categories the query supplies.
 * Review passes everything through to the local content rules.</p>
 */
public class OfflineReasoningCapability implements ReasoningCapability {

    private static final Map<String, Double> CATEGORY_WEIGHTS = Map.of(
        TermLexicon.MISSING_SYMPTOMS, 0.30,
        TermLexicon.MISSING_TONGUE, 0.20,
        TermLexicon.MISSING_PULSE, 0.20,
        TermLexicon.MISSING_DURATION, 0.15,
        TermLexicon.MISSING_TRIGGERS, 0.15);

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public ReasoningResult call(Stage stage, ObjectNode context, Duration timeout) {
        return switch (stage) {
            case GATE -> ReasoningResult.ok(gate(context.path("accumulated_query").asText("")));
            case DIAGNOSE -> diagnose(context);
            case REVIEW -> ReasoningResult.ok(mapper.createObjectNode().put("verdict", "passed"));
            case PRESENT -> ReasoningResult.malformed("PRESENT is formatted locally");
        };
    }

    private ObjectNode gate(String query) {
        RetrievalPlan plan = TermLexicon.extractPlan(query);
        ObjectNode reply = mapper.createObjectNode();
        if (plan.isEmpty()) {
            if (TermLexicon.looksOutOfScope(query)) {
                reply.put("action", "reject");
                reply.put("reason", "not a clinical consultation");
            } else {
                reply.put("action", "ask_more");
                reply.put("reason", "no clinical terms found");
            }
            return reply;
        }
        reply.put("action", "proceed");
        plan.symptomTerms.forEach(reply.putArray("symptom_terms")::add);
        plan.tongueTerms.forEach(reply.putArray("tongue_terms")::add);
        plan.pulseTerms.forEach(reply.putArray("pulse_terms")::add);
        plan.zangfuTerms.forEach(reply.putArray("zangfu_terms")::add);
        return reply;
    }

    private ReasoningResult diagnose(ObjectNode context) {
        JsonNode candidates = context.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            return ReasoningResult.malformed("no candidates in context");
        }
        JsonNode anchor = candidates.get(0);
        String query = context.path("accumulated_query").asText("");
        JsonNode planNode = context.path("plan");
        RetrievalPlan plan = new RetrievalPlan(strings(planNode.path("symptom_terms")),
            strings(planNode.path("tongue_terms")), strings(planNode.path("pulse_terms")),
            strings(planNode.path("zangfu_terms")));

        List<String> missing = TermLexicon.missingCategories(query, plan);
        double coverage = 1.0;
        for (String category : missing) {
            coverage -= CATEGORY_WEIGHTS.getOrDefault(category, 0.0);
        }

        ObjectNode reply = mapper.createObjectNode();
        reply.put("anchor_case_id", anchor.path("case_id").asText());
        reply.put("pattern", anchor.path("pattern").asText());
        reply.put("reasoning", "依相似案例 " + anchor.path("case_id").asText() + " 的證候特徵比對："
            + String.join("、", plan.allTerms()));
        reply.put("coverage_ratio", Math.max(0.0, Math.round(coverage * 100) / 100.0));
        missing.forEach(reply.putArray("missing_info")::add);
        reply.put("contradicts_previous_anchor", false);
        return ReasoningResult.ok(reply);
    }

    private static Set<String> strings(JsonNode node) {
        Set<String> values = new LinkedHashSet<>();
        node.forEach(v -> values.add(v.asText()));
        return values;
    }

    @Override
    public String name() {
        return "Offline";
    }
}
