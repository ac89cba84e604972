package com.scbr.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.scbr.model.CaseRecord;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * CaseRecordMapper - Converts raw search records into {@link CaseRecord}s.
 * A record without a case id or pattern label, or with a non-numeric score, maps to empty.
 */
public class CaseRecordMapper {

    private final DomainClassifier classifier;

    public CaseRecordMapper(DomainClassifier classifier) {
        this.classifier = classifier;
    }

    public Optional<CaseRecord> map(JsonNode node, String sourceField) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String caseId = text(node, "case_id");
        String pattern = text(node, "pattern");
        if (pattern.isEmpty()) {
            pattern = text(node, "diagnosis");
        }
        if (caseId.isEmpty() || pattern.isEmpty()) {
            return Optional.empty();
        }

        Double similarity = score(node, "similarity");
        Double lexical = score(node, "lexical");
        Double blended = score(node, "score");
        if (similarity == null || lexical == null || blended == null) {
            return Optional.empty();
        }

        String chiefComplaint = text(node, "chief_complaint");
        String presentIllness = text(node, "present_illness");
        String summary = text(node, "summary");
        String domain = text(node, "domain");
        if (domain.isEmpty()) {
            domain = classifier.classify(chiefComplaint + presentIllness + summary + pattern);
        }

        return Optional.of(new CaseRecord(caseId, pattern, chiefComplaint,
            summary.isEmpty() ? presentIllness : summary,
            terms(node, "symptom_terms"), terms(node, "tongue_pulse_terms"), terms(node, "zangfu_terms"),
            domain, similarity, lexical, blended, sourceField));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() ? value.asText("").trim() : "";
    }

    /** Missing scores default to 0; present but non-numeric scores are malformed (null). */
    private static Double score(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return 0.0;
        }
        return value.isNumber() ? value.asDouble() : null;
    }

    private static Set<String> terms(JsonNode node, String field) {
        Set<String> terms = new LinkedHashSet<>();
        JsonNode value = node.get(field);
        if (value == null) {
            return terms;
        }
        if (value.isArray()) {
            value.forEach(term -> {
                if (!term.asText("").isBlank()) terms.add(term.asText().trim());
            });
        } else if (value.isTextual()) {
            for (String term : value.asText().split("[,，、\\s]+")) {
                if (!term.isBlank()) terms.add(term.trim());
            }
        }
        return terms;
    }
}
