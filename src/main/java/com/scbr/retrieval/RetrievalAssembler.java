package com.scbr.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.scbr.model.CandidateCase;
import com.scbr.model.CaseRecord;
import com.scbr.model.RetrievalPlan;
import com.scbr.model.VirtualCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * RetrievalAssembler - Turns the accumulated query into at most N ranked candidates.
 *
 * <ol>
 *   <li>field fallback: the first field with a well-formed hit becomes the primary source</li>
 *   <li>backfill from later fields, deduplicated by case id, until N</li>
 *   <li>stable reorder so same-domain cases come first, relaxed when none match</li>
 *   <li>virtual case in front when no candidate shares a term with the plan</li>
 * </ol>
 */
public class RetrievalAssembler {

    private static final Logger log = LoggerFactory.getLogger(RetrievalAssembler.class);

    private final HybridSearchCapability search;
    private final DomainClassifier classifier;
    private final CaseRecordMapper mapper;

    public RetrievalAssembler(HybridSearchCapability search, DomainClassifier classifier) {
        this.search = search;
        this.classifier = classifier;
        this.mapper = new CaseRecordMapper(classifier);
    }

    public AssembledCandidates assemble(String accumulatedQuery, RetrievalPlan plan,
                                        List<String> fallbackFields, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("candidate count must be at least 1, got " + n);
        }
        List<String> notes = new ArrayList<>();
        Map<String, CaseRecord> collected = new LinkedHashMap<>();
        String primaryField = null;

        for (String field : fallbackFields) {
            List<CaseRecord> wellFormed = fetch(accumulatedQuery, field, n, notes);

            if (primaryField == null) {
                if (wellFormed.isEmpty()) {
                    notes.add("field fallback: '" + field + "' yielded no well-formed records");
                    continue;
                }
                primaryField = field;
                notes.add("primary field: '" + field + "' (" + wellFormed.size() + " records)");
            } else {
                int before = collected.size();
                addDeduplicated(collected, wellFormed, n);
                notes.add("backfill from '" + field + "': +" + (collected.size() - before));
                if (collected.size() >= n) break;
                continue;
            }

            addDeduplicated(collected, wellFormed, n);
            if (collected.size() >= n) break;
        }

        String queryDomain = classifier.classify(accumulatedQuery);

        if (collected.isEmpty() && plan.isEmpty()) {
            notes.add("retrieval empty: all fields exhausted and no plan terms to synthesize from");
            log.info("🔍 Retrieval empty for query '{}'", abbreviate(accumulatedQuery));
            return AssembledCandidates.empty(notes, queryDomain);
        }

        List<CandidateCase> ordered = orderByDomain(new ArrayList<>(collected.values()), queryDomain, notes);

        boolean inject = !plan.isEmpty() && noneOverlap(ordered, plan.allTerms());
        if (inject) {
            List<CandidateCase> withVirtual = new ArrayList<>();
            withVirtual.add(VirtualCase.synthesize(accumulatedQuery, plan, queryDomain));
            withVirtual.addAll(ordered.subList(0, Math.min(ordered.size(), n - 1)));
            ordered = withVirtual;
            notes.add("virtual case injected");
        }

        if (ordered.size() > n) {
            ordered = new ArrayList<>(ordered.subList(0, n));
        }
        log.debug("🔍 Assembled {} candidate(s), domain={}, virtual={}", ordered.size(), queryDomain, inject);
        return new AssembledCandidates(ordered, notes, queryDomain, false, inject);
    }

    private List<CaseRecord> fetch(String query, String field, int n, List<String> notes) {
        List<JsonNode> raw;
        try {
            raw = search.search(query, field, n);
        } catch (IOException e) {
            log.warn("⚠️ Search on field '{}' failed: {}", field, e.getMessage());
            notes.add("search error on '" + field + "': " + e.getMessage());
            return List.of();
        }
        if (raw == null) {
            return List.of();
        }

        List<CaseRecord> records = new ArrayList<>();
        int discarded = 0;
        for (JsonNode node : raw) {
            Optional<CaseRecord> record = mapper.map(node, field);
            if (record.isPresent()) {
                records.add(record.get());
            } else {
                discarded++;
            }
        }
        if (discarded > 0) {
            notes.add("discarded " + discarded + " malformed record(s) from '" + field + "'");
        }
        return records;
    }

    private static void addDeduplicated(Map<String, CaseRecord> collected, List<CaseRecord> records, int n) {
        for (CaseRecord record : records) {
            if (collected.size() >= n) return;
            collected.putIfAbsent(record.caseId, record);
        }
    }

    private static List<CandidateCase> orderByDomain(List<CaseRecord> records, String domain, List<String> notes) {
        List<CandidateCase> same = new ArrayList<>();
        List<CandidateCase> other = new ArrayList<>();
        for (CaseRecord record : records) {
            (domain.equals(record.domain) ? same : other).add(record);
        }
        if (same.isEmpty()) {
            if (!records.isEmpty()) {
                notes.add("domain relaxed: no candidate tagged '" + domain + "'");
            }
            return new ArrayList<>(records);
        }
        same.addAll(other);
        return same;
    }

    private static boolean noneOverlap(List<CandidateCase> candidates, Set<String> planTerms) {
        for (CandidateCase candidate : candidates) {
            if (candidate.overlaps(planTerms)) {
                return false;
            }
        }
        return true;
    }

    private static String abbreviate(String text) {
        return text.length() > 40 ? text.substring(0, 40) + "..." : text;
    }
}
