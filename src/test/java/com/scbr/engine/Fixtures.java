package com.scbr.engine;

import com.scbr.model.CaseRecord;
import com.typesafe.config.ConfigFactory;

import java.util.Set;

/**
 * Shared builders for engine tests.
 */
final class Fixtures {

    static SpiralConfig config() {
        return new SpiralConfig(ConfigFactory.load());
    }

    static CaseRecord caseRecord(String id, String pattern, double similarity,
                                 Set<String> symptoms, Set<String> tonguePulse) {
        return new CaseRecord(id, pattern, "", "", symptoms, tonguePulse, Set.of(), "general",
            similarity, similarity, similarity, "symptom_terms");
    }

    static ScoredCandidate scored(String id, String pattern, boolean compound, double specificity, double total) {
        return new ScoredCandidate(caseRecord(id, pattern, 0.5, Set.of(), Set.of()),
            0.5, 0.0, 0.0, specificity, compound, total);
    }

    private Fixtures() {}
}
