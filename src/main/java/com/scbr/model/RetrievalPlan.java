package com.scbr.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * RetrievalPlan - Term sets extracted by the Gate stage
 * Drives domain overlap checks, case scoring and virtual case synthesis
 */
public final class RetrievalPlan {

    public static final RetrievalPlan EMPTY = new RetrievalPlan(Set.of(), Set.of(), Set.of(), Set.of());

    public final Set<String> symptomTerms;
    public final Set<String> tongueTerms;
    public final Set<String> pulseTerms;
    public final Set<String> zangfuTerms;

    public RetrievalPlan(Set<String> symptomTerms, Set<String> tongueTerms,
                         Set<String> pulseTerms, Set<String> zangfuTerms) {
        this.symptomTerms = freeze(symptomTerms);
        this.tongueTerms = freeze(tongueTerms);
        this.pulseTerms = freeze(pulseTerms);
        this.zangfuTerms = freeze(zangfuTerms);
    }

    /**
     * Tongue and pulse terms as one set, the shape case records carry them in.
     */
    public Set<String> tonguePulseTerms() {
        Set<String> merged = new LinkedHashSet<>(tongueTerms);
        merged.addAll(pulseTerms);
        return Collections.unmodifiableSet(merged);
    }

    public Set<String> allTerms() {
        Set<String> all = new LinkedHashSet<>(symptomTerms);
        all.addAll(tongueTerms);
        all.addAll(pulseTerms);
        all.addAll(zangfuTerms);
        return Collections.unmodifiableSet(all);
    }

    public boolean isEmpty() {
        return symptomTerms.isEmpty() && tongueTerms.isEmpty()
            && pulseTerms.isEmpty() && zangfuTerms.isEmpty();
    }

    private static Set<String> freeze(Set<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return Set.of();
        }
        Set<String> cleaned = new LinkedHashSet<>();
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                cleaned.add(term.trim());
            }
        }
        return Collections.unmodifiableSet(cleaned);
    }

    @Override
    public String toString() {
        return String.format("RetrievalPlan{symptoms=%s, tongue=%s, pulse=%s, zangfu=%s}",
            symptomTerms, tongueTerms, pulseTerms, zangfuTerms);
    }
}
