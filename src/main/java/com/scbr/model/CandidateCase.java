package com.scbr.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * CandidateCase - Common shape of every entry in a round's candidate list
 * Either a real corpus record or a virtual case synthesized from the query
 */
public abstract class CandidateCase {

    public final String caseId;
    public final String patternLabel;       // diagnosis / syndrome pattern, e.g. 心脾兩虛
    public final String chiefComplaint;
    public final String summaryText;
    public final Set<String> symptomTerms;
    public final Set<String> tonguePulseTerms;
    public final Set<String> zangfuTerms;
    public final String domain;
    public final double similarity;
    public final double lexical;
    public final double blendedScore;

    protected CandidateCase(String caseId, String patternLabel, String chiefComplaint, String summaryText,
                            Set<String> symptomTerms, Set<String> tonguePulseTerms, Set<String> zangfuTerms,
                            String domain, double similarity, double lexical, double blendedScore) {
        this.caseId = caseId;
        this.patternLabel = patternLabel;
        this.chiefComplaint = chiefComplaint != null ? chiefComplaint : "";
        this.summaryText = summaryText != null ? summaryText : "";
        this.symptomTerms = copy(symptomTerms);
        this.tonguePulseTerms = copy(tonguePulseTerms);
        this.zangfuTerms = copy(zangfuTerms);
        this.domain = domain;
        this.similarity = similarity;
        this.lexical = lexical;
        this.blendedScore = blendedScore;
    }

    public abstract boolean isVirtual();

    /**
     * True when any of this case's term sets shares a term with the given terms.
     */
    public boolean overlaps(Set<String> terms) {
        for (String term : terms) {
            if (symptomTerms.contains(term) || tonguePulseTerms.contains(term) || zangfuTerms.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> copy(Set<String> terms) {
        return terms == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(terms));
    }

    @Override
    public String toString() {
        return String.format("%s{id='%s', pattern='%s', domain=%s, score=%.3f}",
            getClass().getSimpleName(), caseId, patternLabel, domain, blendedScore);
    }
}
