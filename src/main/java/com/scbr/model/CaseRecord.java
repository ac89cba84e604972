package com.scbr.model;

import java.util.Set;

/**
 * CaseRecord - Transient copy of a corpus case returned by hybrid search
 */
public final class CaseRecord extends CandidateCase {

    public final String sourceField;   // retrieval field that produced this hit

    public CaseRecord(String caseId, String patternLabel, String chiefComplaint, String summaryText,
                      Set<String> symptomTerms, Set<String> tonguePulseTerms, Set<String> zangfuTerms,
                      String domain, double similarity, double lexical, double blendedScore,
                      String sourceField) {
        super(caseId, patternLabel, chiefComplaint, summaryText, symptomTerms, tonguePulseTerms,
            zangfuTerms, domain, similarity, lexical, blendedScore);
        this.sourceField = sourceField;
    }

    @Override
    public boolean isVirtual() {
        return false;
    }
}
