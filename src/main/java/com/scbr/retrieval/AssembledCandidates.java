package com.scbr.retrieval;

import com.scbr.model.CandidateCase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AssembledCandidates - Ordered candidate list for one round plus the notes of how it was built
 */
public final class AssembledCandidates {

    public final List<CandidateCase> candidates;
    public final List<String> notes;
    public final String queryDomain;
    public final boolean retrievalEmpty;
    public final boolean virtualInjected;

    public AssembledCandidates(List<CandidateCase> candidates, List<String> notes, String queryDomain,
                               boolean retrievalEmpty, boolean virtualInjected) {
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
        this.queryDomain = queryDomain;
        this.retrievalEmpty = retrievalEmpty;
        this.virtualInjected = virtualInjected;
    }

    public static AssembledCandidates empty(List<String> notes, String queryDomain) {
        return new AssembledCandidates(List.of(), notes, queryDomain, true, false);
    }
}
