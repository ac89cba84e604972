package com.scbr.model;

/**
 * VirtualCase - Candidate synthesized in memory from the live query and plan terms
 * Only ever lives inside one round's candidate list; never persisted.
 */
public final class VirtualCase extends CandidateCase {

    public static final String VIRTUAL_CASE_ID = "VIRTUAL_THEORY_CASE";
    public static final String PENDING_PATTERN = "待定(依症狀推斷)";

    private VirtualCase(String chiefComplaint, String summaryText, RetrievalPlan plan, String domain) {
        super(VIRTUAL_CASE_ID, PENDING_PATTERN, chiefComplaint, summaryText,
            plan.symptomTerms, plan.tonguePulseTerms(), plan.zangfuTerms,
            domain, 0.0, 0.0, 0.0);
    }

    public static VirtualCase synthesize(String accumulatedQuery, RetrievalPlan plan, String domain) {
        String complaint = accumulatedQuery.length() > 120
            ? accumulatedQuery.substring(0, 120) + "..."
            : accumulatedQuery;
        String summary = "No corpus case shares a term with this query; reasoning proceeds from the "
            + "supplied findings: " + String.join("、", plan.allTerms());
        return new VirtualCase(complaint, summary, plan, domain);
    }

    @Override
    public boolean isVirtual() {
        return true;
    }
}
