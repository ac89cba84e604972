package com.scbr.engine;

/**
 * What a stage reported when it finished; together with the stage it picks the next step.
 */
public enum StageOutcome {
    PROCEED,
    REJECT,
    ASK_MORE,
    SECURITY_FAIL,
    RETRIEVAL_EMPTY,
    DIAGNOSED,
    DIAGNOSED_DEGRADED,
    PASSED,
    REWRITTEN,
    REVIEW_REJECTED,
    PRESENTED
}
