package com.scbr.engine;

public enum RoundStatus {
    COMPLETED,
    SCOPE_REJECTED,
    ASK_MORE,
    SECURITY_REJECTED,
    RETRIEVAL_EMPTY,
    REVIEW_REJECTED,
    /** The session was reset or evicted while the round ran; nothing was recorded. */
    SESSION_CHANGED
}
