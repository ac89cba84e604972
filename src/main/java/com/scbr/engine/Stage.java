package com.scbr.engine;

/**
 * The four reasoning stages of a round, in their only legal order.
 */
public enum Stage {
    GATE,
    DIAGNOSE,
    REVIEW,
    PRESENT
}
