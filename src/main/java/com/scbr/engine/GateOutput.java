package com.scbr.engine;

import com.scbr.model.RetrievalPlan;

/**
 * GateOutput - Scope decision and extracted plan for a round
 */
public final class GateOutput {

    public enum Action { PROCEED, REJECT, ASK_MORE }

    public final Action action;
    public final RetrievalPlan plan;
    public final String clarification;   // only meaningful for ASK_MORE
    public final String reason;
    public final boolean localFallback;

    public GateOutput(Action action, RetrievalPlan plan, String clarification, String reason, boolean localFallback) {
        this.action = action;
        this.plan = plan != null ? plan : RetrievalPlan.EMPTY;
        this.clarification = clarification;
        this.reason = reason;
        this.localFallback = localFallback;
    }

    @Override
    public String toString() {
        return String.format("GateOutput{%s, %s%s}", action, plan, localFallback ? ", local fallback" : "");
    }
}
