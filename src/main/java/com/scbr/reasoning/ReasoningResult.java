package com.scbr.reasoning;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * ReasoningResult - Either a JSON reply or one of three failure signals
 */
public final class ReasoningResult {

    public enum Failure { TIMEOUT, MALFORMED, UNAVAILABLE }

    public final JsonNode body;        // null on failure
    public final Failure failure;      // null on success
    public final String detail;

    private ReasoningResult(JsonNode body, Failure failure, String detail) {
        this.body = body;
        this.failure = failure;
        this.detail = detail;
    }

    public static ReasoningResult ok(JsonNode body) {
        return new ReasoningResult(body, null, null);
    }

    public static ReasoningResult failed(Failure failure, String detail) {
        return new ReasoningResult(null, failure, detail);
    }

    public static ReasoningResult timeout(String detail) {
        return failed(Failure.TIMEOUT, detail);
    }

    public static ReasoningResult malformed(String detail) {
        return failed(Failure.MALFORMED, detail);
    }

    public static ReasoningResult unavailable(String detail) {
        return failed(Failure.UNAVAILABLE, detail);
    }

    public boolean isOk() {
        return failure == null;
    }

    @Override
    public String toString() {
        return isOk() ? "ok" : failure + ": " + detail;
    }
}
