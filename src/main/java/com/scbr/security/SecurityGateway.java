package com.scbr.security;

/**
 * SecurityGateway - Pre- and post-checks owned outside the reasoning engine.
 * A failed verdict ends the round and is never retried.
 */
public interface SecurityGateway {

    SecurityVerdict checkInput(String sessionId, String text);

    SecurityVerdict checkOutput(String sessionId, String text);
}
