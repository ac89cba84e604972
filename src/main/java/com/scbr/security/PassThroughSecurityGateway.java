package com.scbr.security;

/**
 * PassThroughSecurityGateway - Default gateway: trims input, rejects oversized or empty text.
 * Sanitization and PII masking belong to the deployment's own gateway.
 */
public class PassThroughSecurityGateway implements SecurityGateway {

    private final int maxInputLength;

    public PassThroughSecurityGateway(int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }

    @Override
    public SecurityVerdict checkInput(String sessionId, String text) {
        if (text == null || text.isBlank()) {
            return SecurityVerdict.fail("empty input");
        }
        if (text.length() > maxInputLength) {
            return SecurityVerdict.fail("input longer than " + maxInputLength + " characters");
        }
        return SecurityVerdict.pass(text.trim());
    }

    @Override
    public SecurityVerdict checkOutput(String sessionId, String text) {
        return text == null || text.isBlank()
            ? SecurityVerdict.fail("empty output")
            : SecurityVerdict.pass(text);
    }
}
