package com.scbr.security;

/**
 * SecurityVerdict - Pass with the sanitized text, or fail
 */
public final class SecurityVerdict {

    public final boolean passed;
    public final String sanitizedText;   // null on fail
    public final String reason;          // internal only, never shown to callers

    private SecurityVerdict(boolean passed, String sanitizedText, String reason) {
        this.passed = passed;
        this.sanitizedText = sanitizedText;
        this.reason = reason;
    }

    public static SecurityVerdict pass(String sanitizedText) {
        return new SecurityVerdict(true, sanitizedText, null);
    }

    public static SecurityVerdict fail(String reason) {
        return new SecurityVerdict(false, null, reason);
    }
}
