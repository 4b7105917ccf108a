package com.aether.binding;

/**
 * Result of a syntax check.
 *
 * @param valid whether the source parsed
 * @param message parser message when invalid
 * @param line 1-based line of the error, or 0 when unknown
 */
public record SyntaxCheck(
    boolean valid,
    String message,
    int line
) {

    private static final SyntaxCheck OK = new SyntaxCheck(true, null, 0);

    public static SyntaxCheck ok() {
        return OK;
    }

    public static SyntaxCheck failed(String message, int line) {
        return new SyntaxCheck(false, message, line);
    }
}
