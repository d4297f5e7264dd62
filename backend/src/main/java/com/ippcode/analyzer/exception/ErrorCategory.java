package com.ippcode.analyzer.exception;

/**
 * Reasons a source text is rejected. Each category maps to a stable exit code so
 * callers can tell them apart without reading the message.
 */
public enum ErrorCategory {
    MISSING_OR_INVALID_HEADER(21),
    UNKNOWN_OPCODE(22),
    ARITY_MISMATCH(23),
    INVALID_OPERAND_SYNTAX(23),
    INVALID_ESCAPE_SEQUENCE(23),
    UNKNOWN_TYPE_KEYWORD(23),
    /**
     * Header token repeated in opcode position. Kept apart from {@link #UNKNOWN_OPCODE}, which
     * would otherwise cover it, because it leaves with 23 rather than 22.
     */
    UNEXPECTED_HEADER(23);

    private final int exitCode;

    ErrorCategory(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
