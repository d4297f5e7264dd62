package com.ippcode.analyzer.exception;

public class SourceAnalysisException extends Exception {

    private final ErrorCategory category;
    private final int line;

    public SourceAnalysisException(ErrorCategory category, int line, String message) {
        super(message);
        this.category = category;
        this.line = line;
    }

    public SourceAnalysisException(ErrorCategory category, int line, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.line = line;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /** 1-based source line, or 0 when the error is not tied to a line. */
    public int getLine() {
        return line;
    }

    public int getExitCode() {
        return category.exitCode();
    }
}
