package com.ippcode.analyzer.exception;

public class ArgumentsException extends Exception {

    public static final int INVALID_ARGUMENTS = 10;
    public static final int INPUT_FILE_ERROR = 11;
    public static final int OUTPUT_FILE_ERROR = 12;

    private final int exitCode;

    public ArgumentsException(int exitCode, String message) {
        super(message);
        this.exitCode = exitCode;
    }

    public ArgumentsException(int exitCode, String message, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
