package com.ippcode.analyzer.grammar;

public enum ControlFlow {
    NONE,
    LABEL_DECLARATION,
    /** Transfers control to the label in its first operand. */
    JUMP
}
