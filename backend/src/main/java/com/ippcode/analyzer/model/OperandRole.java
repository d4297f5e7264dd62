package com.ippcode.analyzer.model;

public enum OperandRole {
    /** Frame-qualified variable, {@code GF@name}. */
    VARIABLE,
    /** Variable or typed constant. */
    SYMBOL,
    LABEL,
    TYPE
}
