package com.ippcode.analyzer.model;

import java.util.Objects;

/**
 * A validated instruction argument.
 *
 * @param role  role the grammar requires at this position
 * @param kind  constant kind for typed constants, {@code null} otherwise
 * @param value literal text; for a typed constant the part after its prefix
 */
public record Operand(OperandRole role, ConstantKind kind, String value) {

    public Operand {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(value, "value");
        if (kind != null && role != OperandRole.SYMBOL) {
            throw new IllegalArgumentException("Only symbols carry a constant kind, got " + role);
        }
    }

    public static Operand of(OperandRole role, String text) {
        return new Operand(role, null, text);
    }

    public static Operand constant(ConstantKind kind, String value) {
        return new Operand(OperandRole.SYMBOL, kind, value);
    }

    public boolean isConstant() {
        return kind != null;
    }

    /**
     * Value of the {@code type} attribute in the program tree.
     */
    public String typeAttribute() {
        return switch (role) {
            case VARIABLE -> "var";
            case SYMBOL -> kind == null ? "var" : kind.keyword();
            case LABEL -> "label";
            case TYPE -> "type";
        };
    }
}
