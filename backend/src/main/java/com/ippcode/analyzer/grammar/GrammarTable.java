package com.ippcode.analyzer.grammar;

import static com.ippcode.analyzer.model.OperandRole.LABEL;
import static com.ippcode.analyzer.model.OperandRole.SYMBOL;
import static com.ippcode.analyzer.model.OperandRole.TYPE;
import static com.ippcode.analyzer.model.OperandRole.VARIABLE;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.ippcode.analyzer.model.OperandRole;

/**
 * The IPPcode24 instruction set: every opcode with the roles of its operands.
 * Lookup ignores case.
 */
public final class GrammarTable {

    private static final Map<String, GrammarEntry> ENTRIES = build();

    private GrammarTable() {
    }

    public static Optional<GrammarEntry> lookup(String opcode) {
        if (opcode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ENTRIES.get(opcode.toUpperCase(Locale.ROOT)));
    }

    public static Set<String> opcodes() {
        return ENTRIES.keySet();
    }

    private static Map<String, GrammarEntry> build() {
        Map<String, GrammarEntry> entries = new LinkedHashMap<>();

        // frames, calls
        add(entries, "MOVE", VARIABLE, SYMBOL);
        add(entries, "CREATEFRAME");
        add(entries, "PUSHFRAME");
        add(entries, "POPFRAME");
        add(entries, "DEFVAR", VARIABLE);
        jump(entries, "CALL", LABEL);
        add(entries, "RETURN");

        // data stack
        add(entries, "PUSHS", SYMBOL);
        add(entries, "POPS", VARIABLE);

        // arithmetic, relational, boolean, conversion
        add(entries, "ADD", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "SUB", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "MUL", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "IDIV", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "DIV", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "LT", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "GT", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "EQ", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "AND", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "OR", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "NOT", VARIABLE, SYMBOL);
        add(entries, "INT2CHAR", VARIABLE, SYMBOL);
        add(entries, "STRI2INT", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "INT2FLOAT", VARIABLE, SYMBOL);
        add(entries, "FLOAT2INT", VARIABLE, SYMBOL);

        // input/output
        add(entries, "READ", VARIABLE, TYPE);
        add(entries, "WRITE", SYMBOL);

        // strings
        add(entries, "CONCAT", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "STRLEN", VARIABLE, SYMBOL);
        add(entries, "GETCHAR", VARIABLE, SYMBOL, SYMBOL);
        add(entries, "SETCHAR", VARIABLE, SYMBOL, SYMBOL);

        // types
        add(entries, "TYPE", VARIABLE, SYMBOL);

        // control flow
        entries.put("LABEL", new GrammarEntry("LABEL", List.of(LABEL), ControlFlow.LABEL_DECLARATION));
        jump(entries, "JUMP", LABEL);
        jump(entries, "JUMPIFEQ", LABEL, SYMBOL, SYMBOL);
        jump(entries, "JUMPIFNEQ", LABEL, SYMBOL, SYMBOL);
        add(entries, "EXIT", SYMBOL);

        // debugging
        add(entries, "DPRINT", SYMBOL);
        add(entries, "BREAK");

        return Map.copyOf(entries);
    }

    private static void add(Map<String, GrammarEntry> entries, String opcode, OperandRole... roles) {
        entries.put(opcode, new GrammarEntry(opcode, List.of(roles), ControlFlow.NONE));
    }

    private static void jump(Map<String, GrammarEntry> entries, String opcode, OperandRole... roles) {
        entries.put(opcode, new GrammarEntry(opcode, List.of(roles), ControlFlow.JUMP));
    }
}
