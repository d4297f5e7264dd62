package com.ippcode.analyzer.model;

import java.util.List;

/**
 * Validated instructions in source order.
 */
public record ProgramTree(String language, List<Instruction> instructions) {

    public ProgramTree {
        instructions = List.copyOf(instructions);
    }

    public int size() {
        return instructions.size();
    }
}
