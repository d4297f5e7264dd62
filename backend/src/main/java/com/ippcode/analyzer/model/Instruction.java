package com.ippcode.analyzer.model;

import java.util.List;

public record Instruction(int order, String opcode, List<Operand> operands, int line) {

    public Instruction {
        operands = List.copyOf(operands);
    }

    public Operand operand(int index) {
        return operands.get(index);
    }
}
