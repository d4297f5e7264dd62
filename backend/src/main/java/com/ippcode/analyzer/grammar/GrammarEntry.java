package com.ippcode.analyzer.grammar;

import java.util.List;

import com.ippcode.analyzer.model.OperandRole;

public record GrammarEntry(String opcode, List<OperandRole> roles, ControlFlow flow) {

    public GrammarEntry {
        roles = List.copyOf(roles);
    }

    public int arity() {
        return roles.size();
    }

    public OperandRole roleAt(int position) {
        return roles.get(position);
    }

    public boolean isJump() {
        return flow == ControlFlow.JUMP;
    }

    public boolean isLabelDeclaration() {
        return flow == ControlFlow.LABEL_DECLARATION;
    }
}
