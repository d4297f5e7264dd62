package com.ippcode.analyzer.service;

import com.ippcode.analyzer.model.Instruction;
import com.ippcode.analyzer.model.ProgramTree;

import java.util.ArrayList;
import java.util.List;

public class ProgramTreeBuilder {

    private final String language;
    private final List<Instruction> instructions = new ArrayList<>();

    public ProgramTreeBuilder(String language) {
        this.language = language;
    }

    public void append(Instruction instruction) {
        instructions.add(instruction);
    }

    public int nextOrder() {
        return instructions.size() + 1;
    }

    public ProgramTree build() {
        return new ProgramTree(language, instructions);
    }
}
