package com.ippcode.analyzer.model;

import java.util.List;

public record SourceLine(int lineNumber, List<Token> tokens) {

    public SourceLine {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("Source line " + lineNumber + " has no tokens");
        }
        tokens = List.copyOf(tokens);
    }

    public Token first() {
        return tokens.get(0);
    }

    public List<Token> operands() {
        return tokens.subList(1, tokens.size());
    }
}
