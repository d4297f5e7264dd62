package com.ippcode.analyzer.service;

import com.ippcode.analyzer.config.AnalyzerProperties;
import com.ippcode.analyzer.exception.ErrorCategory;
import com.ippcode.analyzer.exception.SourceAnalysisException;
import com.ippcode.analyzer.grammar.GrammarEntry;
import com.ippcode.analyzer.grammar.GrammarTable;
import com.ippcode.analyzer.model.Instruction;
import com.ippcode.analyzer.model.Operand;
import com.ippcode.analyzer.model.SourceLine;
import com.ippcode.analyzer.model.Token;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one token line into a validated {@link Instruction}.
 */
@Component
public class InstructionClassifier {

    private final AnalyzerProperties properties;
    private final OperandValidator operandValidator;

    public InstructionClassifier(AnalyzerProperties properties, OperandValidator operandValidator) {
        this.properties = properties;
        this.operandValidator = operandValidator;
    }

    public Instruction classify(SourceLine line, int order) throws SourceAnalysisException {
        GrammarEntry entry = resolveEntry(line.first());

        List<Token> operandTokens = line.operands();
        if (operandTokens.size() != entry.arity()) {
            throw new SourceAnalysisException(ErrorCategory.ARITY_MISMATCH, line.lineNumber(),
                    entry.opcode() + " expects " + entry.arity() + " operand(s) but got " + operandTokens.size());
        }

        List<Operand> operands = new ArrayList<>(entry.arity());
        for (int position = 0; position < entry.arity(); position++) {
            operands.add(operandValidator.validate(entry.opcode(), entry.roleAt(position),
                    operandTokens.get(position)));
        }

        return new Instruction(order, entry.opcode(), operands, line.lineNumber());
    }

    public GrammarEntry resolveEntry(Token opcode) throws SourceAnalysisException {
        if (opcode.text().equalsIgnoreCase(properties.header())) {
            throw new SourceAnalysisException(ErrorCategory.UNEXPECTED_HEADER, opcode.line(),
                    "Header " + properties.header() + " may appear only once");
        }

        return GrammarTable.lookup(opcode.text())
            .orElseThrow(() -> new SourceAnalysisException(ErrorCategory.UNKNOWN_OPCODE, opcode.line(),
                    "Unknown or incorrect opcode '" + opcode.text() + "'"));
    }
}
