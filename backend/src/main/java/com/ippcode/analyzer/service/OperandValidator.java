package com.ippcode.analyzer.service;

import com.ippcode.analyzer.exception.ErrorCategory;
import com.ippcode.analyzer.exception.SourceAnalysisException;
import com.ippcode.analyzer.grammar.EscapeSequenceScanner;
import com.ippcode.analyzer.grammar.LexicalRules;
import com.ippcode.analyzer.model.ConstantKind;
import com.ippcode.analyzer.model.Operand;
import com.ippcode.analyzer.model.OperandRole;
import com.ippcode.analyzer.model.Token;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Checks one operand token against the role the grammar requires at its position.
 * <p>
 * The role decides how a token is read. A bare {@code int} is a label in a label
 * position and a type in a type position; the text never changes the role.
 */
@Component
public class OperandValidator {

    public Operand validate(String opcode, OperandRole role, Token token) throws SourceAnalysisException {
        String text = token.text();

        return switch (role) {
            case VARIABLE -> {
                if (!LexicalRules.isVariable(text)) {
                    throw invalid(opcode, token, "variable");
                }
                yield Operand.of(OperandRole.VARIABLE, text);
            }
            case LABEL -> {
                if (!LexicalRules.isLabel(text)) {
                    throw invalid(opcode, token, "label");
                }
                yield Operand.of(OperandRole.LABEL, text);
            }
            case TYPE -> {
                if (!LexicalRules.isTypeKeyword(text)) {
                    throw new SourceAnalysisException(ErrorCategory.UNKNOWN_TYPE_KEYWORD, token.line(),
                            opcode + ": '" + text + "' is not a type, expected one of "
                            + LexicalRules.TYPE_KEYWORDS);
                }
                yield Operand.of(OperandRole.TYPE, text);
            }
            case SYMBOL -> validateSymbol(opcode, token);
        };
    }

    private Operand validateSymbol(String opcode, Token token) throws SourceAnalysisException {
        String text = token.text();
        if (LexicalRules.isVariable(text)) {
            return Operand.of(OperandRole.SYMBOL, text);
        }

        int at = text.indexOf('@');
        if (at < 0) {
            throw invalid(opcode, token, "symbol");
        }

        Optional<ConstantKind> kind = ConstantKind.fromKeyword(text.substring(0, at));
        if (kind.isEmpty()) {
            throw invalid(opcode, token, "symbol");
        }

        String value = text.substring(at + 1);
        if (kind.get() == ConstantKind.STRING) {
            int position = EscapeSequenceScanner.findInvalidEscape(value);
            if (position >= 0) {
                throw new SourceAnalysisException(ErrorCategory.INVALID_ESCAPE_SEQUENCE, token.line(),
                        opcode + ": invalid escape sequence at position " + position + " of '" + text + "'");
            }
        }
        if (!LexicalRules.isConstantValue(kind.get(), value)) {
            throw invalid(opcode, token, kind.get().keyword() + " constant");
        }

        return Operand.constant(kind.get(), value);
    }

    private SourceAnalysisException invalid(String opcode, Token token, String expected) {
        return new SourceAnalysisException(ErrorCategory.INVALID_OPERAND_SYNTAX, token.line(),
                opcode + ": '" + token.text() + "' is not a valid " + expected);
    }
}
