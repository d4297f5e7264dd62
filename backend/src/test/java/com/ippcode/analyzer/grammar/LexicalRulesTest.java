package com.ippcode.analyzer.grammar;

import com.ippcode.analyzer.model.ConstantKind;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LexicalRulesTest {

    @Test
    void identifiersAllowSpecialCharacters() {
        assertThat(LexicalRules.isIdentifier("counter")).isTrue();
        assertThat(LexicalRules.isIdentifier("_tmp-1")).isTrue();
        assertThat(LexicalRules.isIdentifier("$&%*!?")).isTrue();
        assertThat(LexicalRules.isIdentifier("1abc")).isFalse();
        assertThat(LexicalRules.isIdentifier("a.b")).isFalse();
        assertThat(LexicalRules.isIdentifier("")).isFalse();
    }

    @Test
    void variablesNeedKnownFrameAndSingleAt() {
        assertThat(LexicalRules.isVariable("GF@x")).isTrue();
        assertThat(LexicalRules.isVariable("LF@_y")).isTrue();
        assertThat(LexicalRules.isVariable("TF@z9")).isTrue();
        assertThat(LexicalRules.isVariable("gf@x")).isFalse();
        assertThat(LexicalRules.isVariable("XF@x")).isFalse();
        assertThat(LexicalRules.isVariable("GF@")).isFalse();
        assertThat(LexicalRules.isVariable("GF@a@b")).isFalse();
        assertThat(LexicalRules.isVariable("x")).isFalse();
    }

    @Test
    void typeKeywordsAreCaseSensitive() {
        assertThat(LexicalRules.isTypeKeyword("int")).isTrue();
        assertThat(LexicalRules.isTypeKeyword("float")).isTrue();
        assertThat(LexicalRules.isTypeKeyword("Int")).isFalse();
        assertThat(LexicalRules.isTypeKeyword("label")).isFalse();
    }

    @Test
    void integerLiterals() {
        assertThat(LexicalRules.isConstantValue(ConstantKind.INT, "42")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.INT, "-7")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.INT, "+0x1F")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.INT, "0o17")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.INT, "0o18")).isFalse();
        assertThat(LexicalRules.isConstantValue(ConstantKind.INT, "")).isFalse();
        assertThat(LexicalRules.isConstantValue(ConstantKind.INT, "1.5")).isFalse();
    }

    @Test
    void booleanAndNilLiterals() {
        assertThat(LexicalRules.isConstantValue(ConstantKind.BOOL, "true")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.BOOL, "false")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.BOOL, "TRUE")).isFalse();
        assertThat(LexicalRules.isConstantValue(ConstantKind.NIL, "nil")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.NIL, "")).isFalse();
    }

    @Test
    void floatLiterals() {
        assertThat(LexicalRules.isConstantValue(ConstantKind.FLOAT, "0x1.8p+1")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.FLOAT, "-0x.8p-3")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.FLOAT, "1.5")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.FLOAT, "2e10")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.FLOAT, "0x")).isFalse();
        assertThat(LexicalRules.isConstantValue(ConstantKind.FLOAT, "abc")).isFalse();
    }

    @Test
    void stringLiteralsRejectQuotesAndHashes() {
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "a@b<>&")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "say\"hi")).isFalse();
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "a#b")).isFalse();
    }

    @Test
    void stringLiteralsRejectRawControlCharacters() {
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "a\u0001b")).isFalse();
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "tab\there")).isFalse();
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "\u001f")).isFalse();
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "escaped\\001")).isTrue();
        assertThat(LexicalRules.isConstantValue(ConstantKind.STRING, "\u017elu\u0165")).isTrue();
    }
}
