package com.ippcode.analyzer.grammar;

import java.util.Set;
import java.util.regex.Pattern;

import com.ippcode.analyzer.model.ConstantKind;

/**
 * Lexical predicates of IPPcode24 operands. All methods are pure.
 */
public final class LexicalRules {

    public static final Set<String> FRAMES = Set.of("GF", "LF", "TF");

    public static final Set<String> TYPE_KEYWORDS = Set.of("int", "bool", "string", "nil", "float");

    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("[A-Za-z_\\-&%*$!?][A-Za-z0-9_\\-&%*$!?]*");

    private static final Pattern DECIMAL_INT_PATTERN = Pattern.compile("[-+]?[0-9]+");
    private static final Pattern HEX_INT_PATTERN = Pattern.compile("[-+]?0[xX][0-9A-Fa-f]+");
    private static final Pattern OCTAL_INT_PATTERN = Pattern.compile("[-+]?0[oO][0-7]+");

    private static final Pattern HEX_FLOAT_PATTERN = Pattern.compile(
            "[-+]?0[xX](?:[0-9A-Fa-f]+(?:\\.[0-9A-Fa-f]*)?|\\.[0-9A-Fa-f]+)(?:[pP][-+]?[0-9]+)?");
    private static final Pattern DECIMAL_FLOAT_PATTERN = Pattern.compile(
            "[-+]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][-+]?[0-9]+)?");

    private LexicalRules() {
    }

    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER_PATTERN.matcher(text).matches();
    }

    public static boolean isLabel(String text) {
        return isIdentifier(text);
    }

    /** {@code GF@name}, {@code LF@name} or {@code TF@name}, with exactly one {@code @}. */
    public static boolean isVariable(String text) {
        if (text == null) {
            return false;
        }
        int at = text.indexOf('@');
        if (at < 0 || text.indexOf('@', at + 1) >= 0) {
            return false;
        }
        return FRAMES.contains(text.substring(0, at)) && isIdentifier(text.substring(at + 1));
    }

    public static boolean isTypeKeyword(String text) {
        return TYPE_KEYWORDS.contains(text);
    }

    /**
     * Checks the value part of a typed constant. String escapes are checked
     * separately by {@link EscapeSequenceScanner}.
     */
    public static boolean isConstantValue(ConstantKind kind, String value) {
        return switch (kind) {
            case INT -> isIntegerLiteral(value);
            case BOOL -> "true".equals(value) || "false".equals(value);
            case NIL -> "nil".equals(value);
            case FLOAT -> isFloatLiteral(value);
            case STRING -> isStringLiteral(value);
        };
    }

    public static boolean isIntegerLiteral(String value) {
        return DECIMAL_INT_PATTERN.matcher(value).matches()
            || HEX_INT_PATTERN.matcher(value).matches()
            || OCTAL_INT_PATTERN.matcher(value).matches();
    }

    public static boolean isFloatLiteral(String value) {
        return HEX_FLOAT_PATTERN.matcher(value).matches()
            || DECIMAL_FLOAT_PATTERN.matcher(value).matches();
    }

    /**
     * Character-level rule only. Control characters (below 0x20) must be written
     * as {@code \ddd} escapes.
     */
    public static boolean isStringLiteral(String value) {
        for (int index = 0; index < value.length(); index++) {
            char c = value.charAt(index);
            if (c < 0x20 || c == '"' || c == '#') {
                return false;
            }
        }
        return true;
    }
}
