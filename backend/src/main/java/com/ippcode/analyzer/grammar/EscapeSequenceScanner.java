package com.ippcode.analyzer.grammar;

/**
 * Checks the escape sequences of a string constant. A backslash may only open a
 * decimal escape {@code \ddd}: exactly three digits must follow it.
 */
public final class EscapeSequenceScanner {

    private static final int ESCAPE_DIGITS = 3;

    private EscapeSequenceScanner() {
    }

    /**
     * @return index of the first malformed escape, or -1 when every escape is valid
     */
    public static int findInvalidEscape(String value) {
        int index = 0;
        while (index < value.length()) {
            if (value.charAt(index) != '\\') {
                index++;
                continue;
            }

            if (index + ESCAPE_DIGITS >= value.length()) {
                return index;
            }
            for (int offset = 1; offset <= ESCAPE_DIGITS; offset++) {
                if (!isDecimalDigit(value.charAt(index + offset))) {
                    return index;
                }
            }
            index += ESCAPE_DIGITS + 1;
        }
        return -1;
    }

    public static boolean isValid(String value) {
        return findInvalidEscape(value) < 0;
    }

    private static boolean isDecimalDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
