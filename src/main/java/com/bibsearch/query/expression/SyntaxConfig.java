package com.bibsearch.query.expression;

/**
 * Characters and words recognized by the canonical query syntax.
 */
public final class SyntaxConfig {

    private SyntaxConfig() {
    }

    /**
     * Delimiter symbols.
     */
    public static final class Symbols {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';

        private Symbols() {
        }
    }

    /**
     * Canonical wildcard used for prefix and stem matching.
     */
    public static final char WILDCARD = '*';

    /**
     * @return true if the character opens or closes a quoted span
     */
    public static boolean isQuote(char c) {
        return c == Symbols.QUOTE_DOUBLE || c == Symbols.QUOTE_SINGLE;
    }

    public static boolean isParenthesis(char c) {
        return c == Symbols.LEFT_PAREN || c == Symbols.RIGHT_PAREN;
    }

    /**
     * @return true if the character at {@code index} is preceded by the escape marker
     */
    public static boolean isEscaped(CharSequence text, int index) {
        return index > 0 && text.charAt(index - 1) == Symbols.BACKSLASH;
    }
}
