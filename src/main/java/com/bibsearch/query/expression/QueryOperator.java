package com.bibsearch.query.expression;

import java.util.Locale;
import java.util.Optional;

/**
 * Operators that combine clauses of a query.
 * Canonical syntax spells them as symbols, the legacy dialect as words.
 */
public enum QueryOperator {

    AND('+', "and"),
    OR('|', "or"),
    NOT('-', "not");

    /**
     * Operator implied wherever none is written between two clauses.
     */
    public static final QueryOperator DEFAULT = AND;

    private final char symbol;
    private final String word;

    QueryOperator(char symbol, String word) {
        this.symbol = symbol;
        this.word = word;
    }

    /**
     * Symbol as it appears in a {@link ParseResult}.
     */
    public String token() {
        return String.valueOf(symbol);
    }

    public static boolean isSymbol(char c) {
        return fromSymbol(c).isPresent();
    }

    public static Optional<QueryOperator> fromSymbol(char c) {
        for (QueryOperator operator : values()) {
            if (operator.symbol == c) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    public static Optional<QueryOperator> fromToken(String token) {
        if (token == null || token.length() != 1) {
            return Optional.empty();
        }
        return fromSymbol(token.charAt(0));
    }

    public static Optional<QueryOperator> fromWord(String word) {
        if (word == null) {
            return Optional.empty();
        }
        String lower = word.toLowerCase(Locale.ROOT);
        for (QueryOperator operator : values()) {
            if (operator.word.equals(lower)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
