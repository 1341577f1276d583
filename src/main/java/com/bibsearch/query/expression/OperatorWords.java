package com.bibsearch.query.expression;

import java.util.regex.Pattern;

/**
 * Replaces the word forms of the combining operators with their symbols,
 * e.g. {@code ellis AND muon} becomes {@code ellis + muon}.
 * Quoted spans are left untouched.
 */
public final class OperatorWords {

    private static final Pattern OPERATOR_WORD =
            Pattern.compile("\\b(?:and|or|not)\\b", Pattern.CASE_INSENSITIVE);

    private OperatorWords() {
    }

    public static String toSymbols(String query) {
        return QuotedSpans.of(query).replaceUnquoted(OPERATOR_WORD,
                match -> QueryOperator.fromWord(match.group())
                        .map(QueryOperator::token)
                        .orElse(match.group()));
    }
}
