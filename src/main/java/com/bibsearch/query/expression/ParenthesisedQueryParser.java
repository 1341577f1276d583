package com.bibsearch.query.expression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Segments a canonical query into {@code [operator, clause, ...]} tokens.
 * <p>
 * The parsing is linear: one level of parentheses is supported and the
 * whole parenthesised text becomes a single clause, operators inside it
 * included. There is no operator precedence and no expression tree.
 * <pre>
 * parse("ellis AND (muon OR kaon)")  ->  ["+", "ellis", "+", "muon | kaon"]
 * </pre>
 * Instances hold no state and may be shared between threads.
 */
public class ParenthesisedQueryParser {

    private static final Logger log = LoggerFactory.getLogger(ParenthesisedQueryParser.class);

    /**
     * Parse a query.
     * <p>
     * A query without any parenthesis is returned as one clause preceded by
     * the default operator, exactly as written. Otherwise operator words
     * outside quotes are first replaced by their symbols.
     *
     * @param query Canonical query text
     * @return Alternating operator and clause tokens
     * @throws com.bibsearch.exception.MismatchedParenthesesException        on unbalanced parentheses
     * @throws com.bibsearch.exception.NestedParenthesesUnsupportedException on nested parentheses
     */
    public ParseResult parse(String query) {
        Objects.requireNonNull(query, "query");

        if (!hasParentheses(query)) {
            return ParseResult.of(QueryOperator.DEFAULT.token(), query);
        }

        String symbolic = OperatorWords.toSymbols(query);
        ParseResult result = new GroupScanner(symbolic).scan();
        log.debug("Segmented '{}' into {}", query, result.tokens());
        return result;
    }

    private static boolean hasParentheses(String query) {
        return query.indexOf(SyntaxConfig.Symbols.LEFT_PAREN) >= 0
                || query.indexOf(SyntaxConfig.Symbols.RIGHT_PAREN) >= 0;
    }
}
