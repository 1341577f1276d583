package com.bibsearch.query.expression;

import com.bibsearch.exception.MismatchedParenthesesException;
import com.bibsearch.exception.NestedParenthesesUnsupportedException;

import java.util.ArrayList;
import java.util.List;

import static com.bibsearch.query.expression.SyntaxConfig.*;

/**
 * Single-use scanner that splits a canonical query into operator and clause
 * tokens, treating one level of parentheses as an opaque clause.
 * <p>
 * Holds mutable scan state: create one instance per query.
 */
final class GroupScanner {

    private static final int NO_POSITION = -1;

    private final String query;
    private final List<String> tokens = new ArrayList<>();

    private ScanMode mode = ScanMode.OUTSIDE_PARENS;
    // mode to go back to when the current quoted span closes
    private ScanMode modeBeforeQuote = ScanMode.OUTSIDE_PARENS;
    private char quote;

    private int clauseStart;
    private int clauseEnd;

    private QueryOperator preceding;
    private int precedingPosition = NO_POSITION;
    private QueryOperator following;
    private int followingPosition = NO_POSITION;

    GroupScanner(String query) {
        this.query = query;
    }

    /**
     * Scan the whole query.
     *
     * @return Operator and clause tokens
     * @throws MismatchedParenthesesException        on an unbalanced parenthesis
     * @throws NestedParenthesesUnsupportedException on a parenthesis opened inside a group
     */
    ParseResult scan() {
        for (int i = 0; i < query.length(); i++) {
            advance(query.charAt(i), i);
        }
        return finish();
    }

    private void advance(char c, int position) {
        clauseEnd = position;
        boolean escaped = isEscaped(query, position);

        if (mode == ScanMode.INSIDE_QUOTE) {
            if (c == quote && !escaped) {
                mode = modeBeforeQuote;
            }
            return;
        }

        if (isQuote(c) && !escaped) {
            modeBeforeQuote = mode;
            mode = ScanMode.INSIDE_QUOTE;
            quote = c;
            if (modeBeforeQuote == ScanMode.OUTSIDE_PARENS) {
                assignDefaultOperator();
            }
        } else if (c == Symbols.LEFT_PAREN && !escaped) {
            openGroup(position);
        } else if (c == Symbols.RIGHT_PAREN && !escaped) {
            closeGroup(position);
        } else if (QueryOperator.isSymbol(c)) {
            handleOperator(QueryOperator.fromSymbol(c).orElseThrow(), position);
        } else if (!Character.isWhitespace(c) && mode == ScanMode.OUTSIDE_PARENS) {
            assignDefaultOperator();
        }
    }

    private void openGroup(int position) {
        if (mode == ScanMode.INSIDE_PARENS) {
            throw new NestedParenthesesUnsupportedException(query, position);
        }

        String clause = currentClause();
        if (clause.isEmpty()) {
            // only operators were written since the last group
            tokens.add(orDefault(following != null ? following : preceding));
        } else {
            tokens.add(orDefault(preceding));
            tokens.add(clause);
            tokens.add(orDefault(following));
        }

        mode = ScanMode.INSIDE_PARENS;
        clauseStart = position + 1;
        clearOperators();
    }

    private void closeGroup(int position) {
        if (mode != ScanMode.INSIDE_PARENS) {
            throw new MismatchedParenthesesException(query, position);
        }

        String clause = currentClause();
        if (clause.isEmpty()) {
            // drop the operator emitted for this group
            tokens.remove(tokens.size() - 1);
        } else {
            tokens.add(clause);
        }

        mode = ScanMode.OUTSIDE_PARENS;
        clauseStart = position + 1;
    }

    private void handleOperator(QueryOperator operator, int position) {
        if (mode == ScanMode.INSIDE_PARENS) {
            return;
        }

        if (preceding == null) {
            preceding = operator;
            precedingPosition = position;
            clauseStart = position + 1;
            following = null;
            followingPosition = NO_POSITION;
        } else {
            following = operator;
            followingPosition = position;
        }
    }

    /**
     * A clause with no written operator in front of it gets the default one.
     * Once the clause has started, later text invalidates any operator seen
     * inside it as a candidate following operator.
     */
    private void assignDefaultOperator() {
        if (preceding == null) {
            preceding = QueryOperator.DEFAULT;
            precedingPosition = NO_POSITION;
        } else {
            following = QueryOperator.DEFAULT;
            followingPosition = NO_POSITION;
        }
    }

    private ParseResult finish() {
        if (mode == ScanMode.INSIDE_PARENS
                || (mode == ScanMode.INSIDE_QUOTE && modeBeforeQuote == ScanMode.INSIDE_PARENS)) {
            throw new MismatchedParenthesesException(query, query.length());
        }

        clauseEnd = query.length();
        String clause = currentClause();
        // an operator written before an empty trailing clause is not emitted
        if (!clause.isEmpty()) {
            tokens.add(orDefault(preceding));
            tokens.add(clause);
        }
        return new ParseResult(tokens);
    }

    private String currentClause() {
        int begin = clauseStart;
        if (begin < precedingPosition) {
            begin = precedingPosition + 1;
        }
        int end = clauseEnd;
        if (followingPosition != NO_POSITION && end > followingPosition) {
            end = followingPosition;
        }
        if (begin >= end) {
            return "";
        }
        return query.substring(begin, end).strip();
    }

    private void clearOperators() {
        preceding = null;
        precedingPosition = NO_POSITION;
        following = null;
        followingPosition = NO_POSITION;
    }

    private static String orDefault(QueryOperator operator) {
        return (operator != null ? operator : QueryOperator.DEFAULT).token();
    }
}
