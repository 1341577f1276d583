package com.bibsearch.exception;

/**
 * Thrown when a parenthesis is opened inside an already open group.
 */
public class NestedParenthesesUnsupportedException extends QueryParserException {

    public static final String MESSAGE = "Nested parenthesis are currently not supported";

    public NestedParenthesesUnsupportedException(String query, int position) {
        super(MESSAGE, query, position);
    }
}
