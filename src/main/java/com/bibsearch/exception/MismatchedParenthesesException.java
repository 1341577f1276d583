package com.bibsearch.exception;

/**
 * Thrown when a closing parenthesis has no opening one, or a group is still
 * open at end of input.
 */
public class MismatchedParenthesesException extends QueryParserException {

    public static final String MESSAGE = "Mismatched parenthesis";

    public MismatchedParenthesesException(String query, int position) {
        super(MESSAGE, query, position);
    }
}
