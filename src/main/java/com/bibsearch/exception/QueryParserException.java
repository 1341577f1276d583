package com.bibsearch.exception;

/**
 * Exception thrown when a query cannot be segmented.
 * Fatal to the current parse; the caller decides how to report it.
 */
public class QueryParserException extends BibSearchException {

    private final String query;
    private final int position;

    public QueryParserException(String message, String query, int position) {
        super(message + " at position " + position + " in '" + query + "'");
        this.query = query;
        this.position = position;
    }

    /**
     * The query text that was being scanned when the error was detected.
     */
    public String getQuery() {
        return query;
    }

    /**
     * Offset of the offending character, or the query length when the error
     * was detected at end of input.
     */
    public int getPosition() {
        return position;
    }
}
