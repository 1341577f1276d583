package com.bibsearch.exception;

/**
 * Base exception for the query syntax library.
 */
public class BibSearchException extends RuntimeException {

    public BibSearchException(String message) {
        super(message);
    }

    public BibSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
