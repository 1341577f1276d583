package com.bibsearch.query.expression;

/**
 * Mutually exclusive scanning modes of {@link GroupScanner}.
 */
enum ScanMode {
    OUTSIDE_PARENS,
    INSIDE_PARENS,
    INSIDE_QUOTE
}
