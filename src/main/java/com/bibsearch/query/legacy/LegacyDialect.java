package com.bibsearch.query.legacy;

/**
 * Words and pattern fragments of the legacy query dialect.
 */
public final class LegacyDialect {

    private LegacyDialect() {
    }

    /**
     * Leading word that marks a query as written in the legacy dialect.
     */
    public static final String MARKER = "find";

    /**
     * Words after which a field keyword may appear, as a regex alternation.
     */
    public static final String COMBINING_WORDS = "find|and|or|not";

    /**
     * Lookahead matching the end of a search term: the next operator word or end of input.
     */
    public static final String TERM_END = "(?= and | or | not |$)";

    /**
     * Truncation symbol of the legacy dialect.
     */
    public static final char TRUNCATION = '#';

    /**
     * Year bounds used for open-ended date ranges.
     */
    public static final String MIN_YEAR = "0";
    public static final String MAX_YEAR = "9999";

    public static final String YEAR_FIELD = "year:";
    public static final String RANGE_SEPARATOR = "->";
}
