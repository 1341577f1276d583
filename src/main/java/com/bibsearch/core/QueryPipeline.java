package com.bibsearch.core;

import com.bibsearch.query.expression.ParenthesisedQueryParser;
import com.bibsearch.query.expression.ParseResult;
import com.bibsearch.query.legacy.LegacySyntaxConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw user input into the token sequence handed to the query executor:
 * legacy conversion (only for queries in the legacy dialect) followed by segmentation.
 */
public class QueryPipeline {

    private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

    private final LegacySyntaxConverter converter;
    private final ParenthesisedQueryParser parser;

    public QueryPipeline(LegacySyntaxConverter converter, ParenthesisedQueryParser parser) {
        this.converter = converter;
        this.parser = parser;
    }

    /**
     * Normalize a query to canonical syntax without segmenting it.
     */
    public String normalize(String query) {
        return converter.convert(query);
    }

    /**
     * Normalize and segment a query.
     *
     * @param query Raw query in either dialect
     * @return Alternating operator and clause tokens
     * @throws com.bibsearch.exception.QueryParserException if the parentheses are malformed
     */
    public ParseResult process(String query) {
        String normalized = normalize(query);
        if (converter.isLegacy(query)) {
            log.debug("Converted legacy query '{}' to '{}'", query, normalized);
        }
        ParseResult result = parser.parse(normalized);
        log.debug("Query '{}' parsed into {} segments", normalized, result.size() / 2);
        return result;
    }
}
