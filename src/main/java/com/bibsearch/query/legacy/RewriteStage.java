package com.bibsearch.query.legacy;

/**
 * One text substitution step of the legacy query conversion.
 * Stages never fail: text that does not match is returned unchanged.
 */
public interface RewriteStage {

    /**
     * Rewrite the query.
     *
     * @param query   Query as left by the previous stage
     * @param options Conversion options for this call
     * @return Rewritten query
     */
    String rewrite(String query, ConversionOptions options);
}
