package com.bibsearch.query.legacy.stage;

import com.bibsearch.query.expression.SyntaxConfig;
import com.bibsearch.query.legacy.ConversionOptions;
import com.bibsearch.query.legacy.LegacyDialect;
import com.bibsearch.query.legacy.RewriteStage;

/**
 * Replaces the legacy truncation symbol {@code #} with the canonical wildcard {@code *}.
 */
public class TruncationStage implements RewriteStage {

    @Override
    public String rewrite(String query, ConversionOptions options) {
        return query.replace(LegacyDialect.TRUNCATION, SyntaxConfig.WILDCARD);
    }
}
