package com.bibsearch.query.legacy;

import com.bibsearch.query.legacy.stage.AuthorNameStage;
import com.bibsearch.query.legacy.stage.DateRangeStage;
import com.bibsearch.query.legacy.stage.ExactAuthorStage;
import com.bibsearch.query.legacy.stage.KeywordAliasStage;
import com.bibsearch.query.legacy.stage.SearchTermExpansionStage;
import com.bibsearch.query.legacy.stage.TruncationStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts queries written in the legacy keyword dialect into canonical syntax.
 * <p>
 * Only queries starting with the marker word {@code find} are converted, any
 * other query is returned unchanged. Conversion is best effort: text that no
 * stage recognizes is passed through and no exception is raised.
 * <pre>
 * find a ellis, j and t quark#  ->  author:"ellis, j*" and title:quark*
 * </pre>
 * The result still spells operators as words; {@link
 * com.bibsearch.query.expression.ParenthesisedQueryParser} accepts both forms.
 */
public class LegacySyntaxConverter {

    private static final Logger log = LoggerFactory.getLogger(LegacySyntaxConverter.class);

    private static final Pattern LEADING_MARKER =
            Pattern.compile("^" + LegacyDialect.MARKER + "\\s+", Pattern.CASE_INSENSITIVE);

    // each stage relies on the text shape left by the previous one
    private static final List<RewriteStage> STAGES = List.of(
            new DateRangeStage(),
            new KeywordAliasStage(),
            new AuthorNameStage(),
            new ExactAuthorStage(),
            new TruncationStage(),
            new SearchTermExpansionStage()
    );

    private final ConversionOptions options;

    public LegacySyntaxConverter() {
        this(ConversionOptions.defaults());
    }

    public LegacySyntaxConverter(ConversionOptions options) {
        this.options = options;
    }

    public ConversionOptions getOptions() {
        return options;
    }

    /**
     * @return true if the query starts with the legacy marker word
     */
    public boolean isLegacy(String query) {
        return query != null && LEADING_MARKER.matcher(query).find();
    }

    /**
     * Convert a query using the options this converter was created with.
     */
    public String convert(String query) {
        return convert(query, options);
    }

    /**
     * Convert a query.
     *
     * @param query   Query in either dialect, null is treated as empty
     * @param options Options for this call
     * @return Query in canonical syntax
     */
    public String convert(String query, ConversionOptions options) {
        if (query == null) {
            return "";
        }
        if (!isLegacy(query)) {
            return query;
        }

        String result = query;
        for (RewriteStage stage : STAGES) {
            String rewritten = stage.rewrite(result, options);
            if (log.isDebugEnabled() && !rewritten.equals(result)) {
                log.debug("{}: '{}' -> '{}'", stage.getClass().getSimpleName(), result, rewritten);
            }
            result = rewritten;
        }

        // canonical syntax has no leading marker
        return LEADING_MARKER.matcher(result).replaceFirst("");
    }
}
