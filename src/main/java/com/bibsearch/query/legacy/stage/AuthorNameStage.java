package com.bibsearch.query.legacy.stage;

import com.bibsearch.query.expression.QuotedSpans;
import com.bibsearch.query.legacy.AuthorName;
import com.bibsearch.query.legacy.AuthorPattern;
import com.bibsearch.query.legacy.AuthorSearchFormatter;
import com.bibsearch.query.legacy.ConversionOptions;
import com.bibsearch.query.legacy.RewriteStage;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Expands {@code author:} searches into the spellings the legacy engine matched.
 *
 * @see AuthorPattern
 * @see AuthorSearchFormatter
 */
public class AuthorNameStage implements RewriteStage {

    @Override
    public String rewrite(String query, ConversionOptions options) {
        QuotedSpans quoted = QuotedSpans.of(query);
        Map<AuthorPattern, Matcher> matchers = new EnumMap<>(AuthorPattern.class);
        for (AuthorPattern pattern : AuthorPattern.values()) {
            matchers.put(pattern, pattern.matcher(query));
        }

        StringBuilder result = new StringBuilder(query.length());
        int position = 0;

        while (position < query.length()) {
            AuthorPattern earliest = findEarliest(matchers, position);
            if (earliest == null) {
                break;
            }

            Matcher matcher = matchers.get(earliest);
            if (quoted.isQuoted(matcher.start())) {
                result.append(query, position, matcher.start() + 1);
                position = matcher.start() + 1;
                continue;
            }

            AuthorName name = earliest.toAuthorName(matcher);
            result.append(query, position, matcher.start());
            result.append(AuthorSearchFormatter.format(name, options.extendedAuthorFormat()));
            position = matcher.end();
        }

        result.append(query, position, query.length());
        return result.toString();
    }

    /**
     * Find the pattern matching closest to {@code from}; ties go to the pattern declared first.
     * The returned pattern's matcher is left positioned on its match.
     */
    private static AuthorPattern findEarliest(Map<AuthorPattern, Matcher> matchers, int from) {
        AuthorPattern earliest = null;
        int earliestStart = Integer.MAX_VALUE;

        for (Map.Entry<AuthorPattern, Matcher> entry : matchers.entrySet()) {
            Matcher matcher = entry.getValue();
            if (matcher.find(from) && matcher.start() < earliestStart) {
                earliest = entry.getKey();
                earliestStart = matcher.start();
            }
        }
        return earliest;
    }
}
