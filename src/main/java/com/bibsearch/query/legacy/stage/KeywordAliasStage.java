package com.bibsearch.query.legacy.stage;

import com.bibsearch.query.expression.QuotedSpans;
import com.bibsearch.query.legacy.ConversionOptions;
import com.bibsearch.query.legacy.KeywordAliasTable;
import com.bibsearch.query.legacy.RewriteStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.bibsearch.query.legacy.LegacyDialect.COMBINING_WORDS;

/**
 * Replaces legacy field keywords with canonical field prefixes.
 * <pre>
 * find a ellis and t quark  ->  find author:ellis and title:quark
 * find e 10 gev             ->  find 10 gev
 * </pre>
 * A keyword is only recognized right after a combining word and outside quotes.
 */
public class KeywordAliasStage implements RewriteStage {

    private static final Logger log = LoggerFactory.getLogger(KeywordAliasStage.class);

    private static final Pattern KEYWORD = Pattern.compile(
            "\\b(?<combining>" + COMBINING_WORDS + ")\\s+(?<keyword>[\\w-]+)\\s+(?=[\\w\"'])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public String rewrite(String query, ConversionOptions options) {
        QuotedSpans quoted = QuotedSpans.of(query);
        Matcher matcher = KEYWORD.matcher(query);
        StringBuilder result = new StringBuilder(query.length());
        int position = 0;

        while (position < query.length() && matcher.find(position)) {
            int combiningEnd = matcher.end("combining");
            Optional<String> field = quoted.isQuoted(matcher.start())
                    ? Optional.empty()
                    : KeywordAliasTable.lookup(matcher.group("keyword"));

            if (field.isEmpty()) {
                // the keyword may itself be a combining word, resume right after this one
                result.append(query, position, combiningEnd);
                position = combiningEnd;
                continue;
            }

            log.trace("Keyword '{}' -> '{}'", matcher.group("keyword"), field.get());
            result.append(query, position, combiningEnd);
            result.append(' ').append(field.get());
            position = matcher.end();
        }

        result.append(query, position, query.length());
        return result.toString();
    }
}
