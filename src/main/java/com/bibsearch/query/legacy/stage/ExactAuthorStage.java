package com.bibsearch.query.legacy.stage;

import com.bibsearch.query.legacy.ConversionOptions;
import com.bibsearch.query.legacy.RewriteStage;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.bibsearch.query.legacy.KeywordAliasTable.AUTHOR;
import static com.bibsearch.query.legacy.KeywordAliasTable.EXACT_AUTHOR;
import static com.bibsearch.query.legacy.LegacyDialect.TERM_END;

/**
 * Turns an exact author search into a single literal author phrase.
 * <pre>
 * exactauthor:ellis, j r  ->  author:"ellis, j r"
 * </pre>
 */
public class ExactAuthorStage implements RewriteStage {

    private static final Pattern EXACT_AUTHOR_TERM = Pattern.compile(
            "\\b" + EXACT_AUTHOR + "(?<name>.*?)" + TERM_END, Pattern.CASE_INSENSITIVE);

    @Override
    public String rewrite(String query, ConversionOptions options) {
        Matcher matcher = EXACT_AUTHOR_TERM.matcher(query);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group("name").strip();
            String replacement = name.isEmpty()
                    ? matcher.group()
                    : AUTHOR + "\"" + name + "\"";
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
