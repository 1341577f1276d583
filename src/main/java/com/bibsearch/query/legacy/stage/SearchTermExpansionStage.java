package com.bibsearch.query.legacy.stage;

import com.bibsearch.query.expression.QuotedSpans;
import com.bibsearch.query.expression.SyntaxConfig;
import com.bibsearch.query.legacy.ConversionOptions;
import com.bibsearch.query.legacy.LegacyDialect;
import com.bibsearch.query.legacy.RewriteStage;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.bibsearch.query.legacy.KeywordAliasTable.KEYWORD;
import static com.bibsearch.query.legacy.KeywordAliasTable.TITLE;
import static com.bibsearch.query.legacy.LegacyDialect.COMBINING_WORDS;
import static com.bibsearch.query.legacy.LegacyDialect.TERM_END;

/**
 * Spreads a multi-word title or keyword search over one field search per word.
 * <pre>
 * find title:these three words  ->  find title:these and title:three and title:words
 * or keyword:muon decay         ->  or keyword:muon or keyword:decay
 * </pre>
 * Only title and keyword searches are expanded. A value containing quotes or parentheses is kept as it is.
 */
public class SearchTermExpansionStage implements RewriteStage {

    private static final Pattern SEARCH_TERM = Pattern.compile(
            "\\b(?<combining>" + COMBINING_WORDS + ")\\s+(?<field>" + TITLE + "|" + KEYWORD + ")"
                    + "(?<content>.*?)" + TERM_END,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String rewrite(String query, ConversionOptions options) {
        QuotedSpans quoted = QuotedSpans.of(query);
        Matcher matcher = SEARCH_TERM.matcher(query);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String replacement = quoted.isQuoted(matcher.start())
                    ? matcher.group()
                    : expand(matcher.group("combining"), matcher.group("field").toLowerCase(Locale.ROOT),
                            matcher.group("content").strip(), matcher.group());
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String expand(String combining, String field, String content, String original) {
        if (content.isEmpty() || !isPlainWords(content)) {
            return original;
        }

        // after the marker word the remaining words are combined with AND
        boolean leading = combining.equalsIgnoreCase(LegacyDialect.MARKER);
        String next = leading ? "and" : combining;

        StringBuilder expanded = new StringBuilder();
        String[] words = WHITESPACE.split(content);
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                expanded.append(' ');
            }
            expanded.append(i == 0 ? combining : next).append(' ').append(field).append(words[i]);
        }
        return expanded.toString();
    }

    // quotes and parentheses bind words together, splitting them would break the query
    private static boolean isPlainWords(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (SyntaxConfig.isQuote(c) || SyntaxConfig.isParenthesis(c)) {
                return false;
            }
        }
        return true;
    }
}
