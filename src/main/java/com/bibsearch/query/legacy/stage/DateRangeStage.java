package com.bibsearch.query.legacy.stage;

import com.bibsearch.query.legacy.ConversionOptions;
import com.bibsearch.query.legacy.RewriteStage;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.bibsearch.query.legacy.LegacyDialect.*;

/**
 * Converts date shorthand into an inclusive year range.
 * <pre>
 * date before 1990  ->  year:0->1990
 * d > 2001          ->  year:2001->9999
 * </pre>
 * Runs before keyword aliasing, which would otherwise turn {@code date} into a field prefix.
 */
public class DateRangeStage implements RewriteStage {

    private static final Pattern DATE_BEFORE = Pattern.compile(
            "\\b(?:d|date)\\b\\s*(?:before|<)\\s*(?<year>\\d{4})\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DATE_AFTER = Pattern.compile(
            "\\b(?:d|date)\\b\\s*(?:after|>)\\s*(?<year>\\d{4})\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String rewrite(String query, ConversionOptions options) {
        String result = replace(DATE_BEFORE, query, true);
        return replace(DATE_AFTER, result, false);
    }

    private static String replace(Pattern pattern, String query, boolean upperBound) {
        Matcher matcher = pattern.matcher(query);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String year = matcher.group("year");
            String range = upperBound
                    ? YEAR_FIELD + MIN_YEAR + RANGE_SEPARATOR + year
                    : YEAR_FIELD + year + RANGE_SEPARATOR + MAX_YEAR;
            matcher.appendReplacement(result, Matcher.quoteReplacement(range));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
