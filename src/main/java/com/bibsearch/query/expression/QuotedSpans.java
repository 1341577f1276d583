package com.bibsearch.query.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ranges of a text enclosed in matching single or double quotes.
 * <p>
 * A quote preceded by the escape marker neither opens nor closes a span.
 * A quote that is never closed does not start a span.
 */
public final class QuotedSpans {

    /**
     * Half-open range [start, end) covering both quote characters.
     */
    public record Span(int start, int end) {

        public boolean contains(int index) {
            return index >= start && index < end;
        }
    }

    private final String text;
    private final List<Span> spans;

    private QuotedSpans(String text, List<Span> spans) {
        this.text = text;
        this.spans = Collections.unmodifiableList(spans);
    }

    public static QuotedSpans of(String text) {
        List<Span> spans = new ArrayList<>();
        int start = -1;
        char quote = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!SyntaxConfig.isQuote(c) || SyntaxConfig.isEscaped(text, i)) {
                continue;
            }
            if (start < 0) {
                start = i;
                quote = c;
            } else if (c == quote) {
                spans.add(new Span(start, i + 1));
                start = -1;
            }
        }
        return new QuotedSpans(text, spans);
    }

    public List<Span> spans() {
        return spans;
    }

    public boolean isQuoted(int index) {
        for (Span span : spans) {
            if (span.contains(index)) {
                return true;
            }
            if (span.start() > index) {
                return false;
            }
        }
        return false;
    }

    /**
     * Replace every match of {@code pattern} that does not start inside a quoted span.
     *
     * @param pattern     Pattern searched over the whole text
     * @param replacement Produces the literal replacement for a match
     * @return Rewritten text
     */
    public String replaceUnquoted(Pattern pattern, Function<MatchResult, String> replacement) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        int current = 0;

        while (matcher.find()) {
            if (isQuoted(matcher.start())) {
                continue;
            }
            result.append(text, current, matcher.start());
            result.append(replacement.apply(matcher.toMatchResult()));
            current = matcher.end();
        }
        result.append(text, current, text.length());
        return result.toString();
    }
}
