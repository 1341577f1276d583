package com.bibsearch.query.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QuotedSpans and OperatorWords.
 */
class QuotedSpansTest {

    @Test
    @DisplayName("Should find single and double quoted spans")
    void shouldFindSpans() {
        QuotedSpans spans = QuotedSpans.of("a \"b c\" d 'e' f");

        assertEquals(List.of(new QuotedSpans.Span(2, 7), new QuotedSpans.Span(10, 13)), spans.spans());
        assertTrue(spans.isQuoted(2));
        assertTrue(spans.isQuoted(4));
        assertFalse(spans.isQuoted(8));
        assertTrue(spans.isQuoted(11));
        assertFalse(spans.isQuoted(14));
    }

    @Test
    @DisplayName("Should not close a span with the other quote character")
    void mixedQuotes() {
        QuotedSpans spans = QuotedSpans.of("\"it's\" x");

        assertEquals(List.of(new QuotedSpans.Span(0, 6)), spans.spans());
    }

    @Test
    @DisplayName("Should not form spans from escaped or unterminated quotes")
    void escapedAndUnterminatedQuotes() {
        assertTrue(QuotedSpans.of("a \\\"b\\\" c").spans().isEmpty());
        assertTrue(QuotedSpans.of("a \"b c").spans().isEmpty());
    }

    @Test
    @DisplayName("Should only replace matches outside quotes")
    void replaceUnquoted() {
        String result = QuotedSpans.of("x \"x\" x")
                .replaceUnquoted(Pattern.compile("x"), match -> "y");

        assertEquals("y \"x\" y", result);
    }

    @Test
    @DisplayName("Should turn operator words into symbols outside quotes")
    void operatorWordsToSymbols() {
        assertEquals("ellis + muon | \"not this\" - kaon",
                OperatorWords.toSymbols("ellis AND muon or \"not this\" Not kaon"));
    }

    @Test
    @DisplayName("Should keep operator words inside other words")
    void operatorWordsInsideWords() {
        assertEquals("android notation order", OperatorWords.toSymbols("android notation order"));
    }
}
