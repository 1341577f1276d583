package com.bibsearch.query.expression;

import com.bibsearch.exception.MismatchedParenthesesException;
import com.bibsearch.exception.NestedParenthesesUnsupportedException;
import com.bibsearch.exception.QueryParserException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParenthesisedQueryParser.
 */
class ParenthesisedQueryParserTest {

    private static final Pattern OPERATOR_WORD =
            Pattern.compile("\\b(and|or|not)\\b", Pattern.CASE_INSENSITIVE);

    private final ParenthesisedQueryParser parser = new ParenthesisedQueryParser();

    // =====================================================================
    // Queries without parentheses
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should return a query without parentheses as one clause with the default operator")
    @ValueSource(strings = {"ellis", "ellis AND muon", "a | b - c", "find title:\"AND this\"", ""})
    void queryWithoutParenthesesIsReturnedAsIs(String query) {
        assertEquals(List.of("+", query), parser.parse(query).tokens());
    }

    // =====================================================================
    // Groups
    // =====================================================================

    @Test
    @DisplayName("Should not split out operators inside a group")
    void groupIsOneOpaqueClause() {
        assertEquals(List.of("+", "ellis", "+", "muon | kaon"),
                parser.parse("ellis AND (muon OR kaon)").tokens());
    }

    @Test
    @DisplayName("Should give a leading group the default operator")
    void leadingGroup() {
        assertEquals(List.of("+", "muon | kaon", "+", "ellis"),
                parser.parse("(muon OR kaon) AND ellis").tokens());
    }

    @Test
    @DisplayName("Should keep operators written around a group")
    void operatorsAroundGroup() {
        assertEquals(List.of("+", "ellis", "|", "muon + kaon", "-", "higgs"),
                parser.parse("ellis OR (muon AND kaon) NOT higgs").tokens());
    }

    @Test
    @DisplayName("Should keep the operator between two groups")
    void operatorBetweenGroups() {
        assertEquals(List.of("+", "a", "-", "b"), parser.parse("(a) - (b)").tokens());
        assertEquals(List.of("+", "a", "|", "b"), parser.parse("(a) or (b)").tokens());
    }

    @Test
    @DisplayName("Should fill missing operators with the default operator")
    void defaultOperatorBetweenClauses() {
        assertEquals(List.of("+", "a", "+", "b", "+", "c"), parser.parse("a (b) c").tokens());
    }

    @Test
    @DisplayName("Should keep operators in the text before a group inside that clause")
    void operatorsInsideLeadingText() {
        assertEquals(List.of("+", "a | b", "+", "c"), parser.parse("a | b (c)").tokens());
    }

    @Test
    @DisplayName("Should drop an empty group")
    void emptyGroupIsDropped() {
        assertEquals(List.of("+", "a", "+", "b"), parser.parse("a () b").tokens());
        assertTrue(parser.parse("()").isEmpty());
    }

    @Test
    @DisplayName("Should drop the operator before an empty trailing clause")
    void trailingOperatorIsDropped() {
        assertEquals(List.of("+", "a"), parser.parse("(a) |").tokens());
        assertEquals(List.of("+", "a", "+", "b"), parser.parse("(a) b +").tokens());
    }

    @Test
    @DisplayName("Should replace operator words only as whole words")
    void operatorWordsAsWholeWords() {
        assertEquals(List.of("+", "android", "|", "notation"),
                parser.parse("android OR (notation)").tokens());
    }

    // =====================================================================
    // Quotes and escaping
    // =====================================================================

    @Test
    @DisplayName("Should ignore parentheses and operator words inside quotes")
    void quotedContentIsNotScanned() {
        assertEquals(List.of("+", "title:\"a (b and c\"", "+", "d"),
                parser.parse("title:\"a (b and c\" and (d)").tokens());
    }

    @Test
    @DisplayName("Should allow a closing parenthesis in quotes inside a group")
    void quoteInsideGroup() {
        assertEquals(List.of("+", "'x)' y", "+", "z"), parser.parse("('x)' y) z").tokens());
    }

    @Test
    @DisplayName("Should treat escaped parentheses as plain text")
    void escapedParentheses() {
        assertEquals(List.of("+", "a \\(b\\) c"), parser.parse("a \\(b\\) c").tokens());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should reject unbalanced parentheses")
    @ValueSource(strings = {"a (b", "a) b", "(a))", "(a \"b)", "a (b) c)"})
    void mismatchedParentheses(String query) {
        assertThrows(MismatchedParenthesesException.class, () -> parser.parse(query));
    }

    @Test
    @DisplayName("Should reject nested parentheses")
    void nestedParentheses() {
        NestedParenthesesUnsupportedException e = assertThrows(NestedParenthesesUnsupportedException.class,
                () -> parser.parse("a (b (c) d"));
        assertEquals(5, e.getPosition());
        assertTrue(e.getMessage().startsWith(NestedParenthesesUnsupportedException.MESSAGE));
    }

    @Test
    @DisplayName("Should report position and query in errors")
    void errorCarriesPosition() {
        QueryParserException e = assertThrows(QueryParserException.class, () -> parser.parse("a) b"));
        assertEquals(1, e.getPosition());
        assertEquals("a) b", e.getQuery());

        e = assertThrows(QueryParserException.class, () -> parser.parse("a (b"));
        assertEquals(4, e.getPosition());
    }

    @Test
    @DisplayName("Should reject a null query")
    void nullQuery() {
        assertThrows(NullPointerException.class, () -> parser.parse(null));
    }

    // =====================================================================
    // Result shape
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should alternate operators and clauses and keep all clause text")
    @ValueSource(strings = {
            "ellis AND (muon OR kaon)",
            "(a) b (c) - d",
            "x | (y) | z",
            "- (a) 'b c' (d)",
            "(a) | - (b)",
            "title:\"a (b\" or (c d) not e",
            "a () b +"
    })
    void resultAlternates(String query) {
        List<String> tokens = parser.parse(query).tokens();
        assertEquals(0, tokens.size() % 2);
        for (int i = 0; i < tokens.size(); i++) {
            boolean operator = QueryOperator.fromToken(tokens.get(i)).isPresent();
            assertEquals(i % 2 == 0, operator, "token " + i + " of " + tokens);
        }
        assertEquals(clauseText(query), clauseText(String.join("", parser.parse(query).clauses())));
    }

    // drops operators, parentheses and whitespace
    private static String clauseText(String text) {
        return OPERATOR_WORD.matcher(text).replaceAll("").replaceAll("[+|\\-()\\s]", "");
    }

    @Test
    @DisplayName("Should not share state between concurrent parses")
    void concurrentParses() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<ParseResult>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String query = i % 2 == 0 ? "ellis AND (muon OR kaon)" : "(a) - (b)";
                futures.add(pool.submit(() -> parser.parse(query)));
            }
            for (int i = 0; i < futures.size(); i++) {
                List<String> expected = i % 2 == 0
                        ? List.of("+", "ellis", "+", "muon | kaon")
                        : List.of("+", "a", "-", "b");
                assertEquals(expected, futures.get(i).get(5, TimeUnit.SECONDS).tokens());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
