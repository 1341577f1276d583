package com.bibsearch.query.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParseResult.
 */
class ParseResultTest {

    @Test
    @DisplayName("Should expose operators and clauses in order")
    void segments() {
        ParseResult result = ParseResult.of("+", "ellis", "|", "muon | kaon", "-", "higgs");

        assertEquals(List.of(QueryOperator.AND, QueryOperator.OR, QueryOperator.NOT), result.operators());
        assertEquals(List.of("ellis", "muon | kaon", "higgs"), result.clauses());
        assertEquals(new ParseResult.Segment(QueryOperator.OR, "muon | kaon"), result.segments().get(1));
    }

    @Test
    @DisplayName("Should render tokens as a JSON array")
    void toJson() {
        ParseResult result = ParseResult.of("+", "ellis", "+", "title:\"muon decay\"");

        assertEquals("[\"+\",\"ellis\",\"+\",\"title:\\\"muon decay\\\"\"]", result.toJson());
        assertEquals(result, ParseResult.fromJson(result.toJson()));
    }

    @Test
    @DisplayName("Should reject invalid JSON")
    void invalidJson() {
        assertThrows(IllegalArgumentException.class, () -> ParseResult.fromJson("[\"+\", "));
        assertThrows(IllegalArgumentException.class, () -> ParseResult.fromJson("{\"a\": 1}"));
        assertThrows(IllegalArgumentException.class, () -> ParseResult.fromJson("null"));
        assertThrows(IllegalArgumentException.class, () -> ParseResult.fromJson("[\"+\", null]"));
    }

    @Test
    @DisplayName("Should reject token lists that do not alternate")
    void invalidShape() {
        assertThrows(IllegalArgumentException.class, () -> ParseResult.of("+", "a", "|"));
        assertThrows(IllegalArgumentException.class, () -> ParseResult.of("a", "+"));
        assertThrows(IllegalArgumentException.class, () -> ParseResult.of("+", null));
        assertThrows(IllegalArgumentException.class, () -> ParseResult.fromJson("[\"ellis\",\"+\"]"));
    }

    @Test
    @DisplayName("Should map operators between symbols and words")
    void operatorForms() {
        assertEquals(QueryOperator.AND, QueryOperator.DEFAULT);
        assertEquals(QueryOperator.OR, QueryOperator.fromWord("OR").orElseThrow());
        assertEquals(QueryOperator.NOT, QueryOperator.fromSymbol('-').orElseThrow());
        assertTrue(QueryOperator.fromToken("+|").isEmpty());
        assertEquals("|", QueryOperator.OR.token());
    }
}
