package com.bibsearch.query.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of operator and clause tokens produced by segmentation:
 * {@code [op1, clause1, op2, clause2, ..., opN, clauseN]}.
 * <p>
 * The list always has even length, starts with an operator symbol and
 * alternates strictly between operators and clauses.
 *
 * @param tokens Operator symbols and clause texts in query order
 */
public record ParseResult(List<String> tokens) {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public ParseResult {
        if (tokens == null || tokens.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Tokens must not be null: " + tokens);
        }
        tokens = List.copyOf(tokens);
        if (tokens.size() % 2 != 0) {
            throw new IllegalArgumentException("Odd number of tokens: " + tokens);
        }
        for (int i = 0; i < tokens.size(); i += 2) {
            if (QueryOperator.fromToken(tokens.get(i)).isEmpty()) {
                throw new IllegalArgumentException(
                        "Expected operator at index " + i + " but found '" + tokens.get(i) + "'");
            }
        }
    }

    /**
     * One clause together with the operator that combines it with what precedes it.
     */
    public record Segment(QueryOperator operator, String clause) {
    }

    public static ParseResult of(String... tokens) {
        return new ParseResult(Arrays.asList(tokens));
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public List<Segment> segments() {
        List<Segment> segments = new ArrayList<>(tokens.size() / 2);
        for (int i = 0; i < tokens.size(); i += 2) {
            QueryOperator operator = QueryOperator.fromToken(tokens.get(i)).orElseThrow();
            segments.add(new Segment(operator, tokens.get(i + 1)));
        }
        return segments;
    }

    public List<String> clauses() {
        return segments().stream().map(Segment::clause).toList();
    }

    public List<QueryOperator> operators() {
        return segments().stream().map(Segment::operator).toList();
    }

    /**
     * Render as a JSON array of strings, the form consumed by the query executor.
     */
    public String toJson() {
        try {
            return objectMapper.writeValueAsString(tokens);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tokens: " + e.getMessage(), e);
        }
    }

    public static ParseResult fromJson(String json) {
        try {
            return new ParseResult(objectMapper.readValue(json, new TypeReference<List<String>>() {}));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON token list: " + e.getMessage(), e);
        }
    }
}
