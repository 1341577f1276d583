package com.bibsearch.query.legacy.stage;

import com.bibsearch.query.legacy.ConversionOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SearchTermExpansionStage.
 */
class SearchTermExpansionStageTest {

    private final SearchTermExpansionStage stage = new SearchTermExpansionStage();

    private String rewrite(String query) {
        return stage.rewrite(query, ConversionOptions.defaults());
    }

    @Test
    @DisplayName("Should combine words after the marker with and")
    void leadingTermUsesAnd() {
        assertEquals("find title:these and title:three and title:words",
                rewrite("find title:these three words"));
    }

    @Test
    @DisplayName("Should repeat the operator that introduced the term")
    void operatorIsRepeated() {
        assertEquals("find author:x or keyword:muon or keyword:decay",
                rewrite("find author:x or keyword:muon decay"));
        assertEquals("find author:x NOT title:a NOT title:b",
                rewrite("find author:x NOT title:a b"));
    }

    @Test
    @DisplayName("Should stop expansion at the next operator word")
    void stopsAtNextOperator() {
        assertEquals("find title:a and title:b and author:c", rewrite("find title:a b and author:c"));
    }

    @Test
    @DisplayName("Should not expand single words, phrases or other fields")
    void notExpanded() {
        assertEquals("find title:quark*", rewrite("find title:quark*"));
        assertEquals("find title:\"muon decay\"", rewrite("find title:\"muon decay\""));
        assertEquals("find author:muon decay", rewrite("find author:muon decay"));
        assertEquals("find 700__u:cern geneva", rewrite("find 700__u:cern geneva"));
    }

    @Test
    @DisplayName("Should not expand values containing parentheses")
    void parenthesesAreNotSplit() {
        assertEquals("find title:(muon decay)", rewrite("find title:(muon decay)"));
        assertEquals("find title:muon (decay)", rewrite("find title:muon (decay)"));
        assertEquals("find title:a and title:b or keyword:(c d)", rewrite("find title:a b or keyword:(c d)"));
    }

    @Test
    @DisplayName("Should read field prefixes ignoring case and the default locale")
    void fieldPrefixCase() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr"));
        try {
            assertEquals("find title:a and title:b", rewrite("find TITLE:a b"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
