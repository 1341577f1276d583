package com.bibsearch.query.legacy;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.bibsearch.query.legacy.LegacyDialect.TERM_END;

/**
 * Surface shapes of an author search following {@code author:}.
 * <p>
 * Order matters: at a given position the first shape that matches wins.
 */
public enum AuthorPattern {

    /** author:ellis, jacqueline */
    SURNAME_GIVEN("\\bauthor:\\s*(?<surname>\\w+),\\s*(?<given>\\w{3,})\\b" + TERM_END),

    /** author:jacqueline ellis */
    GIVEN_SURNAME("\\bauthor:\\s*(?<given>\\w+)\\s+" + Fragments.NOT_OPERATOR
            + "(?<surname>\\w+)\\b" + TERM_END),

    /** author:ellis, j. */
    SURNAME_INITIAL("\\bauthor:\\s*(?<surname>\\w+),\\s*(?<given>\\w{1,2})\\b\\.?" + TERM_END),

    /** author:ellis, j. r. */
    SURNAME_GIVEN_MIDDLE("\\bauthor:\\s*(?<surname>\\w+),\\s*(?<given>\\w+)\\b\\.?\\s+"
            + Fragments.NOT_OPERATOR + "(?<middle>\\w+)\\b\\.?"),

    /** author:j. r. ellis */
    INITIALS_SURNAME("\\bauthor:\\s*(?<given>\\w+)\\b\\.?\\s+" + Fragments.NOT_OPERATOR
            + "(?<middle>\\w+)\\b\\.?\\s+" + Fragments.NOT_OPERATOR + "(?<surname>\\w+)\\b\\.?"),

    /** author:ellis */
    SURNAME("\\bauthor:\\s*(?<surname>\\w+)\\b" + TERM_END);

    private final Pattern pattern;
    private final boolean hasGiven;
    private final boolean hasMiddle;

    AuthorPattern(String regex) {
        this.pattern = Pattern.compile(regex, Fragments.FLAGS);
        this.hasGiven = regex.contains("(?<given>");
        this.hasMiddle = regex.contains("(?<middle>");
    }

    public Matcher matcher(CharSequence input) {
        return pattern.matcher(input);
    }

    /**
     * Decompose the current match of a matcher created by {@link #matcher(CharSequence)}.
     */
    public AuthorName toAuthorName(Matcher matcher) {
        return new AuthorName(
                matcher.group("surname"),
                hasGiven ? matcher.group("given") : null,
                hasMiddle ? matcher.group("middle") : null);
    }

    private static final class Fragments {
        static final int FLAGS =
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
        // the next word must not be an operator word
        static final String NOT_OPERATOR = "(?!and |or |not )";
    }
}
