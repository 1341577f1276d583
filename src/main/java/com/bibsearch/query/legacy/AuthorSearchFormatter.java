package com.bibsearch.query.legacy;

import java.util.ArrayList;
import java.util.List;

import static com.bibsearch.query.legacy.KeywordAliasTable.AUTHOR;

/**
 * Builds the author search for a decomposed name.
 * <p>
 * The canonical author field only matches a literal author string, so one
 * name is spread over a disjunction of the spellings the legacy engine
 * accepted:
 * <pre>
 * ellis             ->  author:ellis or author:"ellis, *"
 * ellis, j          ->  author:"ellis, j*"
 * ellis, jacqueline ->  author:"ellis, jacqueline" or author:"ellis, j.*" or author:"ellis, j"
 *                       or author:"ellis, ja.*" or author:"ellis, ja" or author:"ellis, jacqueline *"
 * ellis, john r     ->  author:"ellis, john* r*" or author:"ellis, j.r." or author:"ellis, jo.r."
 * </pre>
 * The period after an initial is only written in the extended author format,
 * a space is used otherwise.
 */
public final class AuthorSearchFormatter {

    private static final String OR = " or ";

    private AuthorSearchFormatter() {
    }

    /**
     * @return Author search, or an empty string when the name has no surname
     */
    public static String format(AuthorName name, boolean extendedAuthorFormat) {
        if (!name.hasSurname()) {
            return "";
        }

        String separator = extendedAuthorFormat ? "." : " ";
        String surname = name.surname();
        List<String> phrases = new ArrayList<>();

        if (name.hasMiddleName()) {
            String given = name.givenName();
            String middle = name.middleName();
            phrases.add(quoted(surname, given + "* " + middle + "*"));
            if (given.length() > 1) {
                phrases.add(quoted(surname, given.substring(0, 1) + separator + middle + separator));
                phrases.add(quoted(surname, given.substring(0, 2) + separator + middle + separator));
            }
            return String.join(OR, phrases);
        }

        if (!name.hasGivenName()) {
            return AUTHOR + surname + OR + quoted(surname, "*");
        }

        String given = name.givenName();
        if (given.length() == 1) {
            return quoted(surname, given + "*");
        }

        phrases.add(quoted(surname, given));
        phrases.add(quoted(surname, given.substring(0, 1) + separator + "*"));
        phrases.add(quoted(surname, given.substring(0, 1)));
        phrases.add(quoted(surname, given.substring(0, 2) + separator + "*"));
        phrases.add(quoted(surname, given.substring(0, 2)));
        phrases.add(quoted(surname, given + " *"));
        return String.join(OR, phrases);
    }

    private static String quoted(String surname, String rest) {
        return AUTHOR + "\"" + surname + ", " + rest + "\"";
    }
}
