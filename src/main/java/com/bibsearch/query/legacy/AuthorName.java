package com.bibsearch.query.legacy;

/**
 * Author name decomposed from a legacy author search.
 *
 * @param surname    Family name, may be null when the pattern did not capture one
 * @param givenName  Given name or initial, may be null
 * @param middleName Middle name or initial, may be null
 */
public record AuthorName(String surname, String givenName, String middleName) {

    public static AuthorName of(String surname, String givenName) {
        return new AuthorName(surname, givenName, null);
    }

    public boolean hasSurname() {
        return surname != null && !surname.isEmpty();
    }

    public boolean hasGivenName() {
        return givenName != null && !givenName.isEmpty();
    }

    public boolean hasMiddleName() {
        return middleName != null && !middleName.isEmpty();
    }
}
