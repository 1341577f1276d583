package com.bibsearch.query.legacy;

/**
 * Site-dependent options of a legacy query conversion.
 *
 * @param extendedAuthorFormat Whether abbreviated author initials carry a trailing period
 */
public record ConversionOptions(boolean extendedAuthorFormat) {

    public static ConversionOptions defaults() {
        return new ConversionOptions(false);
    }
}
