package com.bibsearch.config;

import com.bibsearch.query.legacy.ConversionOptions;

/**
 * Root configuration for query normalization.
 *
 * @param name                 Site name identifier
 * @param version              Configuration version
 * @param extendedAuthorFormat Whether abbreviated author initials carry a trailing period
 */
public record SearchSyntaxConfig(
        String name,
        String version,
        boolean extendedAuthorFormat
) {
    /**
     * Options handed to the legacy converter.
     */
    public ConversionOptions conversionOptions() {
        return new ConversionOptions(extendedAuthorFormat);
    }

    /**
     * Create a minimal configuration for testing.
     */
    public static SearchSyntaxConfig minimal() {
        return new SearchSyntaxConfig("default-site", "1.0", false);
    }
}
