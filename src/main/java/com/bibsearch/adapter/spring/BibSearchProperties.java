package com.bibsearch.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for query normalization.
 */
@ConfigurationProperties(prefix = "bibsearch")
public class BibSearchProperties {

    /**
     * Whether the query beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the query syntax configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:bibsearch.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
