package com.bibsearch.config;

import com.bibsearch.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Set;

/**
 * Loads query syntax configuration from YAML files.
 * <pre>
 * bibsearch:
 *   name: inspire
 *   version: "1.0"
 *   extended-author-format: true
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Set<String> KNOWN_KEYS =
            Set.of("name", "version", "extended-author-format", "extendedAuthorFormat");

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static SearchSyntaxConfig load(String path) {
        log.info("Loading query syntax configuration from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static SearchSyntaxConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }

        Map<String, Object> root = (Map<String, Object>) loaded;
        // the section may sit at the root or under 'bibsearch'
        Object rawSection = root.containsKey("bibsearch") ? root.get("bibsearch") : root;
        if (rawSection == null) {
            throw new ConfigurationException("Section 'bibsearch' is empty");
        }
        if (!(rawSection instanceof Map)) {
            throw new ConfigurationException("Section 'bibsearch' must be a mapping");
        }
        Map<String, Object> section = (Map<String, Object>) rawSection;
        for (Object key : section.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                log.warn("Ignoring unknown configuration key: {}", key);
            }
        }

        String name = getString(section, "name", "default-site");
        String version = getString(section, "version", "1.0");
        boolean extendedAuthorFormat = getBoolean(section,
                "extended-author-format", "extendedAuthorFormat", false);

        SearchSyntaxConfig config = new SearchSyntaxConfig(name, version, extendedAuthorFormat);
        log.info("Loaded query syntax configuration: {} v{}, extended author format: {}",
                name, version, extendedAuthorFormat);
        return config;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, String alternateKey,
                                      boolean defaultValue) {
        Object value = map.containsKey(key) ? map.get(key) : map.get(alternateKey);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        String text = value.toString().trim();
        if (!text.equalsIgnoreCase("true") && !text.equalsIgnoreCase("false")) {
            throw new ConfigurationException("Invalid boolean for '" + key + "': " + text);
        }
        return Boolean.parseBoolean(text);
    }
}
