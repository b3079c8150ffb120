package org.lexidex.search.config;

import org.lexidex.core.text.NormalizerConfig;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. {@code INDEX_PATH}, when set,
 * replaces {@code index.path}. Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int maxResults,
    int defaultLimit,
    int suggestLimit,
    Index index,
    NormalizerConfig normalizer
) {
    /** Location of the persisted bundle. */
    public record Index(String path, String filename) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizeIndexPath(properties);
        return from(properties);
    }

    public static SearchConfig from(Properties p) {
        return new SearchConfig(
            requireInt(p, "server.port"),
            requirePositive(p, "search.max.results"),
            requirePositive(p, "search.default.limit"),
            requirePositive(p, "suggest.max.results"),
            new Index(requireString(p, "index.path"), requireString(p, "index.filename")),
            NormalizerConfig.fromProperties(p)
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static void normalizeIndexPath(Properties properties) {
        String indexPath = trimToNull(properties.getProperty("INDEX_PATH"));
        if (indexPath != null) {
            properties.setProperty("index.path", indexPath);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static int requirePositive(Properties properties, String key) {
        int value = requireInt(properties, key);
        if (value <= 0) {
            throw new IllegalStateException("Configuration '" + key + "' must be positive: " + value);
        }
        return value;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
