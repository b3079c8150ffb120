package org.lexidex.indexing.config;

import org.lexidex.core.text.NormalizerConfig;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Typed configuration for the Indexing Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables and finally any command line
 * overrides. {@code CORPUS_PATH} and {@code INDEX_OUTPUT_PATH}, when set, replace {@code corpus.path} and
 * {@code index.output.path}. Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    Corpus corpus,
    Output output,
    NormalizerConfig normalizer
) {
    /** Where the documents come from and how their snippets are cut. */
    public record Corpus(String path, String extension, int snippetLength) {}

    /** Where the bundle is written. */
    public record Output(String path, String filename, boolean prettyPrint) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load() {
        return load(Map.of());
    }

    /**
     * Same as {@link #load()}, with the given property overrides applied last.
     */
    public static IndexingConfig load(Map<String, String> overrides) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizePaths(properties);
        properties.putAll(overrides);
        return from(properties);
    }

    public static IndexingConfig from(Properties p) {
        return new IndexingConfig(
            readCorpus(p),
            readOutput(p),
            NormalizerConfig.fromProperties(p)
        );
    }

    private static Corpus readCorpus(Properties p) {
        int snippetLength = requireInt(p, "corpus.snippet.length");
        if (snippetLength < 0) {
            throw new IllegalStateException("corpus.snippet.length must not be negative: " + snippetLength);
        }
        return new Corpus(
            requireString(p, "corpus.path"),
            requireString(p, "corpus.extension"),
            snippetLength
        );
    }

    private static Output readOutput(Properties p) {
        return new Output(
            requireString(p, "index.output.path"),
            requireString(p, "index.output.filename"),
            Boolean.parseBoolean(trimToNull(p.getProperty("index.output.pretty")))
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = IndexingConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
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

    private static void normalizePaths(Properties properties) {
        String corpus = trimToNull(properties.getProperty("CORPUS_PATH"));
        if (corpus != null) {
            properties.setProperty("corpus.path", corpus);
        }
        String output = trimToNull(properties.getProperty("INDEX_OUTPUT_PATH"));
        if (output != null) {
            properties.setProperty("index.output.path", output);
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

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
