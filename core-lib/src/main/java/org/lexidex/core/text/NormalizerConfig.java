package org.lexidex.core.text;

import java.util.Collections;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Versioned, immutable configuration of a {@link Normalizer}.
 *
 * <p>Index build and query parsing must use equal configurations; the value is stored with every index bundle and
 * compared on load. Stop words are kept sorted so that equal configurations also serialize identically.</p>
 *
 * <p>Reads these keys from a {@link Properties} source:</p>
 * <ul>
 *   <li>{@code normalizer.stemmer}: {@code porter}, {@code english} or {@code none} (required)</li>
 *   <li>{@code normalizer.stopwords.source}: see {@link StopWords#load(String)} (required)</li>
 *   <li>{@code normalizer.stopwords.extra}: optional comma-separated additions</li>
 *   <li>{@code normalizer.version}: optional, must equal {@link #CURRENT_VERSION}</li>
 * </ul>
 */
public record NormalizerConfig(
        int version,
        StemmerType stemmer,
        Set<String> stopWords
) {
    public static final int CURRENT_VERSION = 1;

    public NormalizerConfig {
        if (version != CURRENT_VERSION) {
            throw new IllegalStateException("Unsupported normalizer version " + version
                    + " (this build supports " + CURRENT_VERSION + ")");
        }
        if (stemmer == null) {
            throw new IllegalStateException("Normalizer stemmer is required");
        }
        TreeSet<String> sorted = new TreeSet<>();
        if (stopWords != null) {
            for (String word : stopWords) {
                if (word == null) {
                    throw new IllegalStateException("Stop word list contains a null entry");
                }
                sorted.add(word.toLowerCase(Locale.ROOT));
            }
        }
        stopWords = Collections.unmodifiableSortedSet(sorted);
    }

    public static NormalizerConfig of(StemmerType stemmer, Set<String> stopWords) {
        return new NormalizerConfig(CURRENT_VERSION, stemmer, stopWords);
    }

    /**
     * Builds a configuration from properties, failing fast with {@link IllegalStateException} on a missing key,
     * an unknown stemmer or an unreadable stop word source.
     */
    public static NormalizerConfig fromProperties(Properties properties) {
        int version = CURRENT_VERSION;
        String versionValue = trimToNull(properties.getProperty("normalizer.version"));
        if (versionValue != null) {
            try {
                version = Integer.parseInt(versionValue);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Invalid integer for configuration 'normalizer.version': '"
                        + versionValue + "'", e);
            }
        }

        StemmerType stemmer = StemmerType.fromName(requireString(properties, "normalizer.stemmer"));
        Set<String> stopWords = StopWords.load(requireString(properties, "normalizer.stopwords.source"));
        stopWords.addAll(StopWords.parseCsv(properties.getProperty("normalizer.stopwords.extra")));

        return new NormalizerConfig(version, stemmer, stopWords);
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
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
